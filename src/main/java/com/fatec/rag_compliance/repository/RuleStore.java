package com.fatec.rag_compliance.repository;

import com.fatec.rag_compliance.exception.RuleStoreUnavailableException;
import com.fatec.rag_compliance.model.Rule;

import java.util.List;

/**
 * Source of compliance rules. Implementations return rules in a stable order.
 */
public interface RuleStore {

    /**
     * @param limit maximum number of rules to return
     * @return rules ordered by id, never {@code null}
     * @throws RuleStoreUnavailableException if the store cannot be read
     */
    List<Rule> fetchRules(int limit);
}
