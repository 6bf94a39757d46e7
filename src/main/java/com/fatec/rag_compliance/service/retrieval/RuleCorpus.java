package com.fatec.rag_compliance.service.retrieval;

import com.fatec.rag_compliance.exception.RuleStoreUnavailableException;
import com.fatec.rag_compliance.model.Rule;
import com.fatec.rag_compliance.repository.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Ordered rules of one snapshot and their indexed texts. Position {@code i} in
 * {@link #getRules()} and {@link #getTexts()} is the document's source index.
 */
public final class RuleCorpus {

    private static final Logger log = LoggerFactory.getLogger(RuleCorpus.class);

    private static final RuleCorpus EMPTY = new RuleCorpus(List.of());

    private final List<Rule> rules;
    private final List<String> texts;

    private RuleCorpus(List<Rule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        List<String> corpusTexts = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            corpusTexts.add(rule.toCorpusText());
        }
        this.texts = Collections.unmodifiableList(corpusTexts);
    }

    public static RuleCorpus empty() {
        return EMPTY;
    }

    /**
     * @throws RuleStoreUnavailableException on null entries or duplicate ids
     */
    public static RuleCorpus of(List<Rule> rules) {
        if (rules == null || rules.isEmpty()) {
            return EMPTY;
        }
        Set<Long> ids = new HashSet<>();
        for (Rule rule : rules) {
            if (rule == null) {
                throw new RuleStoreUnavailableException("Rule store returned a null rule");
            }
            if (!ids.add(rule.getId())) {
                throw new RuleStoreUnavailableException("Rule store returned duplicate rule id " + rule.getId());
            }
        }
        return new RuleCorpus(rules);
    }

    /**
     * Loads up to {@code limit} rules. A store failure yields the empty corpus;
     * it is logged, not thrown.
     */
    public static RuleCorpus load(RuleStore store, int limit) {
        try {
            RuleCorpus corpus = of(store.fetchRules(limit));
            log.info("Loaded {} rules into the corpus", corpus.size());
            return corpus;
        } catch (RuleStoreUnavailableException e) {
            log.warn("Rule store unavailable, continuing with no rules: {}", e.getMessage());
            return EMPTY;
        }
    }

    public List<Rule> getRules() {
        return rules;
    }

    public List<String> getTexts() {
        return texts;
    }

    public Rule getRule(int sourceIndex) {
        return rules.get(sourceIndex);
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /**
     * Source indexes of all documents, or of those whose category equals
     * {@code category} exactly when it is not {@code null}.
     */
    public int[] candidates(String category) {
        if (category == null) {
            int[] all = new int[rules.size()];
            for (int i = 0; i < all.length; i++) {
                all[i] = i;
            }
            return all;
        }
        return IntStream.range(0, rules.size())
                .filter(i -> category.equals(rules.get(i).getCategory()))
                .toArray();
    }
}
