package com.fatec.rag_compliance.service.retrieval;

import com.fatec.rag_compliance.exception.RuleStoreUnavailableException;
import com.fatec.rag_compliance.model.Rule;
import com.fatec.rag_compliance.support.InMemoryRuleStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fatec.rag_compliance.support.ComplianceRules.BILLING_CODE;
import static com.fatec.rag_compliance.support.ComplianceRules.GOAL_SPECIFICITY;
import static com.fatec.rag_compliance.support.ComplianceRules.SIGNATURE_MISSING;
import static org.junit.jupiter.api.Assertions.*;

public class RuleCorpusTest {

    @Test
    void keepsStoreOrderAndIndexesNameWithContent() {
        RuleCorpus corpus = RuleCorpus.of(List.of(GOAL_SPECIFICITY, SIGNATURE_MISSING, BILLING_CODE));

        assertEquals(3, corpus.size());
        assertEquals(SIGNATURE_MISSING, corpus.getRule(1));
        assertEquals("Billing Code. Use correct CPT codes.", corpus.getTexts().get(2));
    }

    @Test
    void candidatesMatchCategoryExactly() {
        RuleCorpus corpus = RuleCorpus.of(List.of(GOAL_SPECIFICITY, SIGNATURE_MISSING, BILLING_CODE));

        assertArrayEquals(new int[] {0, 1, 2}, corpus.candidates(null));
        assertArrayEquals(new int[] {2}, corpus.candidates("Billing"));
        assertArrayEquals(new int[0], corpus.candidates("billing"));
        assertArrayEquals(new int[0], corpus.candidates("Nonexistent"));
    }

    @Test
    void ruleWithoutCategoryOnlyMatchesUnfiltered() {
        RuleCorpus corpus = RuleCorpus.of(List.of(new Rule(9, "General", "Be accurate.", null)));

        assertArrayEquals(new int[] {0}, corpus.candidates(null));
        assertArrayEquals(new int[0], corpus.candidates("PT"));
    }

    @Test
    void duplicateIdsAreRejected() {
        Rule clash = new Rule(1, "Other", "Other content.", "OT");

        assertThrows(RuleStoreUnavailableException.class, () -> RuleCorpus.of(List.of(GOAL_SPECIFICITY, clash)));
        assertTrue(RuleCorpus.load(InMemoryRuleStore.of(GOAL_SPECIFICITY, clash), 10).isEmpty());
    }

    @Test
    void unavailableStoreLoadsEmptyCorpus() {
        InMemoryRuleStore store = InMemoryRuleStore.of(GOAL_SPECIFICITY);
        store.setUnavailable(true);

        assertSame(RuleCorpus.empty(), RuleCorpus.load(store, 10));
    }

    @Test
    void loadHonoursLimit() {
        InMemoryRuleStore store = InMemoryRuleStore.of(GOAL_SPECIFICITY, SIGNATURE_MISSING, BILLING_CODE);

        assertEquals(2, RuleCorpus.load(store, 2).size());
    }
}
