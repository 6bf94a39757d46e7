package com.fatec.rag_compliance.service.retrieval;

import com.fatec.rag_compliance.config.RetrievalProperties;
import com.fatec.rag_compliance.config.RetrieverConfig;
import com.fatec.rag_compliance.exception.InvalidQueryException;
import com.fatec.rag_compliance.model.RetrievalRequest;
import com.fatec.rag_compliance.model.RetrieverState;
import com.fatec.rag_compliance.model.Rule;
import com.fatec.rag_compliance.repository.RuleStore;
import com.fatec.rag_compliance.support.FlakyEmbeddingModel;
import com.fatec.rag_compliance.support.InMemoryRuleStore;
import com.fatec.rag_compliance.support.QueuedExecutor;
import com.fatec.rag_compliance.support.VocabularyEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static com.fatec.rag_compliance.support.ComplianceRules.BILLING_CODE;
import static com.fatec.rag_compliance.support.ComplianceRules.GOAL_SPECIFICITY;
import static com.fatec.rag_compliance.support.ComplianceRules.SIGNATURE_MISSING;
import static com.fatec.rag_compliance.support.ComplianceRules.TREATMENT_MINUTES;
import static com.fatec.rag_compliance.support.ComplianceRules.embeddingModel;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class HybridRetrieverTest {

    private static final Executor DIRECT = Runnable::run;

    private RetrievalProperties properties;
    private InMemoryRuleStore store;

    @BeforeEach
    void setUp() {
        properties = new RetrievalProperties();
        properties.getInitialization().setBackoff(Duration.ofMillis(10));
        store = InMemoryRuleStore.of(GOAL_SPECIFICITY, SIGNATURE_MISSING, BILLING_CODE);
    }

    private HybridRetriever retriever(RuleStore ruleStore, EmbeddingModel model, Executor executor) {
        return new HybridRetriever(ruleStore, model, properties, executor,
                RetrieverConfig.initializationRetry(properties.getInitialization()), null, null);
    }

    private HybridRetriever readyRetriever() {
        HybridRetriever retriever = retriever(store, embeddingModel(), DIRECT);
        retriever.initialize().join();
        assertTrue(retriever.isReady());
        return retriever;
    }

    @Test
    void rulesSharingQueryTermsRankAboveUnrelatedRule() {
        HybridRetriever retriever = readyRetriever();

        List<Rule> results = retriever.retrieve("signed patient goals", 2, null).join();

        assertEquals(List.of(GOAL_SPECIFICITY, SIGNATURE_MISSING), results);
    }

    @Test
    void categoryFilterReturnsOnlyThatCategory() {
        HybridRetriever retriever = readyRetriever();

        assertEquals(List.of(BILLING_CODE), retriever.retrieve("signed patient goals", 5, "Billing").join());
    }

    @Test
    void unknownCategoryReturnsEmpty() {
        HybridRetriever retriever = readyRetriever();

        assertTrue(retriever.retrieve("signed patient goals", 5, "Nonexistent").join().isEmpty());
    }

    @Test
    void emptyRuleStoreLeavesRetrieverReadyWithNoRules() {
        HybridRetriever retriever = retriever(InMemoryRuleStore.of(), embeddingModel(), DIRECT);
        retriever.initialize().join();

        assertTrue(retriever.isReady());
        assertTrue(retriever.retrieve("anything", 5, null).join().isEmpty());
        assertTrue(retriever.retrieve("anything", 5, "PT").join().isEmpty());
    }

    @Test
    void zeroTopKReturnsEmpty() {
        HybridRetriever retriever = readyRetriever();

        assertTrue(retriever.retrieve("signed patient goals", 0, null).join().isEmpty());
    }

    @Test
    void resultCountIsBoundedByTopKAndCandidates() {
        HybridRetriever retriever = readyRetriever();

        for (int k = 0; k <= 5; k++) {
            assertEquals(Math.min(k, 3), retriever.retrieve("cpt codes", k, null).join().size());
            assertEquals(Math.min(k, 2), retriever.retrieve("cpt codes", k, "PT").join().size());
        }
    }

    @Test
    void filteredResultsAllCarryTheCategory() {
        HybridRetriever retriever = readyRetriever();

        List<Rule> results = retriever.retrieve("use correct cpt codes", 5, "PT").join();

        assertFalse(results.isEmpty());
        results.forEach(rule -> assertEquals("PT", rule.getCategory()));
    }

    @Test
    void repeatedQueriesRankIdentically() {
        HybridRetriever retriever = readyRetriever();

        List<Rule> first = retriever.retrieve("measurable goals for billing", 3, null).join();
        List<Rule> second = retriever.retrieve("measurable goals for billing", 3, null).join();

        assertEquals(first, second);
    }

    @Test
    void zeroEmbeddingsFallBackToLexicalOrder() {
        HybridRetriever retriever = retriever(store, new VocabularyEmbeddingModel("unrelated"), DIRECT);
        retriever.initialize().join();

        List<Rule> results = retriever.retrieve("cpt", 3, null).join();

        assertEquals(List.of(BILLING_CODE, GOAL_SPECIFICITY, SIGNATURE_MISSING), results);
    }

    @Test
    void queryEmbeddingFailureDropsOnlyTheDenseSignal() {
        EmbeddingModel corpusOnly = mock(EmbeddingModel.class);
        VocabularyEmbeddingModel delegate = embeddingModel();
        when(corpusOnly.embedAll(anyList())).thenAnswer(invocation -> delegate.embedAll(invocation.getArgument(0)));
        when(corpusOnly.embed(anyString())).thenThrow(new IllegalStateException("model evicted"));
        HybridRetriever retriever = retriever(store, corpusOnly, DIRECT);
        retriever.initialize().join();

        List<Rule> results = retriever.retrieve("cpt", 1, null).join();

        assertEquals(List.of(BILLING_CODE), results);
    }

    @Test
    void invalidQueriesFailFast() {
        HybridRetriever retriever = readyRetriever();

        assertThrows(InvalidQueryException.class, () -> retriever.retrieve(null, 5, null));
        assertThrows(InvalidQueryException.class, () -> retriever.retrieve("", 5, null));
        assertThrows(InvalidQueryException.class, () -> retriever.retrieve("   ", 5, null));
        assertThrows(InvalidQueryException.class, () -> retriever.retrieve("goals", -1, null));
        assertThrows(InvalidQueryException.class, () -> retriever.retrieve((RetrievalRequest) null));
    }

    @Test
    void queriesAreValidatedEvenBeforeInitialization() {
        HybridRetriever retriever = retriever(store, embeddingModel(), DIRECT);

        assertThrows(InvalidQueryException.class, () -> retriever.retrieve(" ", 5, null));
    }

    @Test
    void uninitializedRetrieverReturnsEmpty() {
        HybridRetriever retriever = retriever(store, embeddingModel(), DIRECT);

        assertEquals(RetrieverState.UNINITIALIZED, retriever.getState());
        assertFalse(retriever.isReady());
        assertTrue(retriever.retrieve("signed patient goals").join().isEmpty());
    }

    @Test
    void defaultTopKComesFromProperties() {
        properties.setDefaultTopK(1);
        HybridRetriever retriever = readyRetriever();

        assertEquals(1, retriever.retrieve("signed patient goals").join().size());
    }

    @Test
    void initializeIsIdempotentOnceReady() {
        VocabularyEmbeddingModel model = embeddingModel();
        HybridRetriever retriever = retriever(store, model, DIRECT);
        retriever.initialize().join();

        CompletableFuture<Void> again = retriever.initialize();

        assertTrue(again.isDone());
        assertEquals(1, store.fetches());
        assertEquals(1, model.embedAllCalls());
    }

    @Test
    void concurrentInitializeCallsShareOneBuild() {
        QueuedExecutor executor = new QueuedExecutor();
        HybridRetriever retriever = retriever(store, embeddingModel(), executor);

        CompletableFuture<Void> first = retriever.initialize();
        CompletableFuture<Void> second = retriever.initialize();

        assertSame(first, second);
        assertEquals(1, executor.pending());
        assertEquals(RetrieverState.INITIALIZING, retriever.getState());
        assertTrue(retriever.retrieve("goals", 5, null).join().isEmpty());

        executor.runAll();

        assertTrue(first.isDone());
        assertTrue(retriever.isReady());
        assertEquals(1, store.fetches());
    }

    @Test
    void transientEmbeddingFailuresAreRetried() {
        FlakyEmbeddingModel model = new FlakyEmbeddingModel(embeddingModel(), 2);
        HybridRetriever retriever = retriever(store, model, DIRECT);

        retriever.initialize().join();

        assertTrue(retriever.isReady());
        assertEquals(3, store.fetches());
        assertFalse(retriever.retrieve("cpt codes", 1, null).join().isEmpty());
    }

    @Test
    void exhaustedRetriesLeaveRetrieverUninitialized() {
        FlakyEmbeddingModel model = new FlakyEmbeddingModel(embeddingModel(), Integer.MAX_VALUE);
        HybridRetriever retriever = retriever(store, model, DIRECT);

        CompletableFuture<Void> init = retriever.initialize();

        assertDoesNotThrow(init::join);
        assertEquals(RetrieverState.UNINITIALIZED, retriever.getState());
        assertEquals(3, model.calls());
        assertTrue(retriever.retrieve("cpt codes", 3, null).join().isEmpty());
    }

    @Test
    void failedInitializationCanBeRetriedLater() {
        FlakyEmbeddingModel model = new FlakyEmbeddingModel(embeddingModel(), 3);
        HybridRetriever retriever = retriever(store, model, DIRECT);

        retriever.initialize().join();
        assertFalse(retriever.isReady());

        retriever.initialize().join();
        assertTrue(retriever.isReady());
    }

    @Test
    void unavailableRuleStoreYieldsReadyRetrieverWithoutRules() {
        store.setUnavailable(true);
        HybridRetriever retriever = retriever(store, embeddingModel(), DIRECT);

        retriever.initialize().join();

        assertTrue(retriever.isReady());
        assertTrue(retriever.retrieve("goals", 5, null).join().isEmpty());
    }

    @Test
    void rejectedInitializationSettlesUninitialized() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("pool shut down");
        };
        HybridRetriever retriever = retriever(store, embeddingModel(), rejecting);

        CompletableFuture<Void> init = retriever.initialize();

        assertTrue(init.isDone());
        assertEquals(RetrieverState.UNINITIALIZED, retriever.getState());
    }

    @Test
    void reinitializePicksUpNewRules() {
        HybridRetriever retriever = readyRetriever();
        store.add(TREATMENT_MINUTES);

        retriever.reinitialize().join();

        List<Rule> results = retriever.retrieve("minutes billed units", 4, null).join();
        assertEquals(4, results.size());
        assertEquals(TREATMENT_MINUTES, results.get(0));
    }

    @Test
    void searchInFlightKeepsTheSnapshotItStartedWith() {
        QueuedExecutor executor = new QueuedExecutor();
        HybridRetriever retriever = retriever(store, embeddingModel(), executor);
        retriever.initialize();
        executor.runAll();

        CompletableFuture<List<Rule>> inFlight = retriever.retrieve("minutes billed units", 10, null);
        store.add(TREATMENT_MINUTES);
        CompletableFuture<Void> rebuild = retriever.reinitialize();
        assertTrue(retriever.isReady());

        executor.runLast();
        assertTrue(rebuild.isDone());
        executor.runFirst();

        List<Rule> old = inFlight.join();
        assertEquals(3, old.size());
        assertFalse(old.contains(TREATMENT_MINUTES));

        CompletableFuture<List<Rule>> after = retriever.retrieve("minutes billed units", 10, null);
        executor.runAll();
        assertEquals(4, after.join().size());
        assertEquals(TREATMENT_MINUTES, after.join().get(0));
    }

    @Test
    void failedReinitializationKeepsServingPreviousRules() {
        EmbeddingModel failingAfterFirstBuild = mock(EmbeddingModel.class);
        VocabularyEmbeddingModel delegate = embeddingModel();
        when(failingAfterFirstBuild.embedAll(anyList()))
                .thenAnswer(invocation -> delegate.embedAll(invocation.getArgument(0)))
                .thenThrow(new IllegalStateException("model unloaded"));
        InMemoryRuleStore fresh = InMemoryRuleStore.of(GOAL_SPECIFICITY, SIGNATURE_MISSING, BILLING_CODE);
        HybridRetriever reloading = retriever(fresh, failingAfterFirstBuild, DIRECT);
        reloading.initialize().join();
        fresh.add(TREATMENT_MINUTES);

        reloading.reinitialize().join();

        assertTrue(reloading.isReady());
        List<Rule> results = reloading.retrieve("minutes billed units", 10, null).join();
        assertEquals(3, results.size());
        assertFalse(results.contains(TREATMENT_MINUTES));
    }

    @Test
    void rerankerReordersFusedResults() {
        ScoringModel scoringModel = mock(ScoringModel.class);
        when(scoringModel.scoreAll(anyList(), anyString())).thenReturn(Response.from(List.of(0.1, 0.2, 0.9)));
        HybridRetriever retriever = new HybridRetriever(store, embeddingModel(), properties, DIRECT,
                RetrieverConfig.initializationRetry(properties.getInitialization()), null,
                new RuleReranker(scoringModel, 20));
        retriever.initialize().join();

        List<Rule> results = retriever.retrieve("signed patient goals", 3, null).join();

        assertEquals(BILLING_CODE, results.get(0));
    }

    @Test
    void closeReturnsRetrieverToUninitialized() {
        HybridRetriever retriever = readyRetriever();

        retriever.close();

        assertFalse(retriever.isReady());
        assertTrue(retriever.retrieve("goals", 5, null).join().isEmpty());
    }
}
