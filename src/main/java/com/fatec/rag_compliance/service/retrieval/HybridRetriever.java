package com.fatec.rag_compliance.service.retrieval;

import com.fatec.rag_compliance.config.RetrievalProperties;
import com.fatec.rag_compliance.exception.InvalidQueryException;
import com.fatec.rag_compliance.model.RetrievalRequest;
import com.fatec.rag_compliance.model.RetrieverState;
import com.fatec.rag_compliance.model.Rule;
import com.fatec.rag_compliance.repository.RuleStore;
import com.fatec.rag_compliance.service.expansion.QueryExpander;
import dev.langchain4j.model.embedding.EmbeddingModel;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hybrid search over the compliance rules: BM25 keyword ranking and embedding
 * cosine ranking, merged with Reciprocal Rank Fusion.
 * <p>
 * One instance is shared by the whole application. {@link #initialize()} loads
 * the rules and builds both indexes once; afterwards any number of
 * {@link #retrieve} calls may run concurrently against the published snapshot.
 * Scoring always runs on the retriever executor, never on the calling thread.
 * <p>
 * {@link #reinitialize()} builds a new snapshot and swaps it in with a single
 * reference write. A retrieval that already started keeps the snapshot it read;
 * later retrievals see the new one.
 */
public class HybridRetriever {

    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

    private final RuleStore ruleStore;
    private final EmbeddingModel embeddingModel;
    private final RetrievalProperties properties;
    private final Executor executor;
    private final RetryTemplate initializationRetry;
    private final FusionRanker fusionRanker;
    private final QueryExpander queryExpander;
    private final RuleReranker reranker;

    private final Object lock = new Object();
    private volatile RetrieverSnapshot snapshot = RetrieverSnapshot.empty();
    private volatile RetrieverState state = RetrieverState.UNINITIALIZED;
    // guarded by lock
    private CompletableFuture<Void> pending;

    /**
     * @param queryExpander optional, {@code null} disables query expansion
     * @param reranker optional, {@code null} disables the second pass
     */
    public HybridRetriever(RuleStore ruleStore,
            EmbeddingModel embeddingModel,
            RetrievalProperties properties,
            Executor executor,
            RetryTemplate initializationRetry,
            QueryExpander queryExpander,
            RuleReranker reranker) {
        this.ruleStore = ruleStore;
        this.embeddingModel = embeddingModel;
        this.properties = properties;
        this.executor = executor;
        this.initializationRetry = initializationRetry;
        this.queryExpander = queryExpander;
        this.reranker = reranker;

        Map<RetrievalSignal, Double> weights = new EnumMap<>(RetrievalSignal.class);
        weights.put(RetrievalSignal.LEXICAL, properties.getLexicalWeight());
        weights.put(RetrievalSignal.DENSE, properties.getDenseWeight());
        this.fusionRanker = new FusionRanker(properties.getRrfK(), weights);

        log.info("HybridRetriever created (rrfK={}, queryExpansion={}, reranker={}). Call initialize() to load rules.",
                properties.getRrfK(), queryExpander != null, reranker != null);
    }

    /**
     * Loads the rules and builds both indexes, retrying failed attempts with a
     * fixed backoff. Idempotent: once ready it returns a completed future, and
     * while a build is running every caller receives that same future.
     * <p>
     * The future never completes exceptionally. When all attempts fail the
     * retriever stays uninitialized with no rules; check {@link #isReady()}.
     */
    public CompletableFuture<Void> initialize() {
        synchronized (lock) {
            if (state == RetrieverState.READY) {
                log.info("HybridRetriever is already initialized.");
                return CompletableFuture.completedFuture(null);
            }
            if (pending != null) {
                return pending;
            }
            state = RetrieverState.INITIALIZING;
            return track(startBuild());
        }
    }

    /**
     * Rebuilds the snapshot from the rule store and swaps it in. While the
     * rebuild runs, a ready retriever keeps serving the previous snapshot, and
     * keeps it if the rebuild fails.
     */
    public CompletableFuture<Void> reinitialize() {
        synchronized (lock) {
            if (pending != null) {
                return pending;
            }
            if (state != RetrieverState.READY) {
                state = RetrieverState.INITIALIZING;
            }
            return track(startBuild());
        }
    }

    // Called with the lock held, so a running build cannot settle before it is tracked.
    private CompletableFuture<Void> track(CompletableFuture<Void> build) {
        if (!build.isDone()) {
            pending = build;
        }
        return build;
    }

    public boolean isReady() {
        return state == RetrieverState.READY;
    }

    public RetrieverState getState() {
        return state;
    }

    public CompletableFuture<List<Rule>> retrieve(String query) {
        return retrieve(query, properties.getDefaultTopK(), null);
    }

    public CompletableFuture<List<Rule>> retrieve(String query, int topK, String categoryFilter) {
        return retrieve(RetrievalRequest.of(query, topK, categoryFilter));
    }

    /**
     * Ranks the rules for a query, best first, at most {@code topK} of them.
     * Returns an empty list, without waiting, when the retriever is not ready or
     * no rule carries the requested category.
     *
     * @throws InvalidQueryException if the query is blank or topK is negative
     */
    public CompletableFuture<List<Rule>> retrieve(RetrievalRequest request) {
        validate(request);

        if (state != RetrieverState.READY) {
            log.warn("Retriever is not initialized (state={}). Returning empty list.", state);
            return CompletableFuture.completedFuture(List.of());
        }
        RetrieverSnapshot current = snapshot;
        if (request.getTopK() == 0 || current.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        int[] candidates = current.corpus().candidates(request.getCategoryFilter());
        if (candidates.length == 0) {
            log.info("No rules found for category: {}", request.getCategoryFilter());
            return CompletableFuture.completedFuture(List.of());
        }

        try {
            return CompletableFuture.supplyAsync(() -> search(current, request, candidates), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Retriever executor rejected the search, returning empty list: {}", e.getMessage());
            return CompletableFuture.completedFuture(List.of());
        }
    }

    private static void validate(RetrievalRequest request) {
        if (request == null || request.getQuery() == null || request.getQuery().isBlank()) {
            throw new InvalidQueryException("Query must be a non-empty string");
        }
        if (request.getTopK() < 0) {
            throw new InvalidQueryException("topK must not be negative, was " + request.getTopK());
        }
    }

    private List<Rule> search(RetrieverSnapshot current, RetrievalRequest request, int[] candidates) {
        String query = expandQuery(request);
        Map<RetrievalSignal, Map<Integer, Integer>> rankings = new EnumMap<>(RetrievalSignal.class);

        try {
            double[] lexicalScores = current.lexicalIndex().score(LexicalIndex.tokenize(query), candidates);
            rankings.put(RetrievalSignal.LEXICAL, FusionRanker.rank(candidates, lexicalScores));
        } catch (RuntimeException e) {
            log.warn("BM25 scoring failed, continuing with dense ranking only: {}", e.getMessage());
        }

        try {
            float[] queryEmbedding = DenseIndex.embedQuery(query, embeddingModel);
            double[] denseScores = current.denseIndex().score(queryEmbedding, candidates);
            rankings.put(RetrievalSignal.DENSE, FusionRanker.rank(candidates, denseScores));
        } catch (RuntimeException e) {
            log.warn("Dense scoring failed, continuing with BM25 ranking only: {}", e.getMessage());
        }

        if (rankings.isEmpty()) {
            return List.of();
        }

        List<Integer> ranked = fusionRanker.fuse(rankings);
        if (reranker != null) {
            ranked = reranker.rerank(request.getQuery(), ranked, current.corpus().getTexts());
        }

        int limit = Math.min(request.getTopK(), ranked.size());
        List<Rule> results = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            results.add(current.corpus().getRule(ranked.get(i)));
        }
        log.debug("Retrieved {} of {} candidate rules for query '{}'", results.size(), candidates.length, query);
        return results;
    }

    private String expandQuery(RetrievalRequest request) {
        if (queryExpander == null) {
            return request.getQuery();
        }
        try {
            return queryExpander
                    .expand(request.getQuery(), request.getDiscipline(), request.getDocumentType(),
                            request.getContextEntities())
                    .toQuery(properties.getQueryExpansion().getMaxTerms());
        } catch (RuntimeException e) {
            log.warn("Query expansion failed, using original query: {}", e.getMessage());
            return request.getQuery();
        }
    }

    private CompletableFuture<Void> startBuild() {
        try {
            return CompletableFuture.runAsync(this::buildAndPublish, executor);
        } catch (RejectedExecutionException e) {
            log.error("Retriever executor rejected initialization: {}", e.getMessage());
            settle(null);
            return CompletableFuture.completedFuture(null);
        }
    }

    private void buildAndPublish() {
        RetrieverSnapshot built = null;
        try {
            built = initializationRetry.execute(context -> buildSnapshot(context.getRetryCount() + 1));
        } catch (RuntimeException e) {
            log.error("HybridRetriever initialization failed after {} attempts. Retriever will return no rules.",
                    properties.getInitialization().getMaxAttempts(), e);
        }
        settle(built);
    }

    // The replaced snapshot may still be read by in-flight searches; its heap-backed index is left to GC.
    private void settle(RetrieverSnapshot built) {
        synchronized (lock) {
            if (built != null) {
                snapshot = built;
                state = RetrieverState.READY;
                log.info("HybridRetriever initialized with {} rules.", built.corpus().size());
            } else if (state != RetrieverState.READY) {
                snapshot = RetrieverSnapshot.empty();
                state = RetrieverState.UNINITIALIZED;
            }
            pending = null;
        }
    }

    private RetrieverSnapshot buildSnapshot(int attempt) {
        log.info("Initializing HybridRetriever (attempt {})...", attempt);
        RuleCorpus corpus = RuleCorpus.load(ruleStore, properties.getRuleLimit());
        if (corpus.isEmpty()) {
            log.warn("No rules loaded from the rule store. Retriever will be non-functional.");
            return RetrieverSnapshot.empty();
        }

        LexicalIndex lexicalIndex = LexicalIndex.build(corpus.getTexts(), properties.getBm25K1(), properties.getBm25B());
        try {
            log.info("Encoding corpus of {} rules...", corpus.size());
            DenseIndex denseIndex = DenseIndex.build(corpus.getTexts(), embeddingModel,
                    properties.getEmbeddingBatchSize());
            return new RetrieverSnapshot(corpus, lexicalIndex, denseIndex);
        } catch (RuntimeException e) {
            lexicalIndex.close();
            throw e;
        }
    }

    @PreDestroy
    public void close() {
        synchronized (lock) {
            snapshot.close();
            snapshot = RetrieverSnapshot.empty();
            state = RetrieverState.UNINITIALIZED;
        }
    }
}
