package com.fatec.rag_compliance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning knobs of the hybrid retriever, bound from {@code compliance.retrieval.*}.
 */
@ConfigurationProperties(prefix = "compliance.retrieval")
public class RetrievalProperties {

    /** Maximum number of rules pulled from the rule store per snapshot. */
    private int ruleLimit = 1000;

    private int defaultTopK = 5;

    /** Reciprocal Rank Fusion dampening constant. */
    private double rrfK = 60.0;

    private double lexicalWeight = 1.0;

    private double denseWeight = 1.0;

    private float bm25K1 = 1.5f;

    private float bm25B = 0.75f;

    private int embeddingBatchSize = 64;

    private final Initialization initialization = new Initialization();

    private final Executor executor = new Executor();

    /** Pool for chat model calls of the analysis service. */
    private final Executor analysisExecutor = new Executor();

    private final QueryExpansion queryExpansion = new QueryExpansion();

    private final Reranker reranker = new Reranker();

    public int getRuleLimit() {
        return ruleLimit;
    }

    public void setRuleLimit(int ruleLimit) {
        this.ruleLimit = ruleLimit;
    }

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }

    public double getRrfK() {
        return rrfK;
    }

    public void setRrfK(double rrfK) {
        this.rrfK = rrfK;
    }

    public double getLexicalWeight() {
        return lexicalWeight;
    }

    public void setLexicalWeight(double lexicalWeight) {
        this.lexicalWeight = lexicalWeight;
    }

    public double getDenseWeight() {
        return denseWeight;
    }

    public void setDenseWeight(double denseWeight) {
        this.denseWeight = denseWeight;
    }

    public float getBm25K1() {
        return bm25K1;
    }

    public void setBm25K1(float bm25K1) {
        this.bm25K1 = bm25K1;
    }

    public float getBm25B() {
        return bm25B;
    }

    public void setBm25B(float bm25B) {
        this.bm25B = bm25B;
    }

    public int getEmbeddingBatchSize() {
        return embeddingBatchSize;
    }

    public void setEmbeddingBatchSize(int embeddingBatchSize) {
        this.embeddingBatchSize = embeddingBatchSize;
    }

    public Initialization getInitialization() {
        return initialization;
    }

    public Executor getExecutor() {
        return executor;
    }

    public Executor getAnalysisExecutor() {
        return analysisExecutor;
    }

    public QueryExpansion getQueryExpansion() {
        return queryExpansion;
    }

    public Reranker getReranker() {
        return reranker;
    }

    public static class Initialization {
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofSeconds(2);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }
    }

    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 100;

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    public static class QueryExpansion {
        private boolean enabled = true;
        private int maxTerms = 8;
        private String vocabulary = "classpath:medical-vocabulary.json";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxTerms() {
            return maxTerms;
        }

        public void setMaxTerms(int maxTerms) {
            this.maxTerms = maxTerms;
        }

        public String getVocabulary() {
            return vocabulary;
        }

        public void setVocabulary(String vocabulary) {
            this.vocabulary = vocabulary;
        }
    }

    public static class Reranker {
        private boolean enabled = false;
        private int candidatePoolSize = 20;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCandidatePoolSize() {
            return candidatePoolSize;
        }

        public void setCandidatePoolSize(int candidatePoolSize) {
            this.candidatePoolSize = candidatePoolSize;
        }
    }
}
