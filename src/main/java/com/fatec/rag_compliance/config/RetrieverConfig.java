package com.fatec.rag_compliance.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fatec.rag_compliance.repository.RuleStore;
import com.fatec.rag_compliance.service.expansion.MedicalVocabulary;
import com.fatec.rag_compliance.service.expansion.QueryExpander;
import com.fatec.rag_compliance.service.retrieval.HybridRetriever;
import com.fatec.rag_compliance.service.retrieval.RuleReranker;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

@Configuration
public class RetrieverConfig {

    private static final Logger log = LoggerFactory.getLogger(RetrieverConfig.class);

    /**
     * Worker pool for index builds and query scoring, so callers are never blocked
     * by BM25 or embedding work.
     */
    @Bean(name = "retrieverExecutor")
    public ThreadPoolTaskExecutor retrieverExecutor(RetrievalProperties properties) {
        return threadPool(properties.getExecutor(), "retriever-");
    }

    /**
     * Separate pool for chat model calls. They block for seconds, and must not
     * occupy the threads that score queries and build indexes.
     */
    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor(RetrievalProperties properties) {
        return threadPool(properties.getAnalysisExecutor(), "analysis-");
    }

    private static ThreadPoolTaskExecutor threadPool(RetrievalProperties.Executor pool, String threadNamePrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(pool.getMaxPoolSize());
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.initialize();
        return executor;
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean(name = "retrieverInitializationRetry")
    public RetryTemplate retrieverInitializationRetry(RetrievalProperties properties) {
        return initializationRetry(properties.getInitialization());
    }

    /**
     * Fixed-backoff retry of the whole load-and-build sequence: model and rule
     * loading fail transiently on cold caches and network hiccups.
     */
    public static RetryTemplate initializationRetry(RetrievalProperties.Initialization initialization) {
        int maxAttempts = initialization.getMaxAttempts();
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .fixedBackoff(Math.max(1L, initialization.getBackoff().toMillis()))
                .retryOn(Exception.class)
                .withListener(new RetryListener() {
                    @Override
                    public <T, E extends Throwable> void onError(RetryContext context,
                            RetryCallback<T, E> callback, Throwable throwable) {
                        // retry count already includes this failure
                        if (context.getRetryCount() < maxAttempts) {
                            log.warn("Retrying model/data loading... Attempt #{} failed: {}",
                                    context.getRetryCount(), throwable.getMessage());
                        } else {
                            log.warn("Model/data loading attempt #{} failed, no attempts left: {}",
                                    context.getRetryCount(), throwable.getMessage());
                        }
                    }
                })
                .build();
    }

    @Bean
    public MedicalVocabulary medicalVocabulary(RetrievalProperties properties, ResourceLoader resourceLoader,
            ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(properties.getQueryExpansion().getVocabulary());
        try (InputStream in = resource.getInputStream()) {
            MedicalVocabulary vocabulary = MedicalVocabulary.read(in, objectMapper);
            log.info("Loaded medical vocabulary from {}", resource.getDescription());
            return vocabulary;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load medical vocabulary from " + resource.getDescription(), e);
        }
    }

    @Bean
    public HybridRetriever hybridRetriever(RuleStore ruleStore,
            EmbeddingModel embeddingModel,
            RetrievalProperties properties,
            @Qualifier("retrieverExecutor") ThreadPoolTaskExecutor retrieverExecutor,
            @Qualifier("retrieverInitializationRetry") RetryTemplate retrieverInitializationRetry,
            MedicalVocabulary medicalVocabulary,
            ObjectProvider<ScoringModel> scoringModel) {
        QueryExpander queryExpander = properties.getQueryExpansion().isEnabled()
                ? new QueryExpander(medicalVocabulary)
                : null;

        RuleReranker reranker = null;
        if (properties.getReranker().isEnabled()) {
            ScoringModel model = scoringModel.getIfAvailable();
            if (model != null) {
                reranker = new RuleReranker(model, properties.getReranker().getCandidatePoolSize());
            } else {
                log.warn("Reranker enabled but no ScoringModel bean is available; using fused order.");
            }
        }

        return new HybridRetriever(ruleStore, embeddingModel, properties, retrieverExecutor,
                retrieverInitializationRetry, queryExpander, reranker);
    }
}
