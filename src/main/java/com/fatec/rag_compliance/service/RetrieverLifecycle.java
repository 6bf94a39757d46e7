package com.fatec.rag_compliance.service;

import com.fatec.rag_compliance.service.retrieval.HybridRetriever;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts building the retriever once the application is up, without holding
 * startup back on model loading.
 */
@Component
public class RetrieverLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RetrieverLifecycle.class);

    private final HybridRetriever retriever;

    public RetrieverLifecycle(HybridRetriever retriever) {
        this.retriever = retriever;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        retriever.initialize().thenRun(() -> log.info("Retriever startup finished, ready={}", retriever.isReady()));
    }
}
