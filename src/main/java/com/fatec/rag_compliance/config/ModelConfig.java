package com.fatec.rag_compliance.config;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.bge.small.en.v15.BgeSmallEnV15EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Model selection: without an OpenAI key ("demo") embeddings run locally with
 * BGE small and answers come from Ollama; with a key both go to OpenAI.
 */
@Configuration
public class ModelConfig {

    private static final Logger log = LoggerFactory.getLogger(ModelConfig.class);

    private static boolean useLocalModels(String openAiApiKey) {
        return openAiApiKey == null || openAiApiKey.isBlank() || "demo".equals(openAiApiKey);
    }

    /**
     * BGE (BAAI General Embedding) small, English. Deterministic for a given model
     * version, so repeated queries rank identically.
     */
    @Bean
    public EmbeddingModel embeddingModel(@Value("${langchain4j.open-ai.api-key:demo}") String openAiApiKey,
            @Value("${langchain4j.open-ai.embedding-model:text-embedding-3-small}") String embeddingModelName) {
        if (useLocalModels(openAiApiKey)) {
            log.info("Embedding model: BgeSmallEnV15 (local)");
            return new BgeSmallEnV15EmbeddingModel();
        }
        log.info("Embedding model: OpenAI {}", embeddingModelName);
        return OpenAiEmbeddingModel.builder()
                .apiKey(openAiApiKey)
                .modelName(embeddingModelName)
                .build();
    }

    @Bean
    public ChatLanguageModel chatLanguageModel(@Value("${langchain4j.open-ai.api-key:demo}") String openAiApiKey,
            @Value("${langchain4j.open-ai.chat-model:gpt-4o-mini}") String chatModelName,
            @Value("${ollama.base-url:http://localhost:11434}") String ollamaBaseUrl,
            @Value("${ollama.model.name:llama3}") String ollamaModelName) {
        if (useLocalModels(openAiApiKey)) {
            log.info("Chat model: Ollama {} at {}", ollamaModelName, ollamaBaseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(ollamaBaseUrl)
                    .modelName(ollamaModelName)
                    .temperature(0.0)
                    .build();
        }
        log.info("Chat model: OpenAI {}", chatModelName);
        return OpenAiChatModel.builder()
                .apiKey(openAiApiKey)
                .modelName(chatModelName)
                .temperature(0.0)
                .build();
    }
}
