package com.fatec.rag_compliance.exception;

/**
 * The embedding model could not be loaded or invoked, or produced vectors
 * that cannot be indexed together.
 */
public class EmbeddingModelUnavailableException extends RetrievalException {

    public EmbeddingModelUnavailableException(String message) {
        super(message);
    }

    public EmbeddingModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
