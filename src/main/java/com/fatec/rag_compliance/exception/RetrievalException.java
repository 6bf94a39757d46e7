package com.fatec.rag_compliance.exception;

/**
 * Base type for failures raised while building or querying the rule retriever.
 */
public class RetrievalException extends RuntimeException {

    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
