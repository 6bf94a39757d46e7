package com.fatec.rag_compliance.exception;

/**
 * The rule store could not be reached or returned malformed data.
 */
public class RuleStoreUnavailableException extends RetrievalException {

    public RuleStoreUnavailableException(String message) {
        super(message);
    }

    public RuleStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
