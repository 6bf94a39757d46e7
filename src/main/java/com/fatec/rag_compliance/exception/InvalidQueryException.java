package com.fatec.rag_compliance.exception;

/**
 * Caller contract violation on {@code retrieve}: blank query or negative result count.
 */
public class InvalidQueryException extends IllegalArgumentException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
