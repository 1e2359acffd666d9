package com.commutematch.matching.exception;

/**
 * Base type for failures raised by the matching engine.
 */
public class MatchingException extends RuntimeException {

    public MatchingException(String message) {
        super(message);
    }

    public MatchingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether redelivering the same job may succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}
