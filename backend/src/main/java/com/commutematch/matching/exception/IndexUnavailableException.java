package com.commutematch.matching.exception;

/**
 * The spatial index could not be reached, or none of the sample queries answered in time.
 */
public class IndexUnavailableException extends MatchingException {

    public IndexUnavailableException(String message) {
        super(message);
    }

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
