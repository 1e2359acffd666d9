package com.commutematch.matching.exception;

public class InvalidWeightsException extends MatchingException {

    public InvalidWeightsException(String message) {
        super(message);
    }
}
