package com.commutematch.matching.exception;

import com.commutematch.matching.model.Coordinate;

public class InvalidGeometryException extends MatchingException {

    public InvalidGeometryException(String message) {
        super(message);
    }

    public static InvalidGeometryException outOfRange(Coordinate coordinate, int position) {
        return new InvalidGeometryException(
                "Coordinate out of range at position " + position + ": " + coordinate);
    }
}
