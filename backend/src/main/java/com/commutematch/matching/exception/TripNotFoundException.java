package com.commutematch.matching.exception;

public class TripNotFoundException extends MatchingException {

    private final String tripId;

    public TripNotFoundException(String tripId) {
        super("Trip not found: " + tripId);
        this.tripId = tripId;
    }

    public String getTripId() {
        return tripId;
    }
}
