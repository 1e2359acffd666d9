package com.commutematch.matching.model;

public enum TripStatus {
    ACTIVE, MATCHED, EXPIRED, CANCELLED;

    /**
     * Lifecycle edges: ACTIVE to MATCHED or EXPIRED, ACTIVE or MATCHED to CANCELLED.
     */
    public boolean canTransitionTo(TripStatus next) {
        switch (this) {
            case ACTIVE:
                return next == MATCHED || next == EXPIRED || next == CANCELLED;
            case MATCHED:
                return next == CANCELLED;
            default:
                return false;
        }
    }
}
