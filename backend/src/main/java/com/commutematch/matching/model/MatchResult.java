package com.commutematch.matching.model;

import java.time.Instant;
import java.util.List;

public record MatchResult(String forTripId, List<MatchCandidate> candidates, Instant computedAt) {

    public MatchResult {
        candidates = List.copyOf(candidates);
    }

    public static MatchResult empty(String forTripId, Instant computedAt) {
        return new MatchResult(forTripId, List.of(), computedAt);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
