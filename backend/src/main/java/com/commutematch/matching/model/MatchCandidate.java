package com.commutematch.matching.model;

import java.time.Duration;

/**
 * A scored candidate trip. Component metrics are kept for explainability.
 *
 * @param tripId          the candidate trip
 * @param score           composite score in [0,1]
 * @param overlapFraction share of the querying trip's samples near the candidate's route
 * @param startProximity  origin closeness in [0,1]
 * @param endProximity    destination closeness in [0,1]
 * @param timeProximity   departure closeness in [0,1]
 * @param timeDelta       absolute difference between departure times
 */
public record MatchCandidate(
        String tripId,
        double score,
        double overlapFraction,
        double startProximity,
        double endProximity,
        double timeProximity,
        Duration timeDelta
) {
}
