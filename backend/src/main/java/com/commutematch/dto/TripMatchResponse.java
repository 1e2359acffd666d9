package com.commutematch.dto;

import com.commutematch.entity.MatchedTrip;
import com.commutematch.entity.TripMatch;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

public class TripMatchResponse {
    private final String forTripId;
    private final List<Candidate> candidates;
    private final Instant computedAt;

    public TripMatchResponse(String forTripId, List<Candidate> candidates, Instant computedAt) {
        this.forTripId = forTripId;
        this.candidates = candidates;
        this.computedAt = computedAt;
    }

    public static TripMatchResponse from(TripMatch match) {
        List<Candidate> candidates = match.getCandidates().stream()
                .map(Candidate::from)
                .collect(Collectors.toList());
        return new TripMatchResponse(match.getForTripId(), candidates, match.getComputedAt());
    }

    public String getForTripId() { return forTripId; }
    public List<Candidate> getCandidates() { return candidates; }
    public Instant getComputedAt() { return computedAt; }

    public record Candidate(String tripId, double score, double overlapFraction, double startProximity,
                            double endProximity, double timeProximity, long timeDeltaSeconds) {

        static Candidate from(MatchedTrip m) {
            return new Candidate(m.getTripId(), m.getScore(), m.getOverlapFraction(), m.getStartProximity(),
                    m.getEndProximity(), m.getTimeProximity(), m.getTimeDeltaSeconds());
        }
    }
}
