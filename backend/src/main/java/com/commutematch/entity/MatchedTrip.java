package com.commutematch.entity;

import com.commutematch.matching.model.MatchCandidate;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class MatchedTrip {

    @Column(name = "trip_id", nullable = false)
    private String tripId;

    @Column(name = "score", nullable = false)
    private double score;

    @Column(name = "overlap_fraction")
    private double overlapFraction;

    @Column(name = "start_proximity")
    private double startProximity;

    @Column(name = "end_proximity")
    private double endProximity;

    @Column(name = "time_proximity")
    private double timeProximity;

    @Column(name = "time_delta_seconds")
    private long timeDeltaSeconds;

    protected MatchedTrip() {
    }

    public static MatchedTrip from(MatchCandidate candidate) {
        MatchedTrip m = new MatchedTrip();
        m.tripId = candidate.tripId();
        m.score = candidate.score();
        m.overlapFraction = candidate.overlapFraction();
        m.startProximity = candidate.startProximity();
        m.endProximity = candidate.endProximity();
        m.timeProximity = candidate.timeProximity();
        m.timeDeltaSeconds = candidate.timeDelta().getSeconds();
        return m;
    }

    public String getTripId() { return tripId; }
    public double getScore() { return score; }
    public double getOverlapFraction() { return overlapFraction; }
    public double getStartProximity() { return startProximity; }
    public double getEndProximity() { return endProximity; }
    public double getTimeProximity() { return timeProximity; }
    public long getTimeDeltaSeconds() { return timeDeltaSeconds; }
}
