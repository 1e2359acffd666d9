package com.commutematch.matching;

import com.commutematch.matching.model.Coordinate;
import com.commutematch.matching.model.MatchCandidate;
import com.commutematch.matching.model.TripSnapshot;

import java.time.Duration;
import java.util.List;

/**
 * Scores a candidate trip against the querying trip.
 * <p>
 * The score is computed from the querying trip's side: overlap is the share of
 * <em>its</em> samples that lie near the candidate's route, so {@code score(a, b)}
 * and {@code score(b, a)} can differ when the routes have different lengths.
 */
public class OverlapScorer {

    public static final double DEFAULT_MATCH_RADIUS_METERS = 200;
    public static final double DEFAULT_MAX_ENDPOINT_DISTANCE_METERS = 1000;
    public static final Duration DEFAULT_TIME_WINDOW = Duration.ofMinutes(15);

    private final ScoreWeights weights;
    private final double matchRadiusMeters;
    private final double maxStartDistanceMeters;
    private final double maxEndDistanceMeters;
    private final Duration timeWindow;

    public OverlapScorer() {
        this(ScoreWeights.DEFAULT, DEFAULT_MATCH_RADIUS_METERS, DEFAULT_MAX_ENDPOINT_DISTANCE_METERS,
                DEFAULT_MAX_ENDPOINT_DISTANCE_METERS, DEFAULT_TIME_WINDOW);
    }

    public OverlapScorer(ScoreWeights weights,
                         double matchRadiusMeters,
                         double maxStartDistanceMeters,
                         double maxEndDistanceMeters,
                         Duration timeWindow) {
        if (weights == null) {
            throw new IllegalArgumentException("weights are required");
        }
        if (!(matchRadiusMeters > 0) || !(maxStartDistanceMeters > 0) || !(maxEndDistanceMeters > 0)) {
            throw new IllegalArgumentException("Distances must be positive");
        }
        if (timeWindow == null || timeWindow.isZero() || timeWindow.isNegative()) {
            throw new IllegalArgumentException("Time window must be positive");
        }
        this.weights = weights;
        this.matchRadiusMeters = matchRadiusMeters;
        this.maxStartDistanceMeters = maxStartDistanceMeters;
        this.maxEndDistanceMeters = maxEndDistanceMeters;
        this.timeWindow = timeWindow;
    }

    public MatchCandidate score(TripSnapshot a, TripSnapshot b) {
        double overlap = overlapFraction(a.sampledPoints(), b.sampledPoints());
        double start = proximity(GeoUtils.haversineMeters(a.origin(), b.origin()), maxStartDistanceMeters);
        double end = proximity(GeoUtils.haversineMeters(a.destination(), b.destination()), maxEndDistanceMeters);
        Duration delta = a.departDelta(b);
        double time = proximity(delta.toMillis(), timeWindow.toMillis());

        double composite = weights.overlap() * overlap
                + weights.startProximity() * start
                + weights.endProximity() * end
                + weights.timeDelta() * time;
        composite = Math.min(1.0, Math.max(0.0, composite));

        return new MatchCandidate(b.id(), composite, overlap, start, end, time, delta);
    }

    double overlapFraction(List<Coordinate> mine, List<Coordinate> theirs) {
        if (mine.isEmpty() || theirs.isEmpty()) {
            return 0.0;
        }
        int near = 0;
        for (Coordinate p : mine) {
            for (Coordinate q : theirs) {
                if (GeoUtils.haversineMeters(p, q) <= matchRadiusMeters) {
                    near++;
                    break;
                }
            }
        }
        return (double) near / mine.size();
    }

    private static double proximity(double distance, double ceiling) {
        return 1.0 - Math.min(1.0, distance / ceiling);
    }

    public ScoreWeights getWeights() {
        return weights;
    }

    public double getMatchRadiusMeters() {
        return matchRadiusMeters;
    }

    public Duration getTimeWindow() {
        return timeWindow;
    }
}
