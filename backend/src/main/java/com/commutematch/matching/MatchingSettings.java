package com.commutematch.matching;

import java.time.Duration;

/**
 * Per-invocation knobs of the matching pipeline.
 *
 * @param radiusMeters how far from a sampled point another trip's sample may lie
 * @param timeWindow   largest departure difference still considered a candidate
 * @param resultLimit  maximum number of ranked candidates returned
 */
public record MatchingSettings(double radiusMeters, Duration timeWindow, int resultLimit) {

    public static final MatchingSettings DEFAULT = new MatchingSettings(
            OverlapScorer.DEFAULT_MATCH_RADIUS_METERS, OverlapScorer.DEFAULT_TIME_WINDOW, Ranker.DEFAULT_LIMIT);

    public MatchingSettings {
        if (!(radiusMeters > 0)) {
            throw new IllegalArgumentException("radiusMeters must be positive: " + radiusMeters);
        }
        if (timeWindow == null || timeWindow.isNegative() || timeWindow.isZero()) {
            throw new IllegalArgumentException("timeWindow must be positive: " + timeWindow);
        }
        if (resultLimit <= 0) {
            throw new IllegalArgumentException("resultLimit must be positive: " + resultLimit);
        }
    }
}
