package com.commutematch.matching;

import com.commutematch.matching.exception.InvalidWeightsException;

/**
 * Weights of the composite match score. Must be non-negative and sum to 1.
 */
public record ScoreWeights(double overlap, double startProximity, double endProximity, double timeDelta) {

    private static final double SUM_TOLERANCE = 1e-9;

    public static final ScoreWeights DEFAULT = new ScoreWeights(0.5, 0.2, 0.2, 0.1);

    public ScoreWeights {
        double[] all = {overlap, startProximity, endProximity, timeDelta};
        for (double w : all) {
            if (!Double.isFinite(w) || w < 0) {
                throw new InvalidWeightsException("Score weights must be finite and non-negative, got " + w);
            }
        }
        double sum = overlap + startProximity + endProximity + timeDelta;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidWeightsException("Score weights must sum to 1, got " + sum);
        }
    }
}
