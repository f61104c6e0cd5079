package com.shieldops.anomaly.analytics;

/**
 * Classification of a single input point: its position in the input, the
 * algorithm-specific score and whether the score crossed the threshold.
 */
public record PointScore(int index, double score, boolean anomaly) {

    static PointScore normal(int index) {
        return new PointScore(index, 0d, false);
    }
}
