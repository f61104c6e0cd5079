package com.shieldops.anomaly.analytics;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags points whose distance from the mean of the whole series exceeds
 * {@code sensitivity} population standard deviations.
 */
public class ZScoreDetector {

    public static final double DEFAULT_SENSITIVITY = 2.0d;

    public List<PointScore> detect(List<Double> values) {
        return detect(values, DEFAULT_SENSITIVITY);
    }

    public List<PointScore> detect(List<Double> values, double sensitivity) {
        List<PointScore> scores = new ArrayList<>(values.size());
        if (values.size() < 2) {
            for (int i = 0; i < values.size(); i++) {
                scores.add(PointScore.normal(i));
            }
            return scores;
        }
        double mean = Statistics.mean(values);
        double stdDev = Statistics.populationStdDev(values);
        for (int i = 0; i < values.size(); i++) {
            if (stdDev == 0d) {
                // flat series, nothing stands out
                scores.add(PointScore.normal(i));
                continue;
            }
            double zScore = (values.get(i) - mean) / stdDev;
            scores.add(new PointScore(i, zScore, Math.abs(zScore) > sensitivity));
        }
        return scores;
    }
}
