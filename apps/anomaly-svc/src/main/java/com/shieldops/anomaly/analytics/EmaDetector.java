package com.shieldops.anomaly.analytics;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores each point by its residual against an exponential moving average
 * seeded with the first value, normalised by the standard deviation of all
 * residuals.
 */
public class EmaDetector {

    public static final int DEFAULT_SPAN = 10;

    public List<PointScore> detect(List<Double> values) {
        return detect(values, DEFAULT_SPAN, ZScoreDetector.DEFAULT_SENSITIVITY);
    }

    public List<PointScore> detect(List<Double> values, int span, double sensitivity) {
        if (span < 1) {
            throw new IllegalArgumentException("span must be positive");
        }
        List<PointScore> scores = new ArrayList<>(values.size());
        if (values.size() < 2) {
            for (int i = 0; i < values.size(); i++) {
                scores.add(PointScore.normal(i));
            }
            return scores;
        }
        double alpha = 2d / (span + 1);
        List<Double> residuals = new ArrayList<>(values.size());
        double ema = values.get(0);
        for (int i = 0; i < values.size(); i++) {
            double value = values.get(i);
            if (i > 0) {
                ema = alpha * value + (1 - alpha) * ema;
            }
            residuals.add(value - ema);
        }
        double residualStd = Statistics.populationStdDev(residuals);
        for (int i = 0; i < residuals.size(); i++) {
            if (residualStd == 0d) {
                scores.add(PointScore.normal(i));
                continue;
            }
            double score = residuals.get(i) / residualStd;
            scores.add(new PointScore(i, score, Math.abs(score) > sensitivity));
        }
        return scores;
    }
}
