package com.shieldops.anomaly.analytics;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes a repeating cycle of length {@code period} and z-scores what is left.
 * Series shorter than one full cycle are handed to {@link ZScoreDetector} as is.
 */
public class SeasonalDetector {

    public static final int DEFAULT_PERIOD = 24;

    private final ZScoreDetector fallback;

    public SeasonalDetector(ZScoreDetector fallback) {
        this.fallback = fallback;
    }

    public List<PointScore> detect(List<Double> values) {
        return detect(values, DEFAULT_PERIOD, ZScoreDetector.DEFAULT_SENSITIVITY);
    }

    public List<PointScore> detect(List<Double> values, int period, double sensitivity) {
        if (period < 1) {
            throw new IllegalArgumentException("period must be positive");
        }
        if (values.size() < period) {
            return fallback.detect(values, sensitivity);
        }
        double[] seasonal = seasonalComponent(values, period);
        List<Double> residuals = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            residuals.add(values.get(i) - seasonal[i % period]);
        }
        double residualMean = Statistics.mean(residuals);
        double residualStd = Statistics.populationStdDev(residuals);

        List<PointScore> scores = new ArrayList<>(values.size());
        for (int i = 0; i < residuals.size(); i++) {
            if (residualStd == 0d) {
                scores.add(PointScore.normal(i));
                continue;
            }
            double score = (residuals.get(i) - residualMean) / residualStd;
            scores.add(new PointScore(i, score, Math.abs(score) > sensitivity));
        }
        return scores;
    }

    /**
     * Average of all values sharing the same offset within the cycle.
     */
    static double[] seasonalComponent(List<Double> values, int period) {
        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int i = 0; i < values.size(); i++) {
            sums[i % period] += values.get(i);
            counts[i % period]++;
        }
        double[] seasonal = new double[period];
        for (int offset = 0; offset < period; offset++) {
            seasonal[offset] = counts[offset] == 0 ? 0d : sums[offset] / counts[offset];
        }
        return seasonal;
    }
}
