package com.shieldops.anomaly.analytics;

import java.util.ArrayList;
import java.util.List;

/**
 * Tukey fence detector. Points below {@code Q1 - multiplier * IQR} score
 * negative, points above {@code Q3 + multiplier * IQR} score positive, both in
 * units of IQR past the fence. Points inside the fences score their distance
 * from the quartile midpoint and are never flagged.
 */
public class IqrDetector {

    public static final double DEFAULT_MULTIPLIER = 1.5d;

    static final int MIN_POINTS = 4;

    public List<PointScore> detect(List<Double> values) {
        return detect(values, DEFAULT_MULTIPLIER);
    }

    public List<PointScore> detect(List<Double> values, double multiplier) {
        List<PointScore> scores = new ArrayList<>(values.size());
        if (values.size() < MIN_POINTS) {
            for (int i = 0; i < values.size(); i++) {
                scores.add(PointScore.normal(i));
            }
            return scores;
        }
        List<Double> sorted = Statistics.sortedCopy(values);
        double q1 = Statistics.percentileOfSorted(sorted, 25);
        double q3 = Statistics.percentileOfSorted(sorted, 75);
        double iqr = q3 - q1;
        if (iqr == 0d) {
            for (int i = 0; i < values.size(); i++) {
                scores.add(PointScore.normal(i));
            }
            return scores;
        }
        double lower = q1 - multiplier * iqr;
        double upper = q3 + multiplier * iqr;
        double midpoint = (q1 + q3) / 2d;
        for (int i = 0; i < values.size(); i++) {
            double value = values.get(i);
            if (value < lower) {
                scores.add(new PointScore(i, -(lower - value) / iqr, true));
            } else if (value > upper) {
                scores.add(new PointScore(i, (value - upper) / iqr, true));
            } else {
                scores.add(new PointScore(i, (value - midpoint) / iqr, false));
            }
        }
        return scores;
    }
}
