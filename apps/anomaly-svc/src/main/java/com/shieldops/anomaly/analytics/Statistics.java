package com.shieldops.anomaly.analytics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pure numeric helpers shared by the detectors and the baseline store.
 * Every method returns {@code 0.0} for empty input instead of failing.
 */
public final class Statistics {

    private Statistics() {
    }

    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0d;
        }
        double sum = 0d;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    /**
     * Population standard deviation (divides by n). Fewer than two values yield {@code 0.0}.
     */
    public static double populationStdDev(List<Double> values) {
        if (values.size() < 2) {
            return 0d;
        }
        double mean = mean(values);
        double sumSquaredDiffs = 0d;
        for (double value : values) {
            double diff = value - mean;
            sumSquaredDiffs += diff * diff;
        }
        return Math.sqrt(sumSquaredDiffs / values.size());
    }

    public static double median(List<Double> values) {
        if (values.isEmpty()) {
            return 0d;
        }
        List<Double> sorted = sortedCopy(values);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 0) {
            return (sorted.get(mid - 1) + sorted.get(mid)) / 2d;
        }
        return sorted.get(mid);
    }

    /**
     * Percentile by linear interpolation between the closest ranks, where rank
     * {@code k = p / 100 * (n - 1)} over the sorted values.
     */
    public static double percentile(List<Double> values, double percentile) {
        if (values.isEmpty()) {
            return 0d;
        }
        return percentileOfSorted(sortedCopy(values), percentile);
    }

    static double percentileOfSorted(List<Double> sortedValues, double percentile) {
        if (sortedValues.isEmpty()) {
            return 0d;
        }
        if (sortedValues.size() == 1) {
            return sortedValues.get(0);
        }
        double index = percentile / 100.0 * (sortedValues.size() - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues.get(lower);
        }
        double weight = index - lower;
        return sortedValues.get(lower) * (1 - weight) + sortedValues.get(upper) * weight;
    }

    static List<Double> sortedCopy(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        return sorted;
    }
}
