package com.shieldops.anomaly.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary statistics the engine treats as normal for one metric, recomputed
 * over the metric's full history on every update.
 */
public record Baseline(
        String metricName,
        double mean,
        double stdDev,
        double min,
        double max,
        long count,
        Instant updatedAt,
        Map<String, Double> percentiles
) {

    public Baseline {
        percentiles = percentiles == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(percentiles));
    }
}
