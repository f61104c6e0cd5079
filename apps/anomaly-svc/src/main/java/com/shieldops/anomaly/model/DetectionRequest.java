package com.shieldops.anomaly.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One detection call. {@code algorithm}, {@code sensitivity} and {@code windowSize}
 * may be null, in which case the engine applies its configured defaults.
 * {@code timestamps} is an optional list parallel to {@code values}.
 */
public record DetectionRequest(
        String metricName,
        List<Double> values,
        List<String> timestamps,
        Map<String, String> labels,
        String algorithm,
        Double sensitivity,
        Integer windowSize
) {

    public DetectionRequest {
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName must be provided");
        }
        if (values == null) {
            throw new IllegalArgumentException("values must be provided");
        }
        for (Double value : values) {
            if (value == null) {
                throw new IllegalArgumentException("values must not contain nulls");
            }
        }
        if (sensitivity != null && (sensitivity.isNaN() || sensitivity < 0)) {
            throw new IllegalArgumentException("sensitivity must be zero or positive");
        }
        if (windowSize != null && windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        values = List.copyOf(values);
        // entries may be null, so no List.copyOf here
        timestamps = timestamps == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(timestamps));
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public DetectionRequest(String metricName, List<Double> values, String algorithm) {
        this(metricName, values, null, null, algorithm, null, null);
    }

    public DetectionRequest(String metricName, List<Double> values, String algorithm, Double sensitivity, Integer windowSize) {
        this(metricName, values, null, null, algorithm, sensitivity, windowSize);
    }
}
