package com.shieldops.anomaly.analytics;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum DetectionAlgorithm {
    ZSCORE("zscore"),
    IQR("iqr"),
    EMA("ema"),
    SEASONAL("seasonal");

    private final String id;

    DetectionAlgorithm(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Case-insensitive lookup by id. Unknown names are rejected, never mapped to a default.
     */
    public static DetectionAlgorithm parse(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (DetectionAlgorithm algorithm : values()) {
            if (algorithm.id.equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown algorithm '" + name + "'. Supported: " + supported());
    }

    public static String supported() {
        return Arrays.stream(values())
                .map(DetectionAlgorithm::id)
                .collect(Collectors.joining(", "));
    }
}
