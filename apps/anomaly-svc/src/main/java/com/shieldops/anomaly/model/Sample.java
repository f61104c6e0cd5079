package com.shieldops.anomaly.model;

import java.time.Instant;
import java.util.Map;

public record Sample(Instant timestamp, double value, Map<String, String> labels) {

    public Sample {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public Sample(Instant timestamp, double value) {
        this(timestamp, value, Map.of());
    }
}
