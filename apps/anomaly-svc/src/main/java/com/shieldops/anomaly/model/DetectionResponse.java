package com.shieldops.anomaly.model;

import java.util.List;

public record DetectionResponse(
        String metricName,
        List<AnomalyResult> anomalies,
        int totalPoints,
        int anomalyCount,
        String algorithm
) {

    public DetectionResponse {
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
    }
}
