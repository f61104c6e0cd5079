package com.shieldops.anomaly.controller.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record DetectionResponseDto(
        String metricName,
        List<AnomalyDto> anomalies,
        int totalPoints,
        int anomalyCount,
        String algorithm
) {
    public record AnomalyDto(
            String metricName,
            PointDto point,
            double score,
            double threshold,
            boolean anomaly,
            String algorithm,
            Map<String, Object> details
    ) {
    }

    public record PointDto(Instant timestamp, double value, Map<String, String> labels) {
    }
}
