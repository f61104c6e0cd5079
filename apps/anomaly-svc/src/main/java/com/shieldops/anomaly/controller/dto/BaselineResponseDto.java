package com.shieldops.anomaly.controller.dto;

import java.time.Instant;
import java.util.Map;

public record BaselineResponseDto(
        String metricName,
        double mean,
        double stdDev,
        double min,
        double max,
        long count,
        Instant updatedAt,
        Map<String, Double> percentiles
) {
}
