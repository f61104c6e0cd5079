package com.shieldops.anomaly.controller.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

public record DetectionRequestDto(
        @NotBlank String metricName,
        @NotNull List<@NotNull Double> values,
        List<String> timestamps,
        Map<String, String> labels,
        String algorithm,
        @DecimalMin("0.0") Double sensitivity,
        @Min(1) Integer windowSize
) {
}
