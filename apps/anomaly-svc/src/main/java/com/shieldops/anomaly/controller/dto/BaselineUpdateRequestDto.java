package com.shieldops.anomaly.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record BaselineUpdateRequestDto(
        @NotBlank String metricName,
        @NotEmpty List<@NotNull Double> values
) {
}
