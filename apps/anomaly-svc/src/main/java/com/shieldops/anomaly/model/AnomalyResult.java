package com.shieldops.anomaly.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A flagged point. {@code score} sign is algorithm-defined and always travels
 * with the {@code threshold} that was applied.
 */
public record AnomalyResult(
        String metricName,
        Sample point,
        double score,
        double threshold,
        boolean anomaly,
        String algorithm,
        Map<String, Object> details
) {

    public AnomalyResult {
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
