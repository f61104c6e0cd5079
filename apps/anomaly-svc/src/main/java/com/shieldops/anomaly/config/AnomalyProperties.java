package com.shieldops.anomaly.config;

import com.shieldops.anomaly.analytics.DetectionAlgorithm;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "shieldops.anomaly")
public record AnomalyProperties(Detection detection) {

    public Detection detection() {
        return detection != null ? detection : new Detection(null, null, null);
    }

    /**
     * Settings applied when a request leaves them out. The algorithm binds
     * case-insensitively, so {@code zscore} and {@code ZSCORE} both work.
     */
    public record Detection(DetectionAlgorithm defaultAlgorithm, Double defaultSensitivity, Integer defaultWindowSize) {
        public Detection {
            if (defaultAlgorithm == null) {
                defaultAlgorithm = DetectionAlgorithm.ZSCORE;
            }
            if (defaultSensitivity == null) {
                defaultSensitivity = 2.0d;
            }
            if (defaultSensitivity.isNaN() || defaultSensitivity < 0) {
                throw new IllegalArgumentException("defaultSensitivity must be zero or positive");
            }
            if (defaultWindowSize == null) {
                defaultWindowSize = 10;
            }
            if (defaultWindowSize < 1) {
                throw new IllegalArgumentException("defaultWindowSize must be positive");
            }
        }
    }
}
