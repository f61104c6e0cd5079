package com.shieldops.anomaly.analytics;

public class BaselineNotFoundException extends RuntimeException {

    private final String metricName;

    public BaselineNotFoundException(String metricName) {
        super("No baseline for metric '" + metricName + "'");
        this.metricName = metricName;
    }

    public String metricName() {
        return metricName;
    }
}
