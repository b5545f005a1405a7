package com.mooncell.egress.core.anomaly;

public enum MetricName {
    LATENCY("latency_ms"),
    ERROR_RATE("error_rate"),
    THROUGHPUT("throughput");

    private final String key;

    MetricName(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
