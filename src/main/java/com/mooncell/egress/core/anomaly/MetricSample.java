package com.mooncell.egress.core.anomaly;

import lombok.Data;

/**
 * 一个时间点的出口指标采样，timestamp 为 epoch 秒
 */
@Data
public class MetricSample {
    private final double timestamp;
    private final double latencyMs;
    /** 0 ~ 1 */
    private final double errorRate;
    private final double throughput;

    public double valueOf(MetricName metric) {
        switch (metric) {
            case LATENCY:
                return latencyMs;
            case ERROR_RATE:
                return errorRate;
            case THROUGHPUT:
                return throughput;
            default:
                throw new IllegalArgumentException("Unknown metric: " + metric);
        }
    }
}
