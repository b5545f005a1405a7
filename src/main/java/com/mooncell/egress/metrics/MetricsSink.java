package com.mooncell.egress.metrics;

import java.util.Map;

/**
 * 遥测事件出口，fire-and-forget
 */
public interface MetricsSink {

    void emit(String event, Map<String, Object> payload);

    static MetricsSink discarding() {
        return (event, payload) -> {
        };
    }
}
