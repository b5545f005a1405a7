package com.mooncell.egress.metrics;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 吞掉下游 sink 的异常，只记录日志，保证遥测失败不会影响业务调用
 */
@Slf4j
public final class QuietMetricsSink implements MetricsSink {
    private final MetricsSink delegate;

    private QuietMetricsSink(MetricsSink delegate) {
        this.delegate = delegate;
    }

    public static MetricsSink wrap(MetricsSink sink) {
        if (sink == null) {
            return MetricsSink.discarding();
        }
        if (sink instanceof QuietMetricsSink) {
            return sink;
        }
        return new QuietMetricsSink(sink);
    }

    @Override
    public void emit(String event, Map<String, Object> payload) {
        try {
            delegate.emit(event, payload);
        } catch (RuntimeException e) {
            log.warn("Failed to emit metrics event {}: {}", event, e.getMessage());
        }
    }
}
