package com.mooncell.egress.core.anomaly;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 三个指标在三个窗口上的阈值集合，缺失项按全零处理
 */
public class MetricThresholds {
    private final Map<MetricName, Map<ThresholdWindow, WindowThresholds>> values;

    MetricThresholds(Map<MetricName, Map<ThresholdWindow, WindowThresholds>> values) {
        Map<MetricName, Map<ThresholdWindow, WindowThresholds>> copy = new EnumMap<>(MetricName.class);
        values.forEach((metric, byWindow) -> copy.put(metric, Collections.unmodifiableMap(new EnumMap<>(byWindow))));
        this.values = Collections.unmodifiableMap(copy);
    }

    public WindowThresholds get(MetricName metric, ThresholdWindow window) {
        Map<ThresholdWindow, WindowThresholds> byWindow = values.get(metric);
        if (byWindow == null) {
            return WindowThresholds.ZERO;
        }
        return byWindow.getOrDefault(window, WindowThresholds.ZERO);
    }

    public Map<ThresholdWindow, WindowThresholds> forMetric(MetricName metric) {
        return values.getOrDefault(metric, Map.of());
    }

    @Override
    public String toString() {
        return "MetricThresholds" + values;
    }
}
