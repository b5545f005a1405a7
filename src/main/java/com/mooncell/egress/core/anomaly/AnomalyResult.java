package com.mooncell.egress.core.anomaly;

import lombok.Data;

import java.util.Map;

@Data
public class AnomalyResult {
    /** [0, 1]，保留 4 位小数 */
    private final double anomalyScore;
    private final boolean anomalous;
    private final Map<MetricName, Double> perMetricScore;
}
