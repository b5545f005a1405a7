package com.mooncell.egress.core.anomaly;

import lombok.Data;

/**
 * 单个 (指标, 窗口) 的统计阈值
 */
@Data
public class WindowThresholds {
    public static final WindowThresholds ZERO = new WindowThresholds(0.0d, 0.0d, 0.0d, 0.0d);

    private final double p95;
    private final double p99;
    /** mean + 2σ */
    private final double twoSigma;
    /** mean + 3σ */
    private final double threeSigma;

    public boolean isZero() {
        return p95 == 0.0d && p99 == 0.0d && twoSigma == 0.0d && threeSigma == 0.0d;
    }
}
