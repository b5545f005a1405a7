package com.mooncell.egress.metrics;

import com.mooncell.egress.core.anomaly.MetricSample;

import java.util.List;

/**
 * 历史指标来源，供重校准读取
 */
public interface MetricsSource {

    /**
     * @param sinceSeconds 回溯秒数
     * @param now 当前时间（epoch 秒）
     * @return 不早于 now - sinceSeconds 的采样，顺序不保证，可以为空
     */
    List<MetricSample> fetchSamples(long sinceSeconds, double now);
}
