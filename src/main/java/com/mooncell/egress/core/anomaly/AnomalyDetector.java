package com.mooncell.egress.core.anomaly;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 多窗口统计阈值计算与异常打分，纯函数，无状态
 *
 * <p>阈值：对 24h / 7d / 30d 每个窗口、每个指标分别计算
 * <ul>
 *   <li>p95 / p99：排序后取下标 floor(0.95*(n-1)) / floor(0.99*(n-1))</li>
 *   <li>twoSigma / threeSigma：总体均值 + 2σ / 3σ</li>
 * </ul>
 * 空样本的窗口阈值全部为 0。
 *
 * <p>打分：base = max(p95, 2σ)，extreme = max(p99, 3σ)，值不超过 base 得 0，达到 extreme 得 1，
 * 中间线性插值；单指标取三个窗口最大值，总分取三个指标最大值，总分 ≥ 0.7 视为异常。
 */
public final class AnomalyDetector {
    public static final double ANOMALY_THRESHOLD = 0.7d;

    private AnomalyDetector() {
    }

    public static MetricThresholds computeThresholds(List<MetricSample> samples, double now) {
        Map<MetricName, Map<ThresholdWindow, WindowThresholds>> result = new EnumMap<>(MetricName.class);
        for (MetricName metric : MetricName.values()) {
            result.put(metric, new EnumMap<>(ThresholdWindow.class));
        }
        for (ThresholdWindow window : ThresholdWindow.values()) {
            double cutoff = now - window.seconds();
            List<MetricSample> inWindow = new ArrayList<>();
            for (MetricSample sample : samples) {
                if (sample.getTimestamp() >= cutoff) {
                    inWindow.add(sample);
                }
            }
            for (MetricName metric : MetricName.values()) {
                double[] values = new double[inWindow.size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = inWindow.get(i).valueOf(metric);
                }
                result.get(metric).put(window, thresholdsOf(values));
            }
        }
        return new MetricThresholds(result);
    }

    static WindowThresholds thresholdsOf(double[] values) {
        if (values.length == 0) {
            return WindowThresholds.ZERO;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        double p95 = sorted[(int) Math.floor(0.95d * (n - 1))];
        double p99 = sorted[(int) Math.floor(0.99d * (n - 1))];

        double sum = 0.0d;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / n;
        double squares = 0.0d;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        double std = Math.sqrt(squares / n);
        return new WindowThresholds(p95, p99, mean + 2 * std, mean + 3 * std);
    }

    static double scoreValue(double value, WindowThresholds thresholds) {
        if (thresholds.isZero()) {
            return 0.0d;
        }
        double base = Math.max(thresholds.getP95(), thresholds.getTwoSigma());
        double extreme = Math.max(thresholds.getP99(), thresholds.getThreeSigma());
        if (value <= base) {
            return 0.0d;
        }
        if (value >= extreme) {
            return 1.0d;
        }
        return (value - base) / (extreme - base);
    }

    public static AnomalyResult detectAnomaly(double latencyMs, double errorRate, double throughput,
                                              MetricThresholds thresholds) {
        Map<MetricName, Double> current = new EnumMap<>(MetricName.class);
        current.put(MetricName.LATENCY, latencyMs);
        current.put(MetricName.ERROR_RATE, errorRate);
        current.put(MetricName.THROUGHPUT, throughput);

        Map<MetricName, Double> perMetric = new EnumMap<>(MetricName.class);
        for (Map.Entry<MetricName, Double> entry : current.entrySet()) {
            double best = 0.0d;
            for (ThresholdWindow window : ThresholdWindow.values()) {
                best = Math.max(best, scoreValue(entry.getValue(), thresholds.get(entry.getKey(), window)));
            }
            perMetric.put(entry.getKey(), best);
        }

        double score = perMetric.isEmpty() ? 0.0d : Collections.max(perMetric.values());
        double rounded = Math.round(score * 10_000.0d) / 10_000.0d;
        return new AnomalyResult(rounded, rounded >= ANOMALY_THRESHOLD, Collections.unmodifiableMap(perMetric));
    }
}
