package com.mooncell.egress.core.recalibration;

import com.mooncell.egress.core.anomaly.AnomalyDetector;
import com.mooncell.egress.core.anomaly.AnomalyResult;
import com.mooncell.egress.core.anomaly.MetricName;
import com.mooncell.egress.core.anomaly.MetricSample;
import com.mooncell.egress.core.anomaly.MetricThresholds;
import com.mooncell.egress.core.anomaly.ThresholdWindow;
import com.mooncell.egress.core.anomaly.WindowThresholds;
import com.mooncell.egress.core.pool.ProxyPoolManager;
import com.mooncell.egress.metrics.MetricsSink;
import com.mooncell.egress.metrics.MetricsSource;
import com.mooncell.egress.metrics.QuietMetricsSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 基于历史指标重算地址池策略
 *
 * <p>流程：
 * <ol>
 *   <li>拉取最近 30 天采样；没有采样时直接返回保守默认值，不修改地址池</li>
 *   <li>计算多窗口阈值，并用全部采样的算术平均值打异常分</li>
 *   <li>由 24h 延迟 p95/p99 推导冷却时间，由 24h 错误率 p99 选择失败档位</li>
 *   <li>异常分高时延长冷却、收紧失败阈值</li>
 *   <li>把 maxFailures / baseCooldown 推入地址池，并发出 recalibration_update 事件</li>
 * </ol>
 *
 * <p>run 串行执行，定时触发与手动触发重叠时依次运行。
 */
@Slf4j
public class RecalibrationController {
    static final long HISTORY_SECONDS = ThresholdWindow.LAST_30D.seconds();

    private final MetricsSource metricsSource;
    private final ProxyPoolManager poolManager;
    private final MetricsSink metricsSink;
    private final Clock clock;
    private final Object lock = new Object();

    public RecalibrationController(MetricsSource metricsSource, ProxyPoolManager poolManager,
                                   MetricsSink metricsSink, Clock clock) {
        this.metricsSource = Objects.requireNonNull(metricsSource, "metricsSource must not be null");
        this.poolManager = Objects.requireNonNull(poolManager, "poolManager must not be null");
        this.metricsSink = QuietMetricsSink.wrap(metricsSink);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public RecalibrationPolicies run() {
        synchronized (lock) {
            Instant start = clock.instant();
            double now = start.toEpochMilli() / 1000.0d;
            List<MetricSample> samples = metricsSource.fetchSamples(HISTORY_SECONDS, now);
            if (samples == null || samples.isEmpty()) {
                log.warn("Recalibration skipped: no metric samples available, keeping conservative defaults");
                return RecalibrationPolicies.defaults();
            }

            MetricThresholds thresholds = AnomalyDetector.computeThresholds(samples, now);
            double latency = 0.0d;
            double errorRate = 0.0d;
            double throughput = 0.0d;
            for (MetricSample sample : samples) {
                latency += sample.getLatencyMs();
                errorRate += sample.getErrorRate();
                throughput += sample.getThroughput();
            }
            int n = samples.size();
            AnomalyResult anomaly = AnomalyDetector.detectAnomaly(latency / n, errorRate / n, throughput / n, thresholds);

            RecalibrationPolicies policies = derivePolicies(thresholds, anomaly);
            poolManager.setPolicies(policies.getMaxFailures(), policies.getBaseCooldown());

            long durationMs = clock.millis() - start.toEpochMilli();
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("anomaly_score", anomaly.getAnomalyScore());
            payload.put("is_anomalous", anomaly.isAnomalous());
            payload.put("sample_count", n);
            payload.put("policies", policies.toMap());
            payload.put("duration_ms", durationMs);
            metricsSink.emit("recalibration_update", payload);

            log.info("Recalibration applied from {} samples: score={}, policies={}", n, anomaly.getAnomalyScore(), policies);
            return policies;
        }
    }

    static RecalibrationPolicies derivePolicies(MetricThresholds thresholds, AnomalyResult anomaly) {
        WindowThresholds latency24h = thresholds.get(MetricName.LATENCY, ThresholdWindow.LAST_24H);
        WindowThresholds error24h = thresholds.get(MetricName.ERROR_RATE, ThresholdWindow.LAST_24H);

        int baseCooldown = (int) Math.max(30.0d, Math.min(900.0d, latency24h.getP95() / 5.0d));
        int maxCooldown = (int) Math.max(baseCooldown * 5.0d, latency24h.getP99() / 3.0d);

        int maxFailures;
        int retryAttempts;
        int timeoutSeconds;
        if (error24h.getP99() >= 0.20d) {
            maxFailures = 1;
            retryAttempts = 2;
            timeoutSeconds = 15;
        } else if (error24h.getP99() >= 0.10d) {
            maxFailures = 2;
            retryAttempts = 3;
            timeoutSeconds = 12;
        } else {
            maxFailures = 3;
            retryAttempts = 4;
            timeoutSeconds = 10;
        }

        double score = anomaly.getAnomalyScore();
        if (score >= 0.9d) {
            baseCooldown = (int) Math.min(1200.0d, baseCooldown * 2.0d);
            maxFailures = Math.max(1, maxFailures - 1);
        } else if (score >= AnomalyDetector.ANOMALY_THRESHOLD) {
            baseCooldown = (int) Math.min(1200.0d, baseCooldown * 1.5d);
        }

        return new RecalibrationPolicies(maxFailures, timeoutSeconds, retryAttempts, baseCooldown,
                RecalibrationPolicies.EXPONENTIAL_BACKOFF, maxCooldown);
    }
}
