package com.mooncell.egress.metrics;

import com.mooncell.egress.core.anomaly.MetricSample;
import com.mooncell.egress.core.pool.ProxyDiagnostic;
import com.mooncell.egress.core.pool.ProxyPoolManager;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 周期性把地址池的累计统计转成 {@link MetricSample}，作为重校准的历史来源
 *
 * <p>每次采样取两次快照之间的增量：
 * <ul>
 *   <li>latencyMs = 区间内总耗时 / 区间内请求数</li>
 *   <li>errorRate = 区间内失败数 / 区间内请求数</li>
 *   <li>throughput = 区间内请求数 / 区间秒数</li>
 * </ul>
 * 区间内没有请求时不产生采样。历史只保存在内存中，超过 maxSamples 丢弃最旧的点。
 */
@Slf4j
public class PoolSamplingMetricsSource implements MetricsSource {

    private final ProxyPoolManager poolManager;
    private final Clock clock;
    private final int maxSamples;

    // 只在采样线程修改，读取时加锁复制
    private final ArrayDeque<MetricSample> history = new ArrayDeque<>();

    private boolean baselineTaken;
    private double lastSampleAt;
    private long lastRequests;
    private long lastFailures;
    private long lastDurationMs;

    public PoolSamplingMetricsSource(ProxyPoolManager poolManager, Clock clock, int maxSamples) {
        if (maxSamples < 1) {
            throw new IllegalArgumentException("maxSamples must be >= 1");
        }
        this.poolManager = poolManager;
        this.clock = clock;
        this.maxSamples = maxSamples;
    }

    /**
     * 采一次样，由定时任务调用
     */
    public synchronized void sample() {
        double now = clock.millis() / 1000.0d;
        long requests = 0L;
        long failures = 0L;
        long durationMs = 0L;
        for (ProxyDiagnostic diagnostic : poolManager.diagnosticSnapshot().values()) {
            requests += diagnostic.getRequests();
            failures += diagnostic.getFailures();
            durationMs += diagnostic.getTotalDurationMs();
        }

        long deltaRequests = requests - lastRequests;
        long deltaFailures = failures - lastFailures;
        long deltaDuration = durationMs - lastDurationMs;
        double elapsed = now - lastSampleAt;
        boolean usable = baselineTaken && deltaRequests > 0 && deltaFailures >= 0 && deltaDuration >= 0 && elapsed > 0;

        baselineTaken = true;
        lastSampleAt = now;
        lastRequests = requests;
        lastFailures = failures;
        lastDurationMs = durationMs;

        if (!usable) {
            // 首次采样、无流量，或地址被清理导致累计值回退
            return;
        }
        MetricSample sample = new MetricSample(
                now,
                (double) deltaDuration / deltaRequests,
                (double) deltaFailures / deltaRequests,
                deltaRequests / elapsed);
        history.addLast(sample);
        while (history.size() > maxSamples) {
            history.removeFirst();
        }
        log.debug("Pool sample recorded: {}", sample);
    }

    @Override
    public synchronized List<MetricSample> fetchSamples(long sinceSeconds, double now) {
        double cutoff = now - sinceSeconds;
        return history.stream()
                .filter(s -> s.getTimestamp() >= cutoff)
                .collect(Collectors.toList());
    }

    public synchronized int size() {
        return history.size();
    }
}
