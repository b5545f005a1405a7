package com.mooncell.egress.core.maintenance;

import com.mooncell.egress.core.pool.ProxyPoolManager;
import com.mooncell.egress.core.rate.InMemoryRateLimitStorage;
import com.mooncell.egress.metrics.PoolSamplingMetricsSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * 后台周期任务：地址池探活/清理、池指标采样、过期限流状态清理。
 * 单次执行失败只记录日志，不影响下一次调度。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MaintenanceManager {

    private final ProxyPoolManager proxyPoolManager;
    private final PoolSamplingMetricsSource poolSamplingMetricsSource;
    private final ObjectProvider<InMemoryRateLimitStorage> inMemoryRateLimitStorage;

    @Scheduled(fixedDelayString = "${egress.pool.maintenance-interval-ms:30000}")
    public void maintainPool() {
        try {
            proxyPoolManager.maintain();
        } catch (RuntimeException e) {
            log.error("Proxy pool maintenance failed", e);
        }
    }

    @Scheduled(fixedRateString = "${egress.sampling.interval-seconds:60}", timeUnit = TimeUnit.SECONDS)
    public void samplePool() {
        try {
            poolSamplingMetricsSource.sample();
        } catch (RuntimeException e) {
            log.error("Proxy pool sampling failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${egress.rate-limit.purge-interval-ms:60000}")
    public void purgeRateLimitState() {
        inMemoryRateLimitStorage.ifAvailable(InMemoryRateLimitStorage::purgeExpired);
    }
}
