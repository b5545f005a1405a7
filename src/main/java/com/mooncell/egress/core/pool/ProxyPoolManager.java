package com.mooncell.egress.core.pool;

import com.mooncell.egress.metrics.MetricsSink;
import com.mooncell.egress.metrics.QuietMetricsSink;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 出口地址池管理器
 *
 * <p>核心功能：
 * <ul>
 *   <li><b>健康感知轮询</b>：从游标开始最多扫描一圈，返回第一个可用地址，游标越过被选中的地址</li>
 *   <li><b>故障下线</b>：连续失败达到 maxConsecutiveFailures 后下线</li>
 *   <li><b>冷却恢复</b>：下线地址在 failureCooldownSeconds 之后被扫描到时重新激活</li>
 *   <li><b>周期探活</b>：配置了 {@link HealthCheck} 时，每 healthCheckInterval 最多探测一次全部地址</li>
 *   <li><b>清理</b>：从下线时刻起超过 10 倍冷却时间仍未恢复的地址连同统计一起移除</li>
 * </ul>
 *
 * <p>只统计池内地址，对不在池内的地址上报会被忽略。
 * 选择、上报、探活、清理全部在同一把锁内执行，同一个池内互斥，不同池之间互不影响。
 * 遥测事件在锁外发出，sink 的异常只记录日志。
 */
@Slf4j
public class ProxyPoolManager {
    static final int PRUNE_COOLDOWN_MULTIPLIER = 10;
    private static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(60);

    private final Object lock = new Object();
    /** 轮询顺序 */
    private final List<String> addresses = new ArrayList<>();
    /** 地址 → 统计，与 addresses 一一对应 */
    private final Map<String, ProxyRecord> records = new LinkedHashMap<>();
    private final HealthCheck healthCheck;
    private final Duration healthCheckInterval;
    private final MetricsSink metricsSink;
    private final Clock clock;

    private volatile PoolPolicy policy;
    private int cursor;
    private Instant lastHealthCheckAt;

    @Builder
    public ProxyPoolManager(List<String> addresses,
                            PoolPolicy policy,
                            HealthCheck healthCheck,
                            Duration healthCheckInterval,
                            MetricsSink metricsSink,
                            Clock clock) {
        this.policy = policy == null ? PoolPolicy.defaults() : policy;
        this.healthCheck = healthCheck;
        this.healthCheckInterval = healthCheckInterval == null ? DEFAULT_HEALTH_CHECK_INTERVAL : healthCheckInterval;
        this.metricsSink = QuietMetricsSink.wrap(metricsSink);
        this.clock = clock == null ? Clock.systemUTC() : clock;
        if (addresses != null) {
            for (String address : addresses) {
                if (isBlank(address) || records.containsKey(address)) {
                    continue;
                }
                this.addresses.add(address);
                records.put(address, ProxyRecord.fresh(address));
            }
        }
        log.info("Proxy pool initialized with {} address(es), policy={}", this.addresses.size(), this.policy);
    }

    public ProxyPoolManager(List<String> addresses) {
        this(addresses, null, null, null, null, null);
    }

    /**
     * 从地址文件构建，文件不存在时得到空池
     */
    public static ProxyPoolManager fromFile(Path path, PoolPolicy policy, MetricsSink metricsSink, Clock clock) {
        return ProxyPoolManager.builder()
                .addresses(ProxyListLoader.load(path))
                .policy(policy)
                .metricsSink(metricsSink)
                .clock(clock)
                .build();
    }

    /**
     * 选择下一个可用地址
     *
     * @return 可用地址；池为空或全部下线时为空
     */
    public Optional<String> selectNext() {
        Optional<String> selected = Optional.empty();
        List<String> pruned;
        synchronized (lock) {
            Instant now = clock.instant();
            runHealthCheckIfDue(now);
            pruned = pruneExpired(now);
            int size = addresses.size();
            if (size > 0) {
                int start = cursor % size;
                for (int i = 0; i < size; i++) {
                    int index = (start + i) % size;
                    String address = addresses.get(index);
                    if (isEligible(records.get(address), now)) {
                        cursor = (index + 1) % size;
                        selected = Optional.of(address);
                        break;
                    }
                }
                if (selected.isEmpty()) {
                    // 全部不可用时游标仍前移一位，保证下次从不同位置开始
                    cursor = (start + 1) % size;
                }
            }
        }
        pruned.forEach(address -> metricsSink.emit("proxy_pruned", Map.of("address", address)));
        if (selected.isEmpty()) {
            log.debug("No active proxy available");
        }
        return selected;
    }

    public void reportSuccess(String address) {
        reportSuccess(address, 0L);
    }

    public void reportSuccess(String address, long durationMs) {
        if (isBlank(address)) {
            return;
        }
        Map<String, Object> payload;
        synchronized (lock) {
            ProxyRecord record = records.get(address);
            if (record == null) {
                log.debug("Ignoring success report for unknown proxy {}", address);
                return;
            }
            Instant now = clock.instant();
            if (!record.isActive()) {
                log.info("Proxy {} reactivated after successful call", address);
            }
            applySuccess(record, now, Math.max(0L, durationMs));
            payload = eventPayload(record, durationMs);
        }
        metricsSink.emit("proxy_success", payload);
    }

    public void reportFailure(String address) {
        reportFailure(address, 0L);
    }

    public void reportFailure(String address, long durationMs) {
        if (isBlank(address)) {
            return;
        }
        Map<String, Object> payload;
        synchronized (lock) {
            ProxyRecord record = records.get(address);
            if (record == null) {
                log.debug("Ignoring failure report for unknown proxy {}", address);
                return;
            }
            applyFailure(record, clock.instant(), Math.max(0L, durationMs));
            payload = eventPayload(record, durationMs);
        }
        metricsSink.emit("proxy_failure", payload);
    }

    /**
     * 整体替换策略，之后的选择与上报立即使用新值
     */
    public void setPolicies(int maxConsecutiveFailures, long failureCooldownSeconds) {
        PoolPolicy next = new PoolPolicy(maxConsecutiveFailures, failureCooldownSeconds);
        synchronized (lock) {
            PoolPolicy previous = policy;
            policy = next;
            if (!next.equals(previous)) {
                log.info("Proxy pool policy updated: {} -> {}", previous, next);
            }
        }
    }

    public PoolPolicy getPolicy() {
        return policy;
    }

    /**
     * 把地址加入轮询。被清理过的地址重新加入时从全新统计开始。
     *
     * @return 地址原本不在轮询中时为 true
     */
    public boolean addAddress(String address) {
        if (isBlank(address)) {
            return false;
        }
        synchronized (lock) {
            if (addresses.contains(address)) {
                return false;
            }
            addresses.add(address);
            records.put(address, ProxyRecord.fresh(address));
            log.info("Proxy {} added to pool", address);
            return true;
        }
    }

    /**
     * 执行到期的探活和清理，供定时任务在两次选择之间调用
     */
    public void maintain() {
        List<String> pruned;
        synchronized (lock) {
            Instant now = clock.instant();
            runHealthCheckIfDue(now);
            pruned = pruneExpired(now);
        }
        pruned.forEach(address -> metricsSink.emit("proxy_pruned", Map.of("address", address)));
    }

    /**
     * @return 全部统计的深拷贝，修改返回值不会影响池内状态
     */
    public Map<String, ProxyRecord> snapshotMetrics() {
        synchronized (lock) {
            Map<String, ProxyRecord> snapshot = new LinkedHashMap<>();
            records.forEach((address, record) -> snapshot.put(address, record.copy()));
            return snapshot;
        }
    }

    public Map<String, ProxyDiagnostic> diagnosticSnapshot() {
        synchronized (lock) {
            Map<String, ProxyDiagnostic> snapshot = new LinkedHashMap<>();
            records.forEach((address, record) -> snapshot.put(address, ProxyDiagnostic.of(record)));
            return snapshot;
        }
    }

    public List<String> addresses() {
        synchronized (lock) {
            return List.copyOf(addresses);
        }
    }

    public int size() {
        synchronized (lock) {
            return addresses.size();
        }
    }

    private boolean isEligible(ProxyRecord record, Instant now) {
        if (record.isActive()) {
            return true;
        }
        Instant lastFailureAt = record.getLastFailureAt();
        if (lastFailureAt != null && now.isBefore(lastFailureAt.plusSeconds(policy.getFailureCooldownSeconds()))) {
            return false;
        }
        record.setActive(true);
        record.setInactiveSince(null);
        record.setConsecutiveFailures(0);
        log.info("Proxy {} reactivated after cooldown", record.getAddress());
        return true;
    }

    private void applySuccess(ProxyRecord record, Instant now, long durationMs) {
        record.setSuccesses(record.getSuccesses() + 1);
        record.setRequests(record.getRequests() + 1);
        record.setTotalDurationMs(record.getTotalDurationMs() + durationMs);
        record.setConsecutiveFailures(0);
        record.setLastSuccessAt(now);
        record.setActive(true);
        record.setInactiveSince(null);
    }

    private void applyFailure(ProxyRecord record, Instant now, long durationMs) {
        record.setFailures(record.getFailures() + 1);
        record.setRequests(record.getRequests() + 1);
        record.setTotalDurationMs(record.getTotalDurationMs() + durationMs);
        record.setConsecutiveFailures(record.getConsecutiveFailures() + 1);
        record.setLastFailureAt(now);
        if (record.isActive() && record.getConsecutiveFailures() >= policy.getMaxConsecutiveFailures()) {
            record.setActive(false);
            record.setInactiveSince(now);
            log.warn("Proxy {} deactivated after {} consecutive failures, cooldown {}s",
                    record.getAddress(), record.getConsecutiveFailures(), policy.getFailureCooldownSeconds());
        }
    }

    private void runHealthCheckIfDue(Instant now) {
        if (healthCheck == null) {
            return;
        }
        if (lastHealthCheckAt != null && now.isBefore(lastHealthCheckAt.plus(healthCheckInterval))) {
            return;
        }
        lastHealthCheckAt = now;
        for (String address : addresses) {
            boolean healthy;
            try {
                healthy = healthCheck.check(address);
            } catch (Exception e) {
                log.warn("Health check for proxy {} failed: {}", address, e.getMessage());
                healthy = false;
            }
            ProxyRecord record = records.get(address);
            if (healthy) {
                if (!record.isActive()) {
                    log.info("Proxy {} recovered on health check", address);
                }
                applySuccess(record, now, 0L);
            } else {
                applyFailure(record, now, 0L);
            }
        }
    }

    private List<String> pruneExpired(Instant now) {
        Duration retention = Duration.ofSeconds(policy.getFailureCooldownSeconds()).multipliedBy(PRUNE_COOLDOWN_MULTIPLIER);
        List<String> pruned = new ArrayList<>();
        if (retention.isZero()) {
            // 冷却为 0 时下线地址会被立即重新激活，不做清理
            return pruned;
        }
        Iterator<Map.Entry<String, ProxyRecord>> it = records.entrySet().iterator();
        while (it.hasNext()) {
            ProxyRecord record = it.next().getValue();
            Instant inactiveSince = record.getInactiveSince();
            // 探活失败会不断刷新 lastFailureAt，清理只看下线时刻
            if (record.isActive() || inactiveSince == null || now.isBefore(inactiveSince.plus(retention))) {
                continue;
            }
            it.remove();
            int index = addresses.indexOf(record.getAddress());
            if (index >= 0) {
                addresses.remove(index);
                if (index < cursor) {
                    cursor--;
                }
            }
            pruned.add(record.getAddress());
            log.info("Proxy {} pruned after being inactive since {}", record.getAddress(), inactiveSince);
        }
        if (addresses.isEmpty()) {
            cursor = 0;
        } else {
            cursor = cursor % addresses.size();
        }
        return pruned;
    }

    private Map<String, Object> eventPayload(ProxyRecord record, long durationMs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("address", record.getAddress());
        payload.put("duration_ms", durationMs);
        payload.put("consecutive_failures", record.getConsecutiveFailures());
        payload.put("active", record.isActive());
        return payload;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
