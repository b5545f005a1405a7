package com.mooncell.egress.core.pool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 地址诊断视图：原始计数 + 派生的延迟/错误率/可用性
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyDiagnostic {
    /** totalDurationMs / max(1, requests) */
    private double avgLatencyMs;
    /** failures / max(1, requests) */
    private double errorRate;
    /** active 时为 1.0，否则 0.0 */
    private double availability;
    private long successes;
    private long failures;
    private int consecutiveFailures;
    private long requests;
    private long totalDurationMs;
    private Instant lastSuccessAt;
    private Instant lastFailureAt;
    private boolean active;

    public static ProxyDiagnostic of(ProxyRecord record) {
        double divisor = Math.max(1L, record.getRequests());
        return ProxyDiagnostic.builder()
                .avgLatencyMs(record.getTotalDurationMs() / divisor)
                .errorRate(record.getFailures() / divisor)
                .availability(record.isActive() ? 1.0d : 0.0d)
                .successes(record.getSuccesses())
                .failures(record.getFailures())
                .consecutiveFailures(record.getConsecutiveFailures())
                .requests(record.getRequests())
                .totalDurationMs(record.getTotalDurationMs())
                .lastSuccessAt(record.getLastSuccessAt())
                .lastFailureAt(record.getLastFailureAt())
                .active(record.isActive())
                .build();
    }
}
