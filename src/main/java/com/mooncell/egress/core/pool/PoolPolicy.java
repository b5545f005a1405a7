package com.mooncell.egress.core.pool;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 地址池策略：连续失败多少次下线，下线后冷却多久再重新参与选择。
 * 整体替换，不做部分更新。
 */
@Getter
@ToString
@EqualsAndHashCode
public class PoolPolicy {
    public static final int DEFAULT_MAX_CONSECUTIVE_FAILURES = 3;
    public static final long DEFAULT_FAILURE_COOLDOWN_SECONDS = 60L;

    private final int maxConsecutiveFailures;
    private final long failureCooldownSeconds;

    public PoolPolicy(int maxConsecutiveFailures, long failureCooldownSeconds) {
        if (maxConsecutiveFailures < 1) {
            throw new IllegalArgumentException("maxConsecutiveFailures must be >= 1, got " + maxConsecutiveFailures);
        }
        if (failureCooldownSeconds < 0) {
            throw new IllegalArgumentException("failureCooldownSeconds must be >= 0, got " + failureCooldownSeconds);
        }
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.failureCooldownSeconds = failureCooldownSeconds;
    }

    public static PoolPolicy defaults() {
        return new PoolPolicy(DEFAULT_MAX_CONSECUTIVE_FAILURES, DEFAULT_FAILURE_COOLDOWN_SECONDS);
    }
}
