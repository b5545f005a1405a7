package com.mooncell.egress.core.recalibration;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次重校准的完整输出，每次全量重算，不与上一次合并
 */
@Data
public class RecalibrationPolicies {
    public static final int EXPONENTIAL_BACKOFF = 2;

    private final int maxFailures;
    private final int timeoutSeconds;
    private final int retryAttempts;
    private final int baseCooldown;
    private final int exponentialBackoff;
    private final int maxCooldown;

    /**
     * 没有历史数据时使用的保守默认值
     */
    public static RecalibrationPolicies defaults() {
        return new RecalibrationPolicies(3, 10, 3, 60, EXPONENTIAL_BACKOFF, 600);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("max_failures", maxFailures);
        map.put("timeout_seconds", timeoutSeconds);
        map.put("retry_attempts", retryAttempts);
        map.put("base_cooldown", baseCooldown);
        map.put("exponential_backoff", exponentialBackoff);
        map.put("max_cooldown", maxCooldown);
        return map;
    }
}
