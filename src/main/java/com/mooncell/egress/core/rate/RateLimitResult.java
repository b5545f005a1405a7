package com.mooncell.egress.core.rate;

import lombok.Data;

import java.time.Instant;

/**
 * 一次限流检查的结果
 * <p>
 * 允许时 resetAt 表示额度恢复满的时间点；拒绝时表示建议的重试时间点。
 */
@Data
public class RateLimitResult {
    private final boolean allowed;
    private final int remaining;
    private final Instant resetAt;
}
