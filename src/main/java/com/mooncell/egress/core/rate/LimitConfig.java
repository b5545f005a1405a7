package com.mooncell.egress.core.rate;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单条限流配置：windowSeconds 秒内最多 requests 次请求
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LimitConfig {
    private int requests;
    private int windowSeconds;
    private RateLimitStrategy strategy = RateLimitStrategy.TOKEN_BUCKET;

    public LimitConfig(int requests, int windowSeconds) {
        this(requests, windowSeconds, RateLimitStrategy.TOKEN_BUCKET);
    }

    void validate() {
        if (requests < 1) {
            throw new IllegalArgumentException("requests must be >= 1, got " + requests);
        }
        if (windowSeconds < 1) {
            throw new IllegalArgumentException("windowSeconds must be >= 1, got " + windowSeconds);
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy must not be null");
        }
    }
}
