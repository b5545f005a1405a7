package com.mooncell.egress.core.rate;

import java.util.Optional;

/**
 * 限流状态存储，值在 ttlSeconds 秒后自动过期
 */
public interface RateLimitStorage {

    Optional<String> get(String key);

    void set(String key, String value, long ttlSeconds);
}
