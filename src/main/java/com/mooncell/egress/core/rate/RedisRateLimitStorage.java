package com.mooncell.egress.core.rate;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 基于 Redis 的限流存储，多实例共享同一份额度
 * <p>
 * 仅保证单次 get/set 的原子性，不提供跨进程的读改写协调。
 */
@RequiredArgsConstructor
public class RedisRateLimitStorage implements RateLimitStorage {

    private static final String KEY_PREFIX = "mooncell:";

    private final StringRedisTemplate stringRedisTemplate;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(stringRedisTemplate.opsForValue().get(KEY_PREFIX + key));
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        stringRedisTemplate.opsForValue().set(KEY_PREFIX + key, value, ttlSeconds, TimeUnit.SECONDS);
    }
}
