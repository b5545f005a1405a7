package com.mooncell.egress.core.rate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 按 (endpoint, 调用方类别, 标识) 做准入控制
 *
 * <p>限流配置解析顺序：
 * <ol>
 *   <li>endpoint + 调用方类别 的精确配置</li>
 *   <li>通配 endpoint {@code *} + 调用方类别</li>
 *   <li>默认配置</li>
 * </ol>
 *
 * <p>支持两种算法：
 * <ul>
 *   <li><b>TOKEN_BUCKET</b>：容量 = requests，补充速率 = requests / window；首次使用直接扣除本次请求</li>
 *   <li><b>SLIDING_WINDOW</b>：记录窗口内所有请求时间戳，被拒绝的请求同样记录，持续突发会让窗口持续滑动</li>
 * </ul>
 *
 * <p>状态以 JSON 形式保存在 {@link RateLimitStorage}，TTL 等于限流窗口。同一 key 的读改写通过分段锁串行化，
 * 不同 key 之间互不阻塞。
 */
@Slf4j
public class RateLimiter {
    public static final String WILDCARD_ENDPOINT = "*";
    private static final String ANONYMOUS_IDENTIFIER = "anonymous";
    private static final int LOCK_STRIPES = 64;
    private static final TypeReference<List<Double>> TIMESTAMPS_TYPE = new TypeReference<>() {
    };

    private final RateLimitStorage storage;
    private final Map<String, Map<CallerClass, LimitConfig>> limitsByEndpoint;
    private final LimitConfig defaultLimit;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public RateLimiter(RateLimitStorage storage,
                       Map<String, Map<CallerClass, LimitConfig>> limitsByEndpoint,
                       LimitConfig defaultLimit,
                       ObjectMapper objectMapper,
                       Clock clock) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.defaultLimit = Objects.requireNonNull(defaultLimit, "defaultLimit must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        defaultLimit.validate();
        Map<String, Map<CallerClass, LimitConfig>> copy = new LinkedHashMap<>();
        if (limitsByEndpoint != null) {
            limitsByEndpoint.forEach((endpoint, byCaller) -> {
                Map<CallerClass, LimitConfig> inner = new LinkedHashMap<>();
                if (byCaller != null) {
                    byCaller.forEach((callerClass, limit) -> {
                        limit.validate();
                        inner.put(callerClass, limit);
                    });
                }
                copy.put(endpoint, Collections.unmodifiableMap(inner));
            });
        }
        this.limitsByEndpoint = Collections.unmodifiableMap(copy);
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    public RateLimitResult check(String endpoint, CallerClass callerClass, String identifier) {
        return check(endpoint, callerClass, identifier, null);
    }

    /**
     * 检查并扣减一次额度
     *
     * @param endpoint 接口标识
     * @param callerClass 调用方类别
     * @param identifier 调用方标识（用户 ID 或客户端地址），为空时按 anonymous 计
     * @param now 检查时间，为 null 时取时钟当前时间
     * @return 允许时的结果
     * @throws RateLimitExceededException 超出额度
     */
    public RateLimitResult check(String endpoint, CallerClass callerClass, String identifier, Instant now) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        Objects.requireNonNull(callerClass, "callerClass must not be null");
        Instant currentTime = now == null ? clock.instant() : now;
        String effectiveIdentifier = (identifier == null || identifier.isEmpty()) ? ANONYMOUS_IDENTIFIER : identifier;
        String key = buildKey(endpoint, callerClass, effectiveIdentifier);
        LimitConfig limit = resolveLimit(endpoint, callerClass);

        RateLimitResult result;
        synchronized (lockFor(key)) {
            result = limit.getStrategy() == RateLimitStrategy.TOKEN_BUCKET
                    ? checkTokenBucket(key, limit, toEpochSeconds(currentTime))
                    : checkSlidingWindow(key, limit, toEpochSeconds(currentTime));
        }

        logEvent(endpoint, callerClass, effectiveIdentifier, limit, result);

        if (!result.isAllowed()) {
            throw new RateLimitExceededException(endpoint, callerClass, result);
        }
        return result;
    }

    LimitConfig resolveLimit(String endpoint, CallerClass callerClass) {
        LimitConfig exact = limitsByEndpoint.getOrDefault(endpoint, Map.of()).get(callerClass);
        if (exact != null) {
            return exact;
        }
        LimitConfig wildcard = limitsByEndpoint.getOrDefault(WILDCARD_ENDPOINT, Map.of()).get(callerClass);
        if (wildcard != null) {
            return wildcard;
        }
        return defaultLimit;
    }

    static String buildKey(String endpoint, CallerClass callerClass, String identifier) {
        return "rl:" + endpoint + ":" + callerClass.key() + ":" + identifier;
    }

    private Object lockFor(String key) {
        return locks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    private RateLimitResult checkTokenBucket(String key, LimitConfig limit, double now) {
        double capacity = limit.getRequests();
        double window = limit.getWindowSeconds();
        double refillRate = capacity / window;

        Optional<TokenBucketState> stored = storage.get(key).flatMap(raw -> readValue(key, raw, TokenBucketState.class));
        if (stored.isEmpty()) {
            double tokens = capacity - 1.0d;
            saveValue(key, new TokenBucketState(tokens, now), limit);
            return new RateLimitResult(true, (int) tokens, toInstant(now + window));
        }

        TokenBucketState state = stored.get();
        double elapsed = Math.max(0.0d, now - state.getLastRefillAt());
        double tokens = Math.min(capacity, state.getTokens() + elapsed * refillRate);

        if (tokens < 1.0d) {
            double retryAfter = now + (1.0d - tokens) / refillRate;
            saveValue(key, new TokenBucketState(tokens, now), limit);
            return new RateLimitResult(false, (int) tokens, toInstant(retryAfter));
        }

        tokens -= 1.0d;
        saveValue(key, new TokenBucketState(tokens, now), limit);
        double resetAt = now + (capacity - tokens) / refillRate;
        return new RateLimitResult(true, (int) tokens, toInstant(resetAt));
    }

    private RateLimitResult checkSlidingWindow(String key, LimitConfig limit, double now) {
        double window = limit.getWindowSeconds();
        double windowStart = now - window;

        List<Double> timestamps = new ArrayList<>();
        storage.get(key)
                .flatMap(raw -> readValue(key, raw, TIMESTAMPS_TYPE))
                .ifPresent(stored -> stored.stream()
                        .filter(ts -> ts != null && ts >= windowStart)
                        .forEach(timestamps::add));
        timestamps.add(now);
        saveValue(key, timestamps, limit);

        int used = timestamps.size();
        double oldest = Collections.min(timestamps);
        Instant resetAt = toInstant(oldest + window);
        if (used > limit.getRequests()) {
            return new RateLimitResult(false, 0, resetAt);
        }
        return new RateLimitResult(true, limit.getRequests() - used, resetAt);
    }

    private <T> Optional<T> readValue(String key, String raw, Class<T> type) {
        try {
            return Optional.ofNullable(objectMapper.readValue(raw, type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable rate-limit state for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private <T> Optional<T> readValue(String key, String raw, TypeReference<T> type) {
        try {
            return Optional.ofNullable(objectMapper.readValue(raw, type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable rate-limit state for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void saveValue(String key, Object value, LimitConfig limit) {
        try {
            storage.set(key, objectMapper.writeValueAsString(value), limit.getWindowSeconds());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rate-limit state for " + key, e);
        }
    }

    private void logEvent(String endpoint, CallerClass callerClass, String identifier,
                          LimitConfig limit, RateLimitResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("endpoint", endpoint);
        payload.put("caller_class", callerClass.key());
        payload.put("identifier", identifier);
        payload.put("strategy", limit.getStrategy().key());
        payload.put("allowed", result.isAllowed());
        payload.put("remaining", result.getRemaining());
        payload.put("reset_at", result.getResetAt() == null ? null : result.getResetAt().toString());
        try {
            log.info("rate_limit_event={}", objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            log.info("rate_limit_event={}", payload);
        }
    }

    private static double toEpochSeconds(Instant instant) {
        return instant.toEpochMilli() / 1000.0d;
    }

    private static Instant toInstant(double epochSeconds) {
        return Instant.ofEpochMilli(Math.round(epochSeconds * 1000.0d));
    }
}
