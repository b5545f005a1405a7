package com.mooncell.egress.core.rate;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内限流存储
 * <p>
 * 基于 ConcurrentHashMap，不同 key 可并发读写；同一 key 的读改写由 {@link RateLimiter} 串行化。
 * 过期条目在读取时清除，也可通过 {@link #purgeExpired()} 批量清理。
 */
@Slf4j
public class InMemoryRateLimitStorage implements RateLimitStorage {

    private final ConcurrentHashMap<String, Entry> store = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateLimitStorage(Clock clock) {
        this.clock = clock;
    }

    public InMemoryRateLimitStorage() {
        this(Clock.systemUTC());
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = store.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt.isBefore(clock.instant())) {
            store.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        store.put(key, new Entry(value, clock.instant().plusSeconds(ttlSeconds)));
    }

    public int purgeExpired() {
        Instant now = clock.instant();
        int before = store.size();
        store.entrySet().removeIf(e -> e.getValue().expiresAt.isBefore(now));
        int removed = before - store.size();
        if (removed > 0) {
            log.debug("Purged {} expired rate-limit keys", removed);
        }
        return Math.max(0, removed);
    }

    public int size() {
        return store.size();
    }

    private static final class Entry {
        private final String value;
        private final Instant expiresAt;

        private Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
