package com.mooncell.egress.core.rate;

import com.mooncell.egress.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class InMemoryRateLimitStorageTest {

    @Test
    void entriesExpireAfterTtl() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        InMemoryRateLimitStorage storage = new InMemoryRateLimitStorage(clock);
        storage.set("k", "v", 10);

        clock.advance(Duration.ofSeconds(10));
        assertEquals(Optional.of("v"), storage.get("k"));

        clock.advance(Duration.ofSeconds(1));
        assertEquals(Optional.empty(), storage.get("k"));
        assertEquals(0, storage.size());
    }

    @Test
    void purgeRemovesOnlyExpiredEntries() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        InMemoryRateLimitStorage storage = new InMemoryRateLimitStorage(clock);
        storage.set("short", "1", 5);
        storage.set("long", "2", 60);

        clock.advance(Duration.ofSeconds(30));

        assertEquals(1, storage.purgeExpired());
        assertEquals(Optional.of("2"), storage.get("long"));
    }
}
