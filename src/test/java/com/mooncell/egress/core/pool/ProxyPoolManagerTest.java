package com.mooncell.egress.core.pool;

import com.mooncell.egress.MutableClock;
import com.mooncell.egress.metrics.MetricsSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProxyPoolManagerTest {

    private MutableClock clock;
    private List<String> events;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
        events = new ArrayList<>();
    }

    private ProxyPoolManager pool(PoolPolicy policy, String... addresses) {
        return ProxyPoolManager.builder()
                .addresses(List.of(addresses))
                .policy(policy)
                .metricsSink((event, payload) -> events.add(event + ":" + payload.get("address")))
                .clock(clock)
                .build();
    }

    private static List<String> take(ProxyPoolManager pool, int count) {
        List<String> selected = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            selected.add(pool.selectNext().orElse(null));
        }
        return selected;
    }

    @Test
    @DisplayName("healthy addresses are returned in round-robin order")
    void roundRobin() {
        ProxyPoolManager pool = pool(null, "a", "b", "c");

        assertEquals(List.of("a", "b", "c", "a"), take(pool, 4));
    }

    @Test
    void emptyPoolSelectsNothing() {
        assertEquals(Optional.empty(), new ProxyPoolManager(List.of()).selectNext());
    }

    @Test
    void duplicateAndBlankAddressesAreIgnored() {
        ProxyPoolManager pool = new ProxyPoolManager(List.of("a", " ", "a", "b"));

        assertEquals(List.of("a", "b"), pool.addresses());
    }

    @Test
    @DisplayName("an address is skipped after reaching the consecutive failure limit")
    void deactivatesAfterConsecutiveFailures() {
        ProxyPoolManager pool = pool(new PoolPolicy(2, 60), "a", "b", "c");

        pool.reportFailure("b");
        assertTrue(pool.snapshotMetrics().get("b").isActive());
        pool.reportFailure("b");

        assertFalse(pool.snapshotMetrics().get("b").isActive());
        assertEquals(List.of("a", "c", "a", "c"), take(pool, 4));
    }

    @Test
    void successResetsFailureStreak() {
        ProxyPoolManager pool = pool(new PoolPolicy(2, 60), "a");

        pool.reportFailure("a");
        pool.reportSuccess("a", 40);
        pool.reportFailure("a");

        ProxyRecord record = pool.snapshotMetrics().get("a");
        assertTrue(record.isActive());
        assertEquals(1, record.getConsecutiveFailures());
        assertEquals(1, record.getSuccesses());
        assertEquals(2, record.getFailures());
        assertEquals(3, record.getRequests());
        assertEquals(40, record.getTotalDurationMs());
    }

    @Test
    @DisplayName("inactive addresses come back once the cooldown has elapsed")
    void reactivatesAfterCooldown() {
        ProxyPoolManager pool = pool(new PoolPolicy(1, 60), "a", "b");
        pool.reportFailure("a");
        pool.reportFailure("b");

        clock.advance(Duration.ofSeconds(59));
        assertEquals(Optional.empty(), pool.selectNext());

        clock.advance(Duration.ofSeconds(1));
        Optional<String> selected = pool.selectNext();

        assertTrue(selected.isPresent());
        ProxyRecord record = pool.snapshotMetrics().get(selected.get());
        assertTrue(record.isActive());
        assertEquals(0, record.getConsecutiveFailures());
    }

    @Test
    void successReactivatesImmediately() {
        ProxyPoolManager pool = pool(new PoolPolicy(1, 600), "a");
        pool.reportFailure("a");
        assertEquals(Optional.empty(), pool.selectNext());

        pool.reportSuccess("a");

        assertEquals(Optional.of("a"), pool.selectNext());
    }

    @Test
    @DisplayName("addresses inactive for ten cooldowns are pruned together with their stats")
    void prunesLongInactiveAddresses() {
        ProxyPoolManager pool = pool(new PoolPolicy(1, 10), "a", "b");
        pool.reportFailure("a");

        clock.advance(Duration.ofSeconds(10L * ProxyPoolManager.PRUNE_COOLDOWN_MULTIPLIER));

        assertEquals(Optional.of("b"), pool.selectNext());
        assertEquals(List.of("b"), pool.addresses());
        assertFalse(pool.snapshotMetrics().containsKey("a"));
        assertTrue(events.contains("proxy_pruned:a"));
    }

    @Test
    @DisplayName("an address that keeps failing health checks is still pruned ten cooldowns after going inactive")
    void prunesAddressKeptDownByHealthCheck() {
        ProxyPoolManager pool = ProxyPoolManager.builder()
                .addresses(List.of("a", "b"))
                .policy(new PoolPolicy(1, 10))
                .healthCheck(address -> !"a".equals(address))
                .healthCheckInterval(Duration.ofSeconds(10))
                .metricsSink((event, payload) -> events.add(event + ":" + payload.get("address")))
                .clock(clock)
                .build();

        pool.maintain();
        Instant wentDown = pool.snapshotMetrics().get("a").getInactiveSince();
        for (int i = 0; i < 9; i++) {
            clock.advance(Duration.ofSeconds(10));
            pool.maintain();
        }
        ProxyRecord beforeDeadline = pool.snapshotMetrics().get("a");
        assertFalse(beforeDeadline.isActive());
        assertEquals(wentDown, beforeDeadline.getInactiveSince());
        assertEquals(10, beforeDeadline.getFailures());

        clock.advance(Duration.ofSeconds(10));
        pool.maintain();

        assertEquals(List.of("b"), pool.addresses());
        assertFalse(pool.snapshotMetrics().containsKey("a"));
        assertTrue(events.contains("proxy_pruned:a"));
    }

    @Test
    void reactivationClearsInactiveSince() {
        ProxyPoolManager pool = pool(new PoolPolicy(1, 10), "a");
        pool.reportFailure("a");
        assertEquals(clock.instant(), pool.snapshotMetrics().get("a").getInactiveSince());

        pool.reportSuccess("a");

        assertNull(pool.snapshotMetrics().get("a").getInactiveSince());
    }

    @Test
    void readdedAddressStartsFresh() {
        ProxyPoolManager pool = pool(new PoolPolicy(1, 10), "a", "b");
        pool.reportFailure("a");
        clock.advance(Duration.ofSeconds(100));
        pool.maintain();

        assertTrue(pool.addAddress("a"));
        assertFalse(pool.addAddress("a"));

        ProxyRecord record = pool.snapshotMetrics().get("a");
        assertTrue(record.isActive());
        assertEquals(0, record.getFailures());
        assertEquals(List.of("b", "a"), pool.addresses());
    }

    @Test
    @DisplayName("health check runs at most once per interval and marks unhealthy addresses")
    void healthCheckRunsPerInterval() {
        AtomicInteger probes = new AtomicInteger();
        ProxyPoolManager pool = ProxyPoolManager.builder()
                .addresses(List.of("a", "b", "c"))
                .policy(new PoolPolicy(1, 600))
                .healthCheck(address -> {
                    probes.incrementAndGet();
                    return !"b".equals(address);
                })
                .healthCheckInterval(Duration.ofSeconds(30))
                .clock(clock)
                .build();

        assertEquals(List.of("a", "c", "a"), take(pool, 3));
        assertEquals(3, probes.get());

        clock.advance(Duration.ofSeconds(30));
        pool.selectNext();
        assertEquals(6, probes.get());
        assertEquals(2, pool.snapshotMetrics().get("a").getSuccesses());
    }

    @Test
    void healthCheckExceptionCountsAsFailure() {
        ProxyPoolManager pool = ProxyPoolManager.builder()
                .addresses(List.of("a", "b"))
                .policy(new PoolPolicy(1, 600))
                .healthCheck(address -> {
                    if ("a".equals(address)) {
                        throw new IllegalStateException("connection refused");
                    }
                    return true;
                })
                .clock(clock)
                .build();

        assertEquals(List.of("b", "b"), take(pool, 2));
        assertFalse(pool.snapshotMetrics().get("a").isActive());
    }

    @Test
    void policyUpdateAppliesToLaterReports() {
        ProxyPoolManager pool = pool(new PoolPolicy(3, 60), "a");
        pool.reportFailure("a");

        pool.setPolicies(2, 120);
        pool.reportFailure("a");

        assertEquals(new PoolPolicy(2, 120), pool.getPolicy());
        assertFalse(pool.snapshotMetrics().get("a").isActive());
        assertThrows(IllegalArgumentException.class, () -> pool.setPolicies(0, 60));
        assertThrows(IllegalArgumentException.class, () -> pool.setPolicies(1, -1));
    }

    @Test
    void snapshotIsDetached() {
        ProxyPoolManager pool = pool(null, "a");
        pool.reportSuccess("a", 10);

        Map<String, ProxyRecord> snapshot = pool.snapshotMetrics();
        snapshot.get("a").setSuccesses(99);
        snapshot.remove("a");

        assertEquals(1, pool.snapshotMetrics().get("a").getSuccesses());
    }

    @Test
    void reportsForUnknownAddressesAreIgnored() {
        ProxyPoolManager pool = pool(null, "a");

        pool.reportFailure("x", 5);
        pool.reportSuccess("y", 5);

        assertEquals(List.of("a"), List.copyOf(pool.snapshotMetrics().keySet()));
        assertTrue(events.isEmpty());
        assertEquals(List.of("a", "a"), take(pool, 2));
    }

    @Test
    void emitsEventsAndSurvivesFailingSink() {
        ProxyPoolManager quiet = pool(null, "a");
        quiet.reportSuccess("a", 12);
        quiet.reportFailure("a", 30);
        assertEquals(List.of("proxy_success:a", "proxy_failure:a"), events);

        MetricsSink broken = (event, payload) -> {
            throw new IllegalStateException("sink down");
        };
        ProxyPoolManager pool = ProxyPoolManager.builder()
                .addresses(List.of("a"))
                .metricsSink(broken)
                .clock(clock)
                .build();
        pool.reportFailure("a");

        assertEquals(1, pool.snapshotMetrics().get("a").getFailures());
    }

    @Test
    void diagnosticsDeriveRates() {
        ProxyPoolManager pool = pool(null, "a");
        pool.reportSuccess("a", 100);
        pool.reportFailure("a", 300);

        ProxyDiagnostic diagnostic = pool.diagnosticSnapshot().get("a");

        assertEquals(200.0d, diagnostic.getAvgLatencyMs());
        assertEquals(0.5d, diagnostic.getErrorRate());
        assertEquals(1.0d, diagnostic.getAvailability());
    }
}
