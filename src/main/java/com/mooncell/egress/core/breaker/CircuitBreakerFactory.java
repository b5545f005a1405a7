package com.mooncell.egress.core.breaker;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按调用点名称发放熔断器，同名复用同一实例
 */
public class CircuitBreakerFactory {
    private final int maxFailures;
    private final Duration baseBackoff;
    private final Duration maxBackoff;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerFactory(int maxFailures, Duration baseBackoff, Duration maxBackoff, Clock clock) {
        this.maxFailures = maxFailures;
        this.baseBackoff = baseBackoff;
        this.maxBackoff = maxBackoff;
        this.clock = clock;
    }

    public CircuitBreaker forCallSite(String callSite) {
        return breakers.computeIfAbsent(callSite,
                key -> new CircuitBreaker(key, maxFailures, baseBackoff, maxBackoff, clock));
    }

    public Map<String, CircuitState> states() {
        Map<String, CircuitState> result = new ConcurrentHashMap<>();
        breakers.forEach((key, breaker) -> result.put(key, breaker.getState()));
        return result;
    }
}
