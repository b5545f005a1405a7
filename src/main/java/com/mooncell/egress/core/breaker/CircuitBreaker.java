package com.mooncell.egress.core.breaker;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * 单调用点熔断器，失败后按指数退避重新放行。
 *
 * <p>状态机：
 * <ul>
 *   <li><b>CLOSED</b>：正常放行，失败次数达到 maxFailures 时进入 OPEN</li>
 *   <li><b>OPEN</b>：退避期内直接抛出 {@link CircuitOpenException}，不发起调用</li>
 *   <li><b>HALF_OPEN</b>：退避期结束后放行一次试探调用，成功则回到全新的 CLOSED，失败则重新进入 OPEN</li>
 * </ul>
 *
 * <p>退避时长为 {@code min(maxBackoff, baseBackoff * 2^(failures-1))}。
 *
 * <p>实例内部不加锁：一个实例对应一个逻辑调用点，跨线程共享同一实例时由调用方自行互斥。
 */
@Slf4j
public class CircuitBreaker {
    /** 2^30 之后退避早已被 maxBackoff 截断，限制指数避免溢出 */
    private static final int MAX_BACKOFF_EXPONENT = 30;

    private final String name;
    private final int maxFailures;
    private final Duration baseBackoff;
    private final Duration maxBackoff;
    private final Clock clock;

    private CircuitState state = CircuitState.closed();

    public CircuitBreaker(String name, int maxFailures, Duration baseBackoff, Duration maxBackoff, Clock clock) {
        if (maxFailures < 1) {
            throw new IllegalArgumentException("maxFailures must be >= 1");
        }
        if (baseBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.maxFailures = maxFailures;
        this.baseBackoff = baseBackoff;
        this.maxBackoff = maxBackoff;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public CircuitBreaker(String name, int maxFailures, Duration baseBackoff, Duration maxBackoff) {
        this(name, maxFailures, baseBackoff, maxBackoff, Clock.systemUTC());
    }

    /**
     * 通过熔断器执行一次调用
     *
     * @param callable 被保护的调用
     * @return 调用结果
     * @throws CircuitOpenException 处于 OPEN 且未到 nextTryAt
     * @throws Exception 被保护调用抛出的原始异常
     */
    public <T> T execute(Callable<T> callable) throws Exception {
        Objects.requireNonNull(callable, "callable must not be null");
        Instant now = clock.instant();
        if (state.getState() == BreakerState.OPEN) {
            Instant nextTryAt = state.getNextTryAt();
            if (nextTryAt != null && now.isBefore(nextTryAt)) {
                throw new CircuitOpenException(name, nextTryAt);
            }
            state.setState(BreakerState.HALF_OPEN);
            log.debug("Breaker {} half-open, probing", name);
        }

        T result;
        try {
            result = callable.call();
        } catch (Exception e) {
            recordFailure(now);
            throw e;
        }
        if (state.getFailures() > 0 || state.getState() != BreakerState.CLOSED) {
            log.info("Breaker {} closed after {} failure(s)", name, state.getFailures());
        }
        state = CircuitState.closed();
        return result;
    }

    /**
     * 无受检异常的调用入口
     */
    public <T> T call(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, "supplier must not be null");
        try {
            return execute(supplier::get);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            // Supplier 不会抛出受检异常
            throw new IllegalStateException(e);
        }
    }

    private void recordFailure(Instant now) {
        boolean probing = state.getState() == BreakerState.HALF_OPEN;
        state.setFailures(state.getFailures() + 1);
        state.setLastFailureAt(now);
        if (!probing && state.getFailures() < maxFailures) {
            return;
        }
        Duration backoff = backoffFor(state.getFailures());
        state.setNextTryAt(now.plus(backoff));
        state.setState(BreakerState.OPEN);
        log.warn("Breaker {} opened: failures={}, retry in {} ms", name, state.getFailures(), backoff.toMillis());
    }

    Duration backoffFor(int failures) {
        int exponent = Math.min(MAX_BACKOFF_EXPONENT, Math.max(0, failures - 1));
        double millis = baseBackoff.toMillis() * Math.pow(2, exponent);
        return Duration.ofMillis((long) Math.min(maxBackoff.toMillis(), millis));
    }

    /**
     * @return 当前状态的副本
     */
    public CircuitState getState() {
        return state.copy();
    }

    public String getName() {
        return name;
    }
}
