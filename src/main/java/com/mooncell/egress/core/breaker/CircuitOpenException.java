package com.mooncell.egress.core.breaker;

import lombok.Getter;

import java.time.Instant;

/**
 * 熔断器处于 OPEN 且退避期未结束时抛出，调用并未真正发生。
 * <p>
 * 与被包装调用自身抛出的异常区分开，调用方可以据此判断是"主动拦截"还是"上游失败"。
 */
@Getter
public class CircuitOpenException extends RuntimeException {

    private final String breakerName;
    private final Instant nextTryAt;

    public CircuitOpenException(String breakerName, Instant nextTryAt) {
        super("circuit_open");
        this.breakerName = breakerName;
        this.nextTryAt = nextTryAt;
    }
}
