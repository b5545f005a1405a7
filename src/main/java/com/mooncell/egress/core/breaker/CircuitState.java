package com.mooncell.egress.core.breaker;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 单个调用点的熔断运行态
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CircuitState {
    private BreakerState state = BreakerState.CLOSED;
    /** 自上次关闭以来的失败次数 */
    private int failures;
    private Instant lastFailureAt;
    /** OPEN 状态下允许再次尝试的时间点 */
    private Instant nextTryAt;

    public static CircuitState closed() {
        return new CircuitState(BreakerState.CLOSED, 0, null, null);
    }

    public CircuitState copy() {
        return new CircuitState(state, failures, lastFailureAt, nextTryAt);
    }
}
