package com.mooncell.egress.core.breaker;

/**
 * 熔断器状态
 * <pre>
 *   CLOSED --失败数达到上限--> OPEN --退避期结束--> HALF_OPEN --成功--> CLOSED
 *                                                   HALF_OPEN --失败--> OPEN
 * </pre>
 */
public enum BreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
