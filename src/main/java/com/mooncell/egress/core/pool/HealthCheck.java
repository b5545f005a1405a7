package com.mooncell.egress.core.pool;

/**
 * 地址探活函数，抛出异常视为不健康
 */
@FunctionalInterface
public interface HealthCheck {

    boolean check(String address) throws Exception;
}
