package com.mooncell.egress.core.rate;

/**
 * 调用方类别，用于选择限流配置
 */
public enum CallerClass {
    ANONYMOUS,
    AUTHENTICATED;

    public String key() {
        return name().toLowerCase();
    }
}
