package com.mooncell.egress.core.rate;

public enum RateLimitStrategy {
    /** 令牌桶：连续补充，容量封顶 */
    TOKEN_BUCKET,
    /** 滑动窗口：统计尾随时间窗口内的请求数 */
    SLIDING_WINDOW;

    public String key() {
        return name().toLowerCase();
    }
}
