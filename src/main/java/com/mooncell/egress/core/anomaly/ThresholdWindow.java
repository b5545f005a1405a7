package com.mooncell.egress.core.anomaly;

/**
 * 阈值统计使用的固定时间窗口
 */
public enum ThresholdWindow {
    LAST_24H("24h", 24L * 60 * 60),
    LAST_7D("7d", 7L * 24 * 60 * 60),
    LAST_30D("30d", 30L * 24 * 60 * 60);

    private final String key;
    private final long seconds;

    ThresholdWindow(String key, long seconds) {
        this.key = key;
        this.seconds = seconds;
    }

    public String key() {
        return key;
    }

    public long seconds() {
        return seconds;
    }
}
