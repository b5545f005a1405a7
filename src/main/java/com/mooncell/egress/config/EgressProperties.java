package com.mooncell.egress.config;

import com.mooncell.egress.core.rate.CallerClass;
import com.mooncell.egress.core.rate.LimitConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * egress.* 配置项
 * <p>
 * 调度间隔（egress.pool.maintenance-interval-ms、egress.sampling.interval-seconds、
 * egress.rate-limit.purge-interval-ms、egress.recalibration.*）和 egress.rate-limit.storage
 * 直接由 {@code @Scheduled} / {@code @ConditionalOnProperty} 占位符读取，不在这里绑定。
 */
@Data
@ConfigurationProperties(prefix = "egress")
public class EgressProperties {
    private Pool pool = new Pool();
    private Breaker breaker = new Breaker();
    private RateLimit rateLimit = new RateLimit();
    private Sampling sampling = new Sampling();

    @Data
    public static class Pool {
        /** 直接配置的地址列表，addressFile 非空时忽略 */
        private List<String> addresses = new ArrayList<>();
        /** 地址文件，每行一个，# 开头为注释 */
        private String addressFile;
        private int maxConsecutiveFailures = 3;
        private long failureCooldownSeconds = 60;
        private long healthCheckIntervalSeconds = 60;
    }

    @Data
    public static class Breaker {
        private int maxFailures = 3;
        private long baseBackoffMs = 500;
        private long maxBackoffMs = 30_000;
    }

    @Data
    public static class RateLimit {
        private LimitConfig defaultLimit = new LimitConfig(60, 60);
        /** endpoint → 调用方类别 → 限流配置，endpoint 为 * 表示通配 */
        private Map<String, Map<CallerClass, LimitConfig>> limits = new LinkedHashMap<>();
    }

    @Data
    public static class Sampling {
        /** 默认保留 30 天的分钟级采样 */
        private int maxSamples = 43_200;
    }
}
