package com.mooncell.egress.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mooncell.egress.core.breaker.CircuitBreakerFactory;
import com.mooncell.egress.core.pool.HealthCheck;
import com.mooncell.egress.core.pool.PoolPolicy;
import com.mooncell.egress.core.pool.ProxyListLoader;
import com.mooncell.egress.core.pool.ProxyPoolManager;
import com.mooncell.egress.core.rate.InMemoryRateLimitStorage;
import com.mooncell.egress.core.rate.RateLimitMiddleware;
import com.mooncell.egress.core.rate.RateLimitStorage;
import com.mooncell.egress.core.rate.RateLimiter;
import com.mooncell.egress.core.rate.RedisRateLimitStorage;
import com.mooncell.egress.core.recalibration.RecalibrationController;
import com.mooncell.egress.metrics.LoggingMetricsSink;
import com.mooncell.egress.metrics.MetricsSink;
import com.mooncell.egress.metrics.MetricsSource;
import com.mooncell.egress.metrics.PoolSamplingMetricsSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * 组装各组件：所有配置与协作者都通过构造函数传入，不依赖全局单例
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EgressProperties.class)
public class EgressGuardConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsSink metricsSink(ObjectMapper objectMapper) {
        return new LoggingMetricsSink(objectMapper);
    }

    @Bean
    public ProxyPoolManager proxyPoolManager(EgressProperties properties,
                                             ObjectProvider<HealthCheck> healthCheck,
                                             MetricsSink metricsSink,
                                             Clock clock) {
        EgressProperties.Pool pool = properties.getPool();
        List<String> addresses = pool.getAddressFile() == null || pool.getAddressFile().isBlank()
                ? pool.getAddresses()
                : ProxyListLoader.load(Path.of(pool.getAddressFile()));
        return ProxyPoolManager.builder()
                .addresses(addresses)
                .policy(new PoolPolicy(pool.getMaxConsecutiveFailures(), pool.getFailureCooldownSeconds()))
                .healthCheck(healthCheck.getIfAvailable())
                .healthCheckInterval(Duration.ofSeconds(pool.getHealthCheckIntervalSeconds()))
                .metricsSink(metricsSink)
                .clock(clock)
                .build();
    }

    @Bean
    public PoolSamplingMetricsSource poolSamplingMetricsSource(ProxyPoolManager proxyPoolManager,
                                                               EgressProperties properties,
                                                               Clock clock) {
        return new PoolSamplingMetricsSource(proxyPoolManager, clock, properties.getSampling().getMaxSamples());
    }

    @Bean
    public RecalibrationController recalibrationController(MetricsSource metricsSource,
                                                           ProxyPoolManager proxyPoolManager,
                                                           MetricsSink metricsSink,
                                                           Clock clock) {
        return new RecalibrationController(metricsSource, proxyPoolManager, metricsSink, clock);
    }

    @Bean
    public CircuitBreakerFactory circuitBreakerFactory(EgressProperties properties, Clock clock) {
        EgressProperties.Breaker breaker = properties.getBreaker();
        return new CircuitBreakerFactory(breaker.getMaxFailures(),
                Duration.ofMillis(breaker.getBaseBackoffMs()),
                Duration.ofMillis(breaker.getMaxBackoffMs()),
                clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "egress.rate-limit", name = "storage", havingValue = "memory", matchIfMissing = true)
    public InMemoryRateLimitStorage inMemoryRateLimitStorage(Clock clock) {
        return new InMemoryRateLimitStorage(clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "egress.rate-limit", name = "storage", havingValue = "redis")
    public RedisRateLimitStorage redisRateLimitStorage(StringRedisTemplate stringRedisTemplate) {
        log.info("Rate limiting backed by Redis");
        return new RedisRateLimitStorage(stringRedisTemplate);
    }

    @Bean
    public RateLimiter rateLimiter(RateLimitStorage rateLimitStorage,
                                   EgressProperties properties,
                                   ObjectMapper objectMapper,
                                   Clock clock) {
        EgressProperties.RateLimit rateLimit = properties.getRateLimit();
        return new RateLimiter(rateLimitStorage, rateLimit.getLimits(), rateLimit.getDefaultLimit(), objectMapper, clock);
    }

    @Bean
    public RateLimitMiddleware rateLimitMiddleware(RateLimiter rateLimiter) {
        return new RateLimitMiddleware(rateLimiter);
    }
}
