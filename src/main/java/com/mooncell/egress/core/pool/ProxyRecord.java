package com.mooncell.egress.core.pool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 单个出口地址的健康统计
 * <p>
 * 活体对象只在 {@link ProxyPoolManager} 的锁内修改，对外一律返回 {@link #copy()}。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyRecord {
    private String address;
    private long successes;
    private long failures;
    /** 自上次成功或重新激活以来的连续失败次数 */
    private int consecutiveFailures;
    private Instant lastSuccessAt;
    private Instant lastFailureAt;
    /** 是否参与轮询选择 */
    @Builder.Default
    private boolean active = true;
    /** 最近一次下线的时间，在线时为 null，清理按它计时 */
    private Instant inactiveSince;
    private long totalDurationMs;
    private long requests;

    public static ProxyRecord fresh(String address) {
        return ProxyRecord.builder().address(address).build();
    }

    public ProxyRecord copy() {
        return ProxyRecord.builder()
                .address(address)
                .successes(successes)
                .failures(failures)
                .consecutiveFailures(consecutiveFailures)
                .lastSuccessAt(lastSuccessAt)
                .lastFailureAt(lastFailureAt)
                .active(active)
                .inactiveSince(inactiveSince)
                .totalDurationMs(totalDurationMs)
                .requests(requests)
                .build();
    }
}
