package com.mooncell.egress.core.rate;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 令牌桶持久化状态，时间为 epoch 秒
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
class TokenBucketState {
    @JsonProperty("tokens")
    private double tokens;
    @JsonProperty("last")
    private double lastRefillAt;
}
