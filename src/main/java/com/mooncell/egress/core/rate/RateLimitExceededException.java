package com.mooncell.egress.core.rate;

import lombok.Getter;

import java.time.Instant;

/**
 * 超出限流额度，调用方可在 retryAfter 之后重试
 */
@Getter
public class RateLimitExceededException extends RuntimeException {
    private final String endpoint;
    private final CallerClass callerClass;
    private final Instant retryAfter;
    private final RateLimitResult result;

    public RateLimitExceededException(String endpoint, CallerClass callerClass, RateLimitResult result) {
        super("Rate limit exceeded for " + endpoint + " (" + callerClass.key() + "), retry after " + result.getResetAt());
        this.endpoint = endpoint;
        this.callerClass = callerClass;
        this.retryAfter = result.getResetAt();
        this.result = result;
    }
}
