package com.mooncell.egress.core.rate;

import lombok.RequiredArgsConstructor;

import java.util.function.Function;

/**
 * 在业务处理器之前做限流检查
 * <p>
 * 已认证请求按 authenticated + 用户 ID 计额，其余按 anonymous + 客户端地址计额。
 * 超限时 {@link RateLimitExceededException} 原样抛给调用方，处理器不会被调用。
 */
@RequiredArgsConstructor
public class RateLimitMiddleware {

    private final RateLimiter rateLimiter;

    public <Q extends RateLimitedRequest, R> Function<Q, R> wrap(Function<Q, R> handler) {
        return request -> {
            admit(request);
            return handler.apply(request);
        };
    }

    public RateLimitResult admit(RateLimitedRequest request) {
        String endpoint = request.getEndpoint() == null || request.getEndpoint().isEmpty()
                ? RateLimiter.WILDCARD_ENDPOINT : request.getEndpoint();
        if (request.isAuthenticated()) {
            return rateLimiter.check(endpoint, CallerClass.AUTHENTICATED, request.getUserId());
        }
        return rateLimiter.check(endpoint, CallerClass.ANONYMOUS, request.getClientAddress());
    }
}
