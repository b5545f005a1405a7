package com.mooncell.egress.core.rate;

/**
 * 限流中间件所需的请求视图，由外层的 HTTP/RPC 适配器实现
 */
public interface RateLimitedRequest {

    /**
     * @return 接口标识，为空时按通配 endpoint 处理
     */
    String getEndpoint();

    /**
     * @return 请求是否携带已认证身份
     */
    boolean isAuthenticated();

    String getUserId();

    String getClientAddress();
}
