package com.mooncell.egress.core.rate;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RateLimitMiddlewareTest {

    @Getter
    @AllArgsConstructor
    static class FakeRequest implements RateLimitedRequest {
        private final String endpoint;
        private final boolean authenticated;
        private final String userId;
        private final String clientAddress;
    }

    private static RateLimiter limiter() {
        return new RateLimiter(new InMemoryRateLimitStorage(),
                Map.of("/endpoint", Map.of(CallerClass.ANONYMOUS, new LimitConfig(1, 10))),
                new LimitConfig(1, 10), new ObjectMapper(), Clock.systemUTC());
    }

    @Test
    void blocksAfterLimitWithoutCallingHandler() {
        AtomicInteger calls = new AtomicInteger();
        Function<FakeRequest, String> handler = new RateLimitMiddleware(limiter()).wrap(request -> {
            calls.incrementAndGet();
            return "ok";
        });
        FakeRequest request = new FakeRequest("/endpoint", false, null, "127.0.0.1");

        assertEquals("ok", handler.apply(request));
        assertThrows(RateLimitExceededException.class, () -> handler.apply(request));
        assertEquals(1, calls.get());
    }

    @Test
    void classifiesAuthenticatedRequestsByUserId() {
        RateLimiter limiter = mock(RateLimiter.class);
        when(limiter.check(any(), any(), any())).thenReturn(new RateLimitResult(true, 1, null));
        RateLimitMiddleware middleware = new RateLimitMiddleware(limiter);

        middleware.admit(new FakeRequest("/orders", true, "user-7", "10.0.0.1"));
        middleware.admit(new FakeRequest("/orders", false, "user-7", "10.0.0.1"));
        middleware.admit(new FakeRequest(null, false, null, "10.0.0.2"));

        verify(limiter).check(eq("/orders"), eq(CallerClass.AUTHENTICATED), eq("user-7"));
        verify(limiter).check(eq("/orders"), eq(CallerClass.ANONYMOUS), eq("10.0.0.1"));
        verify(limiter).check(eq("*"), eq(CallerClass.ANONYMOUS), eq("10.0.0.2"));
    }
}
