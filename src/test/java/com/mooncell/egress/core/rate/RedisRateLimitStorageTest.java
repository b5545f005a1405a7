package com.mooncell.egress.core.rate;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisRateLimitStorageTest {

    @Test
    @SuppressWarnings("unchecked")
    void delegatesToRedisWithTtl() {
        StringRedisTemplate template = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(template.opsForValue()).thenReturn(ops);
        when(ops.get("mooncell:rl:/a:anonymous:ip")).thenReturn("{\"tokens\":1.0,\"last\":2.0}");
        RedisRateLimitStorage storage = new RedisRateLimitStorage(template);

        storage.set("rl:/a:anonymous:ip", "[1.0]", 10);

        verify(ops).set("mooncell:rl:/a:anonymous:ip", "[1.0]", 10, TimeUnit.SECONDS);
        assertEquals(Optional.of("{\"tokens\":1.0,\"last\":2.0}"), storage.get("rl:/a:anonymous:ip"));
        assertEquals(Optional.empty(), storage.get("missing"));
    }
}
