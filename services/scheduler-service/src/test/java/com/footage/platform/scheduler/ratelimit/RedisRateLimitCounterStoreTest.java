package com.footage.platform.scheduler.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisRateLimitCounterStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisRateLimitCounterStore store;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        store = new RedisRateLimitCounterStore(redisTemplate);
    }

    @Test
    void firstIncrementSetsExpiry() {
        when(valueOperations.increment("key")).thenReturn(1L);

        assertThat(store.increment("key", Duration.ofHours(2))).isEqualTo(1);

        verify(redisTemplate).expire("key", Duration.ofHours(2));
    }

    @Test
    void laterIncrementsKeepExistingExpiry() {
        when(valueOperations.increment("key")).thenReturn(4L);

        assertThat(store.increment("key", Duration.ofHours(2))).isEqualTo(4);

        verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    void getReadsStoredValue() {
        when(valueOperations.get("key")).thenReturn("7");
        when(valueOperations.get("other")).thenReturn(null);

        assertThat(store.get("key")).isEqualTo(7);
        assertThat(store.get("other")).isZero();
    }

    @Test
    void decrementDelegatesToRedis() {
        store.decrement("key");

        verify(valueOperations).decrement("key");
    }
}
