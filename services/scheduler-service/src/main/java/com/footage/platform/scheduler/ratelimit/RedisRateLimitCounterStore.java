package com.footage.platform.scheduler.ratelimit;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Shares window counters between scheduler instances. INCR is atomic, so two instances cannot both
 * see the same count.
 */
@RequiredArgsConstructor
public class RedisRateLimitCounterStore implements RateLimitCounterStore {

    private final StringRedisTemplate redisTemplate;

    @Override
    public long increment(String key, Duration ttl) {
        Long count = redisTemplate.opsForValue().increment(key);

        if (count != null && count == 1) {
            redisTemplate.expire(key, ttl);
        }

        return count != null ? count : 0;
    }

    @Override
    public void decrement(String key) {
        redisTemplate.opsForValue().decrement(key);
    }

    @Override
    public long get(String key) {
        String value = redisTemplate.opsForValue().get(key);
        return value != null ? Long.parseLong(value) : 0;
    }
}
