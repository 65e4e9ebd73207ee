package com.footage.platform.scheduler.config;

import com.footage.platform.scheduler.ratelimit.InMemoryRateLimitCounterStore;
import com.footage.platform.scheduler.ratelimit.RateLimitCounterStore;
import com.footage.platform.scheduler.ratelimit.RedisRateLimitCounterStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class RateLimitConfig {

    @Bean
    @ConditionalOnProperty(name = "scheduler.rate-limit.store", havingValue = "redis")
    public RateLimitCounterStore redisRateLimitCounterStore(StringRedisTemplate redisTemplate) {
        return new RedisRateLimitCounterStore(redisTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(RateLimitCounterStore.class)
    public RateLimitCounterStore inMemoryRateLimitCounterStore(Clock clock) {
        return new InMemoryRateLimitCounterStore(clock);
    }
}
