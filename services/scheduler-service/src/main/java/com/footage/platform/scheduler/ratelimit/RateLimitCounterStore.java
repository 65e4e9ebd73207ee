package com.footage.platform.scheduler.ratelimit;

import java.time.Duration;

/**
 * Atomic counters keyed by rate-limit window. A key that outlives its ttl reads as zero.
 */
public interface RateLimitCounterStore {

    long increment(String key, Duration ttl);

    void decrement(String key);

    long get(String key);
}
