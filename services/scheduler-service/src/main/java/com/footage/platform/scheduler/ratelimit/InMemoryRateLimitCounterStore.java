package com.footage.platform.scheduler.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRateLimitCounterStore implements RateLimitCounterStore {

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateLimitCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long increment(String key, Duration ttl) {
        Instant now = clock.instant();
        counters.values().removeIf(counter -> counter.isExpired(now));
        Counter counter = counters.compute(key, (k, existing) ->
                existing == null || existing.isExpired(now)
                        ? new Counter(1, now.plus(ttl))
                        : new Counter(existing.value + 1, existing.expiresAt));
        return counter.value;
    }

    @Override
    public void decrement(String key) {
        counters.computeIfPresent(key, (k, existing) -> new Counter(Math.max(0, existing.value - 1), existing.expiresAt));
    }

    @Override
    public long get(String key) {
        Counter counter = counters.get(key);
        return counter == null || counter.isExpired(clock.instant()) ? 0 : counter.value;
    }

    private static final class Counter {
        private final long value;
        private final Instant expiresAt;

        private Counter(long value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
