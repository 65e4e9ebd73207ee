package com.footage.platform.scheduler.queue;

import com.footage.platform.scheduler.config.SchedulerProperties;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(base * 2^(attempt-1), max)}.
 */
public class RetryPolicy {

    private final Duration base;
    private final Duration max;

    public RetryPolicy(Duration base, Duration max) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("Backoff base must be positive");
        }
        if (max.compareTo(base) < 0) {
            throw new IllegalArgumentException("Backoff max must not be below base");
        }
        this.base = base;
        this.max = max;
    }

    public static RetryPolicy from(SchedulerProperties.Queue queue) {
        return new RetryPolicy(queue.getBackoffBase(), queue.getBackoffMax());
    }

    public Duration delayFor(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        // 2^31 * any positive base is already past every sane max
        if (exponent >= 31) {
            return max;
        }
        Duration delay = base.multipliedBy(1L << exponent);
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
