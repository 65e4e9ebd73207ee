package com.footage.platform.scheduler.queue;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(Duration.ofMinutes(2), Duration.ofHours(1));

    @Test
    void doublesPerAttempt() {
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofMinutes(2));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofMinutes(4));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofMinutes(8));
    }

    @Test
    void cappedAtMaximum() {
        assertThat(policy.delayFor(6)).isEqualTo(Duration.ofHours(1));
        assertThat(policy.delayFor(64)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new RetryPolicy(Duration.ZERO, Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(Duration.ofHours(2), Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
