package com.footage.platform.scheduler.driver;

import com.footage.platform.scheduler.config.SchedulerProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerDriverTest {

    private SchedulerDriver driver;

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.stop();
        }
    }

    private static final class CountingTask implements PeriodicTask {
        private final CountDownLatch runs;
        private final AtomicInteger starts = new AtomicInteger();
        private final boolean failing;

        private CountingTask(int expectedRuns, boolean failing) {
            this.runs = new CountDownLatch(expectedRuns);
            this.failing = failing;
        }

        @Override
        public String name() {
            return failing ? "failing" : "counting";
        }

        @Override
        public Duration interval() {
            return Duration.ofMillis(20);
        }

        @Override
        public void onStart() {
            starts.incrementAndGet();
        }

        @Override
        public void run() {
            runs.countDown();
            if (failing) {
                throw new IllegalStateException("task failure");
            }
        }
    }

    @Test
    void runsTasksRepeatedlyAndSurvivesFailures() throws InterruptedException {
        CountingTask healthy = new CountingTask(3, false);
        CountingTask failing = new CountingTask(3, true);
        driver = new SchedulerDriver(List.of(healthy, failing), new SchedulerProperties(), Clock.systemUTC());

        driver.start();

        assertThat(driver.isRunning()).isTrue();
        assertThat(healthy.runs.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(failing.runs.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(healthy.starts.get()).isEqualTo(1);
    }

    @Test
    void startAndStopAreIdempotent() {
        CountingTask task = new CountingTask(1, false);
        driver = new SchedulerDriver(List.of(task), new SchedulerProperties(), Clock.systemUTC());

        driver.start();
        driver.start();
        assertThat(task.starts.get()).isEqualTo(1);

        driver.stop();
        driver.stop();
        assertThat(driver.isRunning()).isFalse();
    }
}
