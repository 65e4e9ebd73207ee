package com.footage.platform.scheduler.driver;

import com.footage.platform.scheduler.config.SchedulerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the single scheduler thread pool that runs every {@link PeriodicTask} at a fixed rate.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "scheduler.driver", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerDriver implements SmartLifecycle {

    private final List<PeriodicTask> tasks;
    private final SchedulerProperties properties;
    private final Clock clock;
    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();

    private ThreadPoolTaskScheduler taskScheduler;
    private volatile boolean running;

    public SchedulerDriver(List<PeriodicTask> tasks, SchedulerProperties properties, Clock clock) {
        this.tasks = List.copyOf(tasks);
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(properties.getDriver().getPoolSize());
        taskScheduler.setThreadNamePrefix("scheduler-driver-");
        taskScheduler.setClock(clock);
        taskScheduler.initialize();

        for (PeriodicTask task : tasks) {
            try {
                task.onStart();
            } catch (RuntimeException e) {
                log.error("Start hook of task {} failed: {}", task.name(), e.getMessage(), e);
            }
            scheduled.add(taskScheduler.scheduleAtFixedRate(
                    () -> runSafely(task),
                    clock.instant().plus(task.initialDelay()),
                    task.interval()));
            log.info("Scheduled task {} every {}", task.name(), task.interval());
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        scheduled.forEach(future -> future.cancel(false));
        scheduled.clear();
        taskScheduler.shutdown();
        taskScheduler = null;
        running = false;
        log.info("Scheduler driver stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void runSafely(PeriodicTask task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Task {} failed: {}", task.name(), e.getMessage(), e);
        }
    }
}
