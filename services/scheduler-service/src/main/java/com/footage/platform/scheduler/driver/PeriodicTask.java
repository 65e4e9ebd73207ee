package com.footage.platform.scheduler.driver;

import java.time.Duration;

/**
 * Unit of recurring background work run by the {@link SchedulerDriver}.
 */
public interface PeriodicTask {

    String name();

    Duration interval();

    default Duration initialDelay() {
        return Duration.ZERO;
    }

    void run();

    /**
     * Called once when the driver starts, before the first run is scheduled.
     */
    default void onStart() {
    }
}
