package com.footage.platform.scheduler.driver;

import com.footage.platform.scheduler.analytics.AnalyticsRefresher;
import com.footage.platform.scheduler.config.SchedulerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@RequiredArgsConstructor
public class StatsRecomputeTask implements PeriodicTask {

    private final AnalyticsRefresher analyticsRefresher;
    private final SchedulerProperties properties;

    @Override
    public String name() {
        return "stats-recompute";
    }

    @Override
    public Duration interval() {
        return properties.getAnalytics().getRecomputeInterval();
    }

    // Let the first sample fetch land before the first recompute
    @Override
    public Duration initialDelay() {
        return Duration.ofMinutes(5);
    }

    @Override
    public void run() {
        analyticsRefresher.recomputeStats();
    }
}
