package com.footage.platform.scheduler.driver;

import com.footage.platform.scheduler.analytics.AnalyticsRefresher;
import com.footage.platform.scheduler.config.SchedulerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@RequiredArgsConstructor
public class AnalyticsFetchTask implements PeriodicTask {

    private final AnalyticsRefresher analyticsRefresher;
    private final SchedulerProperties properties;

    @Override
    public String name() {
        return "analytics-fetch";
    }

    @Override
    public Duration interval() {
        return properties.getAnalytics().getFetchInterval();
    }

    @Override
    public void run() {
        analyticsRefresher.refreshSamples();
    }
}
