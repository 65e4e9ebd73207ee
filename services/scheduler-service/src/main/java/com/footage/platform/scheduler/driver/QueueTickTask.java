package com.footage.platform.scheduler.driver;

import com.footage.platform.scheduler.config.SchedulerProperties;
import com.footage.platform.scheduler.dto.TickReport;
import com.footage.platform.scheduler.queue.PublishingQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Slf4j
@Component
@RequiredArgsConstructor
public class QueueTickTask implements PeriodicTask {

    private final PublishingQueue publishingQueue;
    private final SchedulerProperties properties;

    @Override
    public String name() {
        return "queue-tick";
    }

    @Override
    public Duration interval() {
        return properties.getQueue().getTickInterval();
    }

    @Override
    public void onStart() {
        publishingQueue.recoverInterruptedDispatches();
    }

    @Override
    public void run() {
        TickReport report = publishingQueue.tick();
        if (report.getAdmitted() > 0 || report.getDeferred() > 0) {
            log.debug("Queue tick: {}", report);
        }
    }
}
