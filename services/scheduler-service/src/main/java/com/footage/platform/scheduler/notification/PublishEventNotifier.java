package com.footage.platform.scheduler.notification;

import com.footage.platform.scheduler.config.SchedulerProperties;
import com.footage.platform.scheduler.dto.PublishJobEvent;
import com.footage.platform.scheduler.entity.PublishJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Emits job outcome events for the notification service. Delivery is best-effort and never
 * affects the job that triggered it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PublishEventNotifier {

    private final RabbitTemplate rabbitTemplate;
    private final SchedulerProperties properties;
    private final Clock clock;

    public void jobSucceeded(PublishJob job) {
        send(properties.getNotifications().getPublishedRoutingKey(), job);
    }

    public void jobAbandoned(PublishJob job) {
        send(properties.getNotifications().getAbandonedRoutingKey(), job);
    }

    private void send(String routingKey, PublishJob job) {
        if (!properties.getNotifications().isEnabled()) {
            return;
        }
        PublishJobEvent event = PublishJobEvent.builder()
                .jobId(job.getId())
                .contentId(job.getContentId())
                .platform(job.getPlatform().name().toLowerCase())
                .state(job.getState().name())
                .platformVideoId(job.getPlatformVideoId())
                .lastError(job.getLastError())
                .attempt(job.getAttempt())
                .occurredAt(OffsetDateTime.now(clock))
                .build();
        try {
            rabbitTemplate.convertAndSend(routingKey, event);
        } catch (AmqpException e) {
            log.warn("Failed to emit {} event for job {}: {}", routingKey, job.getId(), e.getMessage());
        }
    }
}
