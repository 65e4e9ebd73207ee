package com.footage.platform.scheduler.service;

import com.footage.platform.scheduler.dto.PublishPayload;
import com.footage.platform.scheduler.dto.ScheduleOptions;
import com.footage.platform.scheduler.dto.ScheduleResult;
import com.footage.platform.scheduler.entity.PublishJob;
import com.footage.platform.scheduler.enrichment.ContentEnricher;
import com.footage.platform.scheduler.exception.ContentEnrichmentException;
import com.footage.platform.scheduler.exception.InvalidJobException;
import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.publisher.PlatformPublisherRegistry;
import com.footage.platform.scheduler.queue.PublishingQueue;
import com.footage.platform.scheduler.timing.OptimalTimeCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Turns a schedule request into one queued job per target platform.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulingEngine {

    private final PublishingQueue publishingQueue;
    private final OptimalTimeCalculator optimalTimeCalculator;
    private final ContentEnricher contentEnricher;
    private final PlatformPublisherRegistry publisherRegistry;
    private final Clock clock;

    public ScheduleResult schedule(Long contentId, List<String> platforms, ScheduleOptions options) {
        if (contentId == null) {
            throw new InvalidJobException("contentId is required");
        }
        if (platforms == null || platforms.isEmpty()) {
            throw new InvalidJobException("At least one platform is required");
        }
        ScheduleOptions effective = options != null ? options : new ScheduleOptions();
        OffsetDateTime customTime = parseCustomSchedule(effective.getCustomSchedule());
        warnOnConflictingOptions(contentId, effective);

        ScheduleResult result = ScheduleResult.builder().contentId(contentId).build();
        for (String name : platforms) {
            Optional<Platform> platform = Platform.fromName(name);
            if (platform.isEmpty() || !publisherRegistry.isRegistered(platform.get())) {
                log.warn("Skipping {} for content {}: no publisher registered", name, contentId);
                result.getSkipped().add(ScheduleResult.PlatformSkip.builder()
                        .platform(name)
                        .reason(ScheduleResult.SkipReason.NO_PUBLISHER)
                        .message("No publisher registered for platform " + name)
                        .build());
                continue;
            }

            PublishPayload payload;
            try {
                payload = contentEnricher.enrich(contentId, platform.get());
            } catch (ContentEnrichmentException e) {
                log.warn("Skipping {} for content {}: {}", platform.get(), contentId, e.getMessage());
                result.getSkipped().add(ScheduleResult.PlatformSkip.builder()
                        .platform(name)
                        .reason(ScheduleResult.SkipReason.ENRICHMENT_FAILED)
                        .message(e.getMessage())
                        .build());
                continue;
            }

            PublishJob job = publishingQueue.enqueue(PublishJob.builder()
                    .contentId(contentId)
                    .platform(platform.get())
                    .payload(payload)
                    .scheduledAt(resolveTime(platform.get(), effective, customTime))
                    .priority(effective.getPriority())
                    .build());

            result.getScheduled().add(ScheduleResult.ScheduledJob.builder()
                    .jobId(job.getId())
                    .platform(platform.get().name().toLowerCase())
                    .scheduledAt(job.getScheduledAt())
                    .build());
        }

        log.info("Scheduled content {}: {} job(s), {} skipped",
                contentId, result.getScheduled().size(), result.getSkipped().size());
        return result;
    }

    private OffsetDateTime resolveTime(Platform platform, ScheduleOptions options, OffsetDateTime customTime) {
        if (options.isImmediate()) {
            return OffsetDateTime.now(clock);
        }
        if (customTime != null) {
            return customTime;
        }
        if (options.isUseOptimalTiming()) {
            return optimalTimeCalculator.nextOccurrence(platform);
        }
        return OffsetDateTime.now(clock);
    }

    private OffsetDateTime parseCustomSchedule(String customSchedule) {
        if (customSchedule == null || customSchedule.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(customSchedule.trim()).withOffsetSameInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidJobException("customSchedule is not an ISO-8601 timestamp: " + customSchedule, e);
        }
    }

    private void warnOnConflictingOptions(Long contentId, ScheduleOptions options) {
        int set = 0;
        if (options.isImmediate()) {
            set++;
        }
        if (options.getCustomSchedule() != null && !options.getCustomSchedule().isBlank()) {
            set++;
        }
        if (options.isUseOptimalTiming()) {
            set++;
        }
        if (set > 1) {
            log.warn("Content {} has conflicting schedule options, applying immediate > customSchedule > optimal", contentId);
        }
    }
}
