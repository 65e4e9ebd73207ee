package com.footage.platform.scheduler.analytics;

import com.footage.platform.scheduler.config.SchedulerProperties;
import com.footage.platform.scheduler.dto.RecomputeReport;
import com.footage.platform.scheduler.dto.RefreshReport;
import com.footage.platform.scheduler.dto.VideoAnalytics;
import com.footage.platform.scheduler.entity.PerformanceSample;
import com.footage.platform.scheduler.entity.PlatformTimeSlotStats;
import com.footage.platform.scheduler.entity.PublishJob;
import com.footage.platform.scheduler.entity.PublishJobState;
import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.publisher.PlatformPublisher;
import com.footage.platform.scheduler.publisher.PlatformPublisherRegistry;
import com.footage.platform.scheduler.repository.PublishJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Pulls analytics for recently published videos and rebuilds the time-slot stats from them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsRefresher {

    private final PublishJobRepository jobRepository;
    private final PerformanceStore performanceStore;
    private final PlatformPublisherRegistry publisherRegistry;
    private final SchedulerProperties properties;
    private final Clock clock;

    public RefreshReport refreshSamples() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime since = now.minus(properties.getAnalytics().getWindow());
        RefreshReport report = new RefreshReport();

        for (PublishJob job : jobRepository.findByStateAndPublishedAtGreaterThanEqual(PublishJobState.SUCCEEDED, since)) {
            Optional<PlatformPublisher> publisher = publisherRegistry.find(job.getPlatform());
            if (job.getPlatformVideoId() == null || publisher.isEmpty()) {
                report.setSkipped(report.getSkipped() + 1);
                continue;
            }
            try {
                VideoAnalytics analytics = publisher.get().getAnalytics(job.getPlatformVideoId());
                performanceStore.appendSample(toSample(job, analytics, now));
                report.setFetched(report.getFetched() + 1);
            } catch (RuntimeException e) {
                log.warn("Failed to fetch analytics for job {} ({} video {}): {}",
                        job.getId(), job.getPlatform(), job.getPlatformVideoId(), e.getMessage());
                report.setFailed(report.getFailed() + 1);
            }
        }

        log.info("Analytics refresh: {} fetched, {} failed, {} skipped",
                report.getFetched(), report.getFailed(), report.getSkipped());
        return report;
    }

    public RecomputeReport recomputeStats() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime since = now.minus(properties.getAnalytics().getWindow());
        RecomputeReport report = RecomputeReport.builder().build();

        for (Platform platform : Platform.values()) {
            try {
                List<PlatformTimeSlotStats> rows =
                        TimeSlotAggregator.aggregate(platform, performanceStore.samplesSince(platform, since), now);
                int written = performanceStore.replaceStats(platform, rows);
                report.setRowsWritten(report.getRowsWritten() + written);
                report.getRecomputed().add(platform.name().toLowerCase());
                log.info("Recomputed {} time slot(s) for {}", written, platform);
            } catch (RuntimeException e) {
                log.error("Failed to recompute time slot stats for {}: {}", platform, e.getMessage(), e);
                report.getFailed().add(platform.name().toLowerCase());
            }
        }
        return report;
    }

    private PerformanceSample toSample(PublishJob job, VideoAnalytics analytics, OffsetDateTime now) {
        long views = valueOf(analytics.getViews());
        long likes = valueOf(analytics.getLikes());
        long comments = valueOf(analytics.getComments());
        long shares = valueOf(analytics.getShares());
        return PerformanceSample.builder()
                .platform(job.getPlatform())
                .platformVideoId(job.getPlatformVideoId())
                .contentId(job.getContentId())
                .views(views)
                .likes(likes)
                .comments(comments)
                .shares(shares)
                .engagement(TimeSlotAggregator.engagementOf(views, likes, comments, shares))
                .publishedAt(job.getPublishedAt())
                .fetchedAt(analytics.getCapturedAt() != null ? analytics.getCapturedAt() : now)
                .build();
    }

    private static long valueOf(Long counter) {
        return counter != null ? Math.max(0L, counter) : 0L;
    }
}
