package com.footage.platform.scheduler.analytics;

import com.footage.platform.scheduler.config.SchedulerProperties;
import com.footage.platform.scheduler.dto.PublishingInsights;
import com.footage.platform.scheduler.dto.SchedulingStrategy;
import com.footage.platform.scheduler.entity.PerformanceSample;
import com.footage.platform.scheduler.entity.PublishJobState;
import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.model.TimeSlot;
import com.footage.platform.scheduler.publisher.PlatformPublisherRegistry;
import com.footage.platform.scheduler.repository.PublishJobRepository;
import com.footage.platform.scheduler.timing.OptimalTimeCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.OffsetDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class SchedulingInsightsService {

    private static final int STRATEGY_SLOTS = 10;

    private final OptimalTimeCalculator optimalTimeCalculator;
    private final PerformanceStore performanceStore;
    private final PublishJobRepository jobRepository;
    private final PlatformPublisherRegistry publisherRegistry;
    private final SchedulerProperties properties;
    private final Clock clock;

    public SchedulingStrategy strategy(Platform platform) {
        List<SchedulingStrategy.OptimalTime> optimalTimes = optimalTimeCalculator
                .rankedSlots(platform, STRATEGY_SLOTS).stream()
                .map(row -> SchedulingStrategy.OptimalTime.builder()
                        .dayOfWeek(row.getDayOfWeek())
                        .hour(row.getHourOfDay())
                        .score(row.getAvgEngagement())
                        .build())
                .toList();

        List<PerformanceSample> samples = performanceStore.samplesSince(platform, windowStart());
        double peakEngagement = samples.stream().mapToDouble(PerformanceSample::getEngagement).max().orElse(0.0);
        double avgViews = samples.stream().mapToLong(PerformanceSample::getViews).average().orElse(0.0);

        return SchedulingStrategy.builder()
                .platform(platform.name().toLowerCase())
                .optimalTimes(optimalTimes)
                .contentTypes(List.copyOf(properties.getCalendar().getContentTypes()))
                .audienceMetrics(SchedulingStrategy.AudienceMetrics.builder()
                        .peakEngagement(peakEngagement)
                        .avgViews(avgViews)
                        .sampleCount(samples.size())
                        .build())
                .build();
    }

    public PublishingInsights insights() {
        long succeeded = jobRepository.countByState(PublishJobState.SUCCEEDED);
        long abandoned = jobRepository.countByState(PublishJobState.ABANDONED);
        double successRate = succeeded + abandoned == 0 ? 0.0 : (double) succeeded / (succeeded + abandoned);

        List<PerformanceSample> samples = performanceStore.samplesSince(windowStart());
        double avgEngagement = samples.stream().mapToDouble(PerformanceSample::getEngagement).average().orElse(0.0);

        Map<Platform, double[]> engagementByPlatform = new EnumMap<>(Platform.class);
        for (PerformanceSample sample : samples) {
            double[] acc = engagementByPlatform.computeIfAbsent(sample.getPlatform(), p -> new double[2]);
            acc[0] += sample.getEngagement();
            acc[1]++;
        }
        Optional<Platform> top = engagementByPlatform.entrySet().stream()
                .max(Comparator.comparingDouble(e -> e.getValue()[0] / e.getValue()[1]))
                .map(Map.Entry::getKey);

        return PublishingInsights.builder()
                .totalPublications(succeeded)
                .successRate(successRate)
                .avgEngagement(avgEngagement)
                .topPerformingPlatform(top.map(p -> p.name().toLowerCase()).orElse(null))
                .recommendations(recommendations(top, successRate))
                .build();
    }

    private List<String> recommendations(Optional<Platform> top, double successRate) {
        List<String> recommendations = new ArrayList<>();
        top.ifPresent(platform -> {
            recommendations.add("Best performing platform: " + platform.getDisplayName());
            if (publisherRegistry.isRegistered(platform) && optimalTimeCalculator.hasHistory(platform)) {
                TimeSlot slot = optimalTimeCalculator.bestSlot(platform);
                recommendations.add(String.format("Publish to %s on %s around %02d:00 UTC",
                        platform.getDisplayName(), dayName(slot.toDayOfWeek()), slot.getHourOfDay()));
            }
        });
        if (successRate > 0 && successRate < 0.9) {
            recommendations.add("Review abandoned jobs: fewer than 90% of publications succeed");
        }
        recommendations.add("Post consistently during peak engagement hours");
        return recommendations;
    }

    private static String dayName(DayOfWeek day) {
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    private OffsetDateTime windowStart() {
        return OffsetDateTime.now(clock).minus(properties.getAnalytics().getWindow());
    }
}
