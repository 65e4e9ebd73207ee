package com.footage.platform.scheduler.calendar;

import com.footage.platform.scheduler.analytics.PerformanceStore;
import com.footage.platform.scheduler.analytics.TimeSlotAggregator;
import com.footage.platform.scheduler.config.SchedulerProperties;
import com.footage.platform.scheduler.dto.CalendarEntry;
import com.footage.platform.scheduler.entity.PlatformTimeSlotStats;
import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.model.TimeSlot;
import com.footage.platform.scheduler.publisher.PlatformPublisherRegistry;
import com.footage.platform.scheduler.timing.OptimalTimeCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only projection of the next N days of publishing, one entry per day and platform.
 */
@Service
@RequiredArgsConstructor
public class CalendarProjector {

    static final int MAX_DAYS = 365;

    private final PerformanceStore performanceStore;
    private final OptimalTimeCalculator optimalTimeCalculator;
    private final PlatformPublisherRegistry publisherRegistry;
    private final SchedulerProperties properties;
    private final Clock clock;

    public List<CalendarEntry> project(int days) {
        if (days < 1 || days > MAX_DAYS) {
            throw new IllegalArgumentException("days must be between 1 and " + MAX_DAYS + ": " + days);
        }

        List<PlatformPlan> plans = new ArrayList<>();
        for (Platform platform : publisherRegistry.registeredPlatforms()) {
            plans.add(new PlatformPlan(platform,
                    performanceStore.statsFor(platform),
                    optimalTimeCalculator.bestSlot(platform),
                    properties.platform(platform)));
        }

        List<String> contentTypes = properties.getCalendar().getContentTypes();
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        List<CalendarEntry> entries = new ArrayList<>();

        for (int i = 0; i < days; i++) {
            LocalDate date = today.plusDays(i);
            String contentType = contentTypes.isEmpty() ? null : contentTypes.get(i % contentTypes.size());
            for (PlatformPlan plan : plans) {
                if (plan.settings.getExcludedDays().contains(date.getDayOfWeek())) {
                    continue;
                }
                entries.add(plan.entryFor(date, contentType));
            }
        }

        entries.sort(Comparator.comparing(CalendarEntry::getDate).thenComparing(CalendarEntry::getPlatform));
        return entries;
    }

    private static final class PlatformPlan {
        private final Platform platform;
        private final List<PlatformTimeSlotStats> rows;
        private final TimeSlot bestSlot;
        private final SchedulerProperties.PlatformSettings settings;
        private final double averageViews;

        private PlatformPlan(Platform platform, List<PlatformTimeSlotStats> rows, TimeSlot bestSlot,
                             SchedulerProperties.PlatformSettings settings) {
            this.platform = platform;
            this.rows = rows;
            this.bestSlot = bestSlot;
            this.settings = settings;
            this.averageViews = TimeSlotAggregator.weightedAverageViews(rows);
        }

        private CalendarEntry entryFor(LocalDate date, String contentType) {
            int day = TimeSlot.dayIndex(date.getDayOfWeek());
            Optional<PlatformTimeSlotStats> best = TimeSlotAggregator.selectBest(
                    rows.stream().filter(row -> row.getDayOfWeek() == day).toList());

            int hour = best.map(PlatformTimeSlotStats::getHourOfDay).orElse(bestSlot.getHourOfDay());
            double reach = best.map(PlatformTimeSlotStats::getAvgViews).orElse(averageViews);

            return CalendarEntry.builder()
                    .date(date)
                    .platform(platform.name().toLowerCase())
                    .contentType(contentType)
                    .optimalTime(date.atTime(hour, 0).atOffset(ZoneOffset.UTC))
                    .estimatedReach(reach)
                    .build();
        }
    }
}
