package com.footage.platform.scheduler.timing;

import com.footage.platform.scheduler.analytics.PerformanceStore;
import com.footage.platform.scheduler.analytics.TimeSlotAggregator;
import com.footage.platform.scheduler.dto.OptimalTimeResponse;
import com.footage.platform.scheduler.entity.PlatformTimeSlotStats;
import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.model.TimeSlot;
import com.footage.platform.scheduler.publisher.PlatformPublisher;
import com.footage.platform.scheduler.publisher.PlatformPublisherRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Optional;

/**
 * Picks the best weekly publishing slot per platform from the aggregated time-slot stats.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptimalTimeCalculator {

    private final PerformanceStore performanceStore;
    private final PlatformPublisherRegistry publisherRegistry;
    private final Clock clock;

    /**
     * Best slot from history, or the publisher's configured default when there is none.
     */
    public TimeSlot bestSlot(Platform platform) {
        PlatformPublisher publisher = publisherRegistry.require(platform);
        Optional<PlatformTimeSlotStats> best = TimeSlotAggregator.selectBest(performanceStore.statsFor(platform));
        if (best.isPresent()) {
            return TimeSlot.of(best.get().getDayOfWeek(), best.get().getHourOfDay());
        }
        log.debug("No performance history for {}, using default slot", platform);
        return publisher.optimalUploadTimeDefault();
    }

    public boolean hasHistory(Platform platform) {
        return !performanceStore.statsFor(platform).isEmpty();
    }

    public OffsetDateTime nextOccurrence(Platform platform) {
        return nextOccurrence(bestSlot(platform), OffsetDateTime.now(clock));
    }

    public OptimalTimeResponse describe(Platform platform) {
        TimeSlot slot = bestSlot(platform);
        return OptimalTimeResponse.builder()
                .platform(platform.name().toLowerCase())
                .dayOfWeek(slot.getDayOfWeek())
                .hourOfDay(slot.getHourOfDay())
                .fromHistory(hasHistory(platform))
                .nextOccurrence(nextOccurrence(slot, OffsetDateTime.now(clock)))
                .build();
    }

    /**
     * Top rows in best-first order.
     */
    public List<PlatformTimeSlotStats> rankedSlots(Platform platform, int limit) {
        publisherRegistry.require(platform);
        return TimeSlotAggregator.rank(performanceStore.statsFor(platform), limit);
    }

    /**
     * First {@code hourOfDay:00} UTC on the slot's weekday strictly after {@code now}.
     */
    public static OffsetDateTime nextOccurrence(TimeSlot slot, OffsetDateTime now) {
        OffsetDateTime utcNow = now.withOffsetSameInstant(ZoneOffset.UTC);
        OffsetDateTime candidate = utcNow.truncatedTo(ChronoUnit.DAYS)
                .with(TemporalAdjusters.nextOrSame(slot.toDayOfWeek()))
                .withHour(slot.getHourOfDay());
        if (!candidate.isAfter(utcNow)) {
            candidate = candidate.plusWeeks(1);
        }
        return candidate;
    }
}
