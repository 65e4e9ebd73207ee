package com.footage.platform.scheduler.analytics;

import com.footage.platform.scheduler.entity.PerformanceSample;
import com.footage.platform.scheduler.entity.PlatformTimeSlotStats;
import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.model.TimeSlot;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Side-effect free aggregation of performance samples into (dayOfWeek, hourOfDay) buckets.
 */
public final class TimeSlotAggregator {

    /**
     * Highest engagement first, then most views, then earliest day and hour.
     */
    public static final Comparator<PlatformTimeSlotStats> BEST_FIRST = Comparator
            .comparing(PlatformTimeSlotStats::getAvgEngagement, Comparator.reverseOrder())
            .thenComparing(PlatformTimeSlotStats::getAvgViews, Comparator.reverseOrder())
            .thenComparing(PlatformTimeSlotStats::getDayOfWeek)
            .thenComparing(PlatformTimeSlotStats::getHourOfDay);

    private TimeSlotAggregator() {
    }

    /**
     * (likes + comments + shares) / views, clamped to [0, 1].
     */
    public static double engagementOf(long views, long likes, long comments, long shares) {
        if (views <= 0) {
            return 0.0;
        }
        double ratio = (double) (likes + comments + shares) / views;
        return Math.max(0.0, Math.min(1.0, ratio));
    }

    /**
     * Builds one stats row per populated slot. Counters are cumulative, so only the latest sample of
     * each video counts; it is bucketed by the video's publish time, or its fetch time when unknown.
     */
    public static List<PlatformTimeSlotStats> aggregate(Platform platform,
                                                        Collection<PerformanceSample> samples,
                                                        OffsetDateTime calculatedAt) {
        Map<String, PerformanceSample> latestByVideo = new HashMap<>();
        for (PerformanceSample sample : samples) {
            if (sample.getPlatform() != platform) {
                continue;
            }
            latestByVideo.merge(sample.getPlatformVideoId(), sample,
                    (a, b) -> b.getFetchedAt().isAfter(a.getFetchedAt()) ? b : a);
        }

        Map<Integer, Bucket> buckets = new TreeMap<>();
        for (PerformanceSample sample : latestByVideo.values()) {
            OffsetDateTime when = (sample.getPublishedAt() != null ? sample.getPublishedAt() : sample.getFetchedAt())
                    .withOffsetSameInstant(ZoneOffset.UTC);
            int day = TimeSlot.dayIndex(when.getDayOfWeek());
            int hour = when.getHour();
            buckets.computeIfAbsent(day * 24 + hour, k -> new Bucket(day, hour)).add(sample);
        }

        List<PlatformTimeSlotStats> rows = new ArrayList<>();
        for (Bucket bucket : buckets.values()) {
            rows.add(PlatformTimeSlotStats.builder()
                    .platform(platform)
                    .dayOfWeek(bucket.day)
                    .hourOfDay(bucket.hour)
                    .avgViews(bucket.totalViews / bucket.count)
                    .avgEngagement(bucket.totalEngagement / bucket.count)
                    .sampleCount(bucket.count)
                    .calculatedAt(calculatedAt)
                    .build());
        }
        return rows;
    }

    public static Optional<PlatformTimeSlotStats> selectBest(Collection<PlatformTimeSlotStats> rows) {
        return rows.stream().min(BEST_FIRST);
    }

    public static List<PlatformTimeSlotStats> rank(Collection<PlatformTimeSlotStats> rows, int limit) {
        return rows.stream().sorted(BEST_FIRST).limit(limit).toList();
    }

    /**
     * Sample-weighted average of avgViews across rows; 0 when there are none.
     */
    public static double weightedAverageViews(Collection<PlatformTimeSlotStats> rows) {
        long weight = 0;
        double total = 0;
        for (PlatformTimeSlotStats row : rows) {
            int count = row.getSampleCount() != null ? row.getSampleCount() : 0;
            total += row.getAvgViews() * count;
            weight += count;
        }
        return weight == 0 ? 0.0 : total / weight;
    }

    private static final class Bucket {
        private final int day;
        private final int hour;
        private double totalViews;
        private double totalEngagement;
        private int count;

        private Bucket(int day, int hour) {
            this.day = day;
            this.hour = hour;
        }

        private void add(PerformanceSample sample) {
            totalViews += sample.getViews() != null ? sample.getViews() : 0;
            totalEngagement += sample.getEngagement() != null ? sample.getEngagement() : 0.0;
            count++;
        }
    }
}
