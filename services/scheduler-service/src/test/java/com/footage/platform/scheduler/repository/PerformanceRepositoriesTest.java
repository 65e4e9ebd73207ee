package com.footage.platform.scheduler.repository;

import com.footage.platform.scheduler.entity.PerformanceSample;
import com.footage.platform.scheduler.entity.PlatformTimeSlotStats;
import com.footage.platform.scheduler.model.Platform;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class PerformanceRepositoriesTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2024-03-10T00:00:00Z");

    @Autowired
    private PerformanceSampleRepository sampleRepository;

    @Autowired
    private PlatformTimeSlotStatsRepository statsRepository;

    private static PlatformTimeSlotStats stats(Platform platform, int day, int hour) {
        return PlatformTimeSlotStats.builder()
                .platform(platform)
                .dayOfWeek(day)
                .hourOfDay(hour)
                .avgViews(100.0)
                .avgEngagement(0.05)
                .sampleCount(1)
                .calculatedAt(NOW)
                .build();
    }

    @Test
    void samplesAreFilteredByPlatformAndFetchTime() {
        sampleRepository.saveAll(List.of(
                PerformanceSample.builder().platform(Platform.YOUTUBE).platformVideoId("a").fetchedAt(NOW.minusDays(40)).build(),
                PerformanceSample.builder().platform(Platform.YOUTUBE).platformVideoId("b").fetchedAt(NOW.minusDays(1)).build(),
                PerformanceSample.builder().platform(Platform.TIKTOK).platformVideoId("c").fetchedAt(NOW.minusDays(1)).build()));

        assertThat(sampleRepository.findByPlatformAndFetchedAtGreaterThanEqual(Platform.YOUTUBE, NOW.minusDays(30)))
                .extracting(PerformanceSample::getPlatformVideoId)
                .containsExactly("b");
        assertThat(sampleRepository.findByFetchedAtGreaterThanEqual(NOW.minusDays(30))).hasSize(2);
    }

    @Test
    void deleteByPlatformLeavesOtherPlatforms() {
        statsRepository.saveAll(List.of(
                stats(Platform.YOUTUBE, 1, 9),
                stats(Platform.YOUTUBE, 2, 10),
                stats(Platform.TIKTOK, 1, 9)));

        int deleted = statsRepository.deleteByPlatform(Platform.YOUTUBE);
        statsRepository.save(stats(Platform.YOUTUBE, 1, 9));

        assertThat(deleted).isEqualTo(2);
        assertThat(statsRepository.findByPlatform(Platform.YOUTUBE)).hasSize(1);
        assertThat(statsRepository.findByPlatform(Platform.TIKTOK)).hasSize(1);
    }
}
