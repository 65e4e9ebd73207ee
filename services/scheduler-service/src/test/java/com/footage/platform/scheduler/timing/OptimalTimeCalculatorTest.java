package com.footage.platform.scheduler.timing;

import com.footage.platform.scheduler.analytics.PerformanceStore;
import com.footage.platform.scheduler.entity.PlatformTimeSlotStats;
import com.footage.platform.scheduler.exception.InvalidJobException;
import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.model.TimeSlot;
import com.footage.platform.scheduler.publisher.PlatformPublisher;
import com.footage.platform.scheduler.publisher.PlatformPublisherRegistry;
import com.footage.platform.scheduler.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OptimalTimeCalculatorTest {

    @Mock
    private PerformanceStore performanceStore;

    @Mock
    private PlatformPublisher youtubePublisher;

    private OptimalTimeCalculator calculator;

    @BeforeEach
    void setUp() {
        when(youtubePublisher.getPlatform()).thenReturn(Platform.YOUTUBE);
        lenient().when(youtubePublisher.optimalUploadTimeDefault()).thenReturn(TimeSlot.of(2, 20));
        // 2024-03-06 is a Wednesday
        MutableClock clock = MutableClock.at("2024-03-06T12:00:00Z");
        calculator = new OptimalTimeCalculator(performanceStore,
                new PlatformPublisherRegistry(List.of(youtubePublisher)), clock);
    }

    @Nested
    @DisplayName("bestSlot")
    class BestSlot {

        @Test
        @DisplayName("falls back to the configured default without history")
        void usesDefaultWithoutHistory() {
            when(performanceStore.statsFor(Platform.YOUTUBE)).thenReturn(List.of());

            assertThat(calculator.bestSlot(Platform.YOUTUBE)).isEqualTo(TimeSlot.of(2, 20));
        }

        @Test
        @DisplayName("picks the most engaging slot from history")
        void usesHistory() {
            when(performanceStore.statsFor(Platform.YOUTUBE)).thenReturn(List.of(
                    PlatformTimeSlotStats.builder().dayOfWeek(1).hourOfDay(9).avgViews(900.0).avgEngagement(0.03).sampleCount(4).build(),
                    PlatformTimeSlotStats.builder().dayOfWeek(4).hourOfDay(17).avgViews(300.0).avgEngagement(0.07).sampleCount(2).build()));

            assertThat(calculator.bestSlot(Platform.YOUTUBE)).isEqualTo(TimeSlot.of(4, 17));
            assertThat(calculator.hasHistory(Platform.YOUTUBE)).isTrue();
        }

        @Test
        @DisplayName("rejects platforms without a publisher")
        void rejectsUnregisteredPlatform() {
            assertThatThrownBy(() -> calculator.bestSlot(Platform.TIKTOK))
                    .isInstanceOf(InvalidJobException.class);
        }
    }

    @Nested
    @DisplayName("nextOccurrence")
    class NextOccurrence {

        @Test
        @DisplayName("today when the slot hour has not started yet")
        void laterToday() {
            OffsetDateTime now = OffsetDateTime.parse("2024-03-06T12:00:00Z");

            assertThat(OptimalTimeCalculator.nextOccurrence(TimeSlot.of(3, 18), now))
                    .isEqualTo(OffsetDateTime.parse("2024-03-06T18:00:00Z"));
        }

        @Test
        @DisplayName("next week when the slot hour is exactly now")
        void exactlyNowRollsAWeek() {
            OffsetDateTime now = OffsetDateTime.parse("2024-03-06T18:00:00Z");

            assertThat(OptimalTimeCalculator.nextOccurrence(TimeSlot.of(3, 18), now))
                    .isEqualTo(OffsetDateTime.parse("2024-03-13T18:00:00Z"));
        }

        @Test
        @DisplayName("next week when the slot hour already passed today")
        void earlierTodayRollsAWeek() {
            OffsetDateTime now = OffsetDateTime.parse("2024-03-06T18:30:00Z");

            assertThat(OptimalTimeCalculator.nextOccurrence(TimeSlot.of(3, 18), now))
                    .isEqualTo(OffsetDateTime.parse("2024-03-13T18:00:00Z"));
        }

        @Test
        @DisplayName("Sunday slots resolve to the coming Sunday")
        void sundaySlot() {
            OffsetDateTime now = OffsetDateTime.parse("2024-03-06T12:00:00Z");

            assertThat(OptimalTimeCalculator.nextOccurrence(TimeSlot.of(0, 9), now))
                    .isEqualTo(OffsetDateTime.parse("2024-03-10T09:00:00Z"));
        }

        @Test
        @DisplayName("non-UTC input is normalised to UTC")
        void normalisesOffset() {
            // 2024-03-07T01:00+02:00 is still Wednesday 23:00 UTC
            OffsetDateTime now = OffsetDateTime.parse("2024-03-07T01:00:00+02:00");

            assertThat(OptimalTimeCalculator.nextOccurrence(TimeSlot.of(4, 0), now))
                    .isEqualTo(OffsetDateTime.parse("2024-03-07T00:00:00Z"));
        }

        @Test
        @DisplayName("platform variant uses the default slot and the injected clock")
        void forPlatform() {
            when(performanceStore.statsFor(Platform.YOUTUBE)).thenReturn(List.of());

            assertThat(calculator.nextOccurrence(Platform.YOUTUBE))
                    .isEqualTo(OffsetDateTime.parse("2024-03-12T20:00:00Z"));
        }
    }
}
