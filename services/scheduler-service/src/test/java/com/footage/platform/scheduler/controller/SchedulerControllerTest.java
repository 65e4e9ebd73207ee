package com.footage.platform.scheduler.controller;

import com.footage.platform.scheduler.analytics.SchedulingInsightsService;
import com.footage.platform.scheduler.calendar.CalendarProjector;
import com.footage.platform.scheduler.dto.*;
import com.footage.platform.scheduler.entity.PublishJobState;
import com.footage.platform.scheduler.exception.InvalidJobException;
import com.footage.platform.scheduler.exception.JobNotFoundException;
import com.footage.platform.scheduler.exception.SchedulerExceptionHandler;
import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.queue.PublishingQueue;
import com.footage.platform.scheduler.service.SchedulingEngine;
import com.footage.platform.scheduler.timing.OptimalTimeCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SchedulerControllerTest {

    private MockMvc mockMvc;

    @Mock
    private SchedulingEngine schedulingEngine;

    @Mock
    private PublishingQueue publishingQueue;

    @Mock
    private CalendarProjector calendarProjector;

    @Mock
    private OptimalTimeCalculator optimalTimeCalculator;

    @Mock
    private SchedulingInsightsService insightsService;

    @InjectMocks
    private SchedulerController schedulerController;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(schedulerController)
                .setControllerAdvice(new SchedulerExceptionHandler())
                .build();
    }

    @Test
    void scheduleReturnsCreatedWithResult() throws Exception {
        when(schedulingEngine.schedule(eq(42L), anyList(), any(ScheduleOptions.class))).thenReturn(ScheduleResult.builder()
                .contentId(42L)
                .scheduled(List.of(ScheduleResult.ScheduledJob.builder().jobId(1L).platform("youtube").build()))
                .skipped(List.of(ScheduleResult.PlatformSkip.builder()
                        .platform("instagram").reason(ScheduleResult.SkipReason.NO_PUBLISHER).message("none").build()))
                .build());

        mockMvc.perform(post("/api/v1/scheduler/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"contentId\":42,\"platforms\":[\"youtube\",\"instagram\"],\"useOptimalTiming\":true}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.scheduled[0].jobId").value(1))
                .andExpect(jsonPath("$.skipped[0].reason").value("NO_PUBLISHER"));

        ArgumentCaptor<ScheduleOptions> options = ArgumentCaptor.forClass(ScheduleOptions.class);
        verify(schedulingEngine).schedule(eq(42L), eq(List.of("youtube", "instagram")), options.capture());
        assertThat(options.getValue().isUseOptimalTiming()).isTrue();
        assertThat(options.getValue().isImmediate()).isFalse();
    }

    @Test
    void scheduleValidatesRequestBody() throws Exception {
        mockMvc.perform(post("/api/v1/scheduler/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"platforms\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verifyNoInteractions(schedulingEngine);
    }

    @Test
    void invalidJobMapsToBadRequest() throws Exception {
        when(schedulingEngine.schedule(eq(42L), anyList(), any(ScheduleOptions.class)))
                .thenThrow(new InvalidJobException("customSchedule is not an ISO-8601 timestamp: soon"));

        mockMvc.perform(post("/api/v1/scheduler/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"contentId\":42,\"platforms\":[\"youtube\"],\"customSchedule\":\"soon\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("customSchedule is not an ISO-8601 timestamp: soon"));
    }

    @Test
    void queueStatus() throws Exception {
        when(publishingQueue.status()).thenReturn(QueueStatusResponse.builder()
                .pending(3)
                .abandoned(1)
                .paused(true)
                .rateLimits(Map.of("youtube", RateLimitStatus.builder().maxPerHour(10).maxPerDay(100).currentHour(2).build()))
                .build());

        mockMvc.perform(get("/api/v1/scheduler/queue/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending").value(3))
                .andExpect(jsonPath("$.paused").value(true))
                .andExpect(jsonPath("$.rateLimits.youtube.currentHour").value(2));
    }

    @Test
    void listJobsParsesFilters() throws Exception {
        when(publishingQueue.findJobs(PublishJobState.ABANDONED, Platform.TIKTOK)).thenReturn(List.of(
                PublishJobResponse.builder().id(5L).platform("tiktok").state("ABANDONED").build()));

        mockMvc.perform(get("/api/v1/scheduler/queue/jobs").param("state", "abandoned").param("platform", "TikTok"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(5));
    }

    @Test
    void listJobsRejectsUnknownState() throws Exception {
        mockMvc.perform(get("/api/v1/scheduler/queue/jobs").param("state", "LOST"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown job state: LOST"));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        when(publishingQueue.findJob(99L)).thenThrow(new JobNotFoundException(99L));

        mockMvc.perform(get("/api/v1/scheduler/queue/jobs/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void retryAbandonedPassesIds() throws Exception {
        when(publishingQueue.retryAbandoned(List.of(1L, 2L))).thenReturn(RetryReport.builder()
                .retried(List.of(1L))
                .skipped(List.of(2L))
                .build());

        mockMvc.perform(post("/api/v1/scheduler/queue/retry-abandoned")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jobIds\":[1,2]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.retried[0]").value(1))
                .andExpect(jsonPath("$.skipped[0]").value(2));
    }

    @Test
    void pauseAndResume() throws Exception {
        when(publishingQueue.isPaused()).thenReturn(true, false);

        mockMvc.perform(post("/api/v1/scheduler/queue/pause"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paused").value(true));
        mockMvc.perform(post("/api/v1/scheduler/queue/resume"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paused").value(false));

        verify(publishingQueue).pauseProcessing();
        verify(publishingQueue).resumeProcessing();
    }

    @Test
    void calendarRejectsOutOfRangeDays() throws Exception {
        when(calendarProjector.project(400)).thenThrow(new IllegalArgumentException("days must be between 1 and 365: 400"));

        mockMvc.perform(get("/api/v1/scheduler/calendar").param("days", "400"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void optimalTimeForPlatform() throws Exception {
        when(optimalTimeCalculator.describe(Platform.YOUTUBE)).thenReturn(OptimalTimeResponse.builder()
                .platform("youtube").dayOfWeek(2).hourOfDay(20).fromHistory(false).build());

        mockMvc.perform(get("/api/v1/scheduler/optimal-time/youtube"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hourOfDay").value(20))
                .andExpect(jsonPath("$.fromHistory").value(false));
    }

    @Test
    void unknownPlatformIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/scheduler/strategy/myspace"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown platform: myspace"));
    }

    @Test
    void insights() throws Exception {
        when(insightsService.insights()).thenReturn(PublishingInsights.builder()
                .totalPublications(12).successRate(0.75).topPerformingPlatform("tiktok").recommendations(List.of()).build());

        mockMvc.perform(get("/api/v1/scheduler/insights"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.topPerformingPlatform").value("tiktok"));
    }

    @Test
    void health() throws Exception {
        mockMvc.perform(get("/api/v1/scheduler/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("Scheduler Service is healthy"));
    }
}
