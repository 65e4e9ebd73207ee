package com.footage.platform.scheduler.controller;

import com.footage.platform.scheduler.analytics.SchedulingInsightsService;
import com.footage.platform.scheduler.calendar.CalendarProjector;
import com.footage.platform.scheduler.dto.*;
import com.footage.platform.scheduler.entity.PublishJobState;
import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.queue.PublishingQueue;
import com.footage.platform.scheduler.service.SchedulingEngine;
import com.footage.platform.scheduler.timing.OptimalTimeCalculator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final SchedulingEngine schedulingEngine;
    private final PublishingQueue publishingQueue;
    private final CalendarProjector calendarProjector;
    private final OptimalTimeCalculator optimalTimeCalculator;
    private final SchedulingInsightsService insightsService;

    @PostMapping("/schedule")
    public ResponseEntity<ScheduleResult> schedule(@Valid @RequestBody ScheduleRequest request) {
        ScheduleResult result = schedulingEngine.schedule(
                request.getContentId(), request.getPlatforms(), request.toOptions());
        HttpStatus status = result.getScheduled().isEmpty() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping("/queue/status")
    public ResponseEntity<QueueStatusResponse> queueStatus() {
        return ResponseEntity.ok(publishingQueue.status());
    }

    @GetMapping("/queue/jobs")
    public ResponseEntity<List<PublishJobResponse>> jobs(
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String platform
    ) {
        PublishJobState jobState = state != null ? parseState(state) : null;
        Platform jobPlatform = platform != null ? parsePlatform(platform) : null;
        return ResponseEntity.ok(publishingQueue.findJobs(jobState, jobPlatform));
    }

    @GetMapping("/queue/jobs/{jobId}")
    public ResponseEntity<PublishJobResponse> job(@PathVariable Long jobId) {
        return ResponseEntity.ok(publishingQueue.findJob(jobId));
    }

    @PostMapping("/queue/retry-abandoned")
    public ResponseEntity<RetryReport> retryAbandoned(@RequestBody(required = false) RetryAbandonedRequest request) {
        return ResponseEntity.ok(publishingQueue.retryAbandoned(request != null ? request.getJobIds() : null));
    }

    @PostMapping("/queue/pause")
    public ResponseEntity<Map<String, Object>> pause() {
        publishingQueue.pauseProcessing();
        return ResponseEntity.ok(Map.of("success", true, "paused", publishingQueue.isPaused()));
    }

    @PostMapping("/queue/resume")
    public ResponseEntity<Map<String, Object>> resume() {
        publishingQueue.resumeProcessing();
        return ResponseEntity.ok(Map.of("success", true, "paused", publishingQueue.isPaused()));
    }

    @GetMapping("/calendar")
    public ResponseEntity<List<CalendarEntry>> calendar(@RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(calendarProjector.project(days));
    }

    @GetMapping("/optimal-time/{platform}")
    public ResponseEntity<OptimalTimeResponse> optimalTime(@PathVariable String platform) {
        return ResponseEntity.ok(optimalTimeCalculator.describe(parsePlatform(platform)));
    }

    @GetMapping("/strategy/{platform}")
    public ResponseEntity<SchedulingStrategy> strategy(@PathVariable String platform) {
        return ResponseEntity.ok(insightsService.strategy(parsePlatform(platform)));
    }

    @GetMapping("/insights")
    public ResponseEntity<PublishingInsights> insights() {
        return ResponseEntity.ok(insightsService.insights());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Scheduler Service is healthy");
    }

    private static Platform parsePlatform(String name) {
        return Platform.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown platform: " + name));
    }

    private static PublishJobState parseState(String state) {
        try {
            return PublishJobState.valueOf(state.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown job state: " + state, e);
        }
    }
}
