package com.footage.platform.scheduler.queue;

import com.footage.platform.scheduler.config.DispatchConfig;
import com.footage.platform.scheduler.config.SchedulerProperties;
import com.footage.platform.scheduler.dto.PublishJobResponse;
import com.footage.platform.scheduler.dto.PublishPayload;
import com.footage.platform.scheduler.dto.PublishRequest;
import com.footage.platform.scheduler.dto.QueueStatusResponse;
import com.footage.platform.scheduler.dto.RateLimitStatus;
import com.footage.platform.scheduler.dto.RetryReport;
import com.footage.platform.scheduler.dto.TickReport;
import com.footage.platform.scheduler.entity.PublishJob;
import com.footage.platform.scheduler.entity.PublishJobState;
import com.footage.platform.scheduler.exception.InvalidJobException;
import com.footage.platform.scheduler.exception.JobNotFoundException;
import com.footage.platform.scheduler.exception.PermanentPublishException;
import com.footage.platform.scheduler.exception.PublishException;
import com.footage.platform.scheduler.exception.TransientPublishException;
import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.notification.PublishEventNotifier;
import com.footage.platform.scheduler.publisher.PlatformPublisher;
import com.footage.platform.scheduler.publisher.PlatformPublisherRegistry;
import com.footage.platform.scheduler.ratelimit.PlatformRateLimiter;
import com.footage.platform.scheduler.repository.PublishJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable, rate-limited publishing queue.
 * <p>
 * All job state changes happen on the thread that holds {@link #tickLock}. Only the platform
 * publish calls run elsewhere, on the dispatch executor, and their outcomes are applied back on
 * the locked thread.
 */
@Slf4j
@Service
public class PublishingQueue {

    static final Comparator<PublishJob> DISPATCH_ORDER = Comparator
            .comparing(PublishJob::getPriority)
            .thenComparing(PublishJob::getScheduledAt)
            .thenComparing(PublishJob::getId);

    private final PublishJobRepository jobRepository;
    private final PlatformPublisherRegistry publisherRegistry;
    private final PlatformRateLimiter rateLimiter;
    private final PublishEventNotifier eventNotifier;
    private final SchedulerProperties properties;
    private final ExecutorService dispatchExecutor;
    private final Clock clock;
    private final RetryPolicy retryPolicy;

    private final ReentrantLock tickLock = new ReentrantLock();
    private final AtomicBoolean paused = new AtomicBoolean(false);

    public PublishingQueue(PublishJobRepository jobRepository,
                           PlatformPublisherRegistry publisherRegistry,
                           PlatformRateLimiter rateLimiter,
                           PublishEventNotifier eventNotifier,
                           SchedulerProperties properties,
                           @Qualifier(DispatchConfig.DISPATCH_EXECUTOR) ExecutorService dispatchExecutor,
                           Clock clock) {
        this.jobRepository = jobRepository;
        this.publisherRegistry = publisherRegistry;
        this.rateLimiter = rateLimiter;
        this.eventNotifier = eventNotifier;
        this.properties = properties;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
        this.retryPolicy = RetryPolicy.from(properties.getQueue());
    }

    /**
     * Insert a new job in {@code PENDING} with a fresh attempt budget.
     */
    public PublishJob enqueue(PublishJob job) {
        if (job.getContentId() == null) {
            throw new InvalidJobException("Job has no content id");
        }
        if (job.getScheduledAt() == null) {
            throw new InvalidJobException("Job has no scheduled time");
        }
        if (job.getPayload() == null) {
            throw new InvalidJobException("Job has no payload");
        }
        if (!publisherRegistry.isRegistered(job.getPlatform())) {
            throw new InvalidJobException("No publisher registered for platform " + job.getPlatform());
        }

        job.setId(null);
        job.setState(PublishJobState.PENDING);
        job.setAttempt(0);
        job.setMaxAttempts(properties.getQueue().getMaxAttempts());
        if (job.getPriority() == null) {
            job.setPriority(properties.getQueue().getDefaultPriority());
        }
        job.setLastError(null);
        job.setPlatformVideoId(null);
        job.setPublishedAt(null);

        PublishJob saved = jobRepository.save(job);
        log.info("Enqueued job {} for content {} on {} at {}",
                saved.getId(), saved.getContentId(), saved.getPlatform(), saved.getScheduledAt());
        return saved;
    }

    public TickReport tick() {
        if (paused.get()) {
            return TickReport.pausedReport();
        }
        tickLock.lock();
        try {
            if (paused.get()) {
                return TickReport.pausedReport();
            }
            TickReport report = new TickReport();
            OffsetDateTime now = OffsetDateTime.now(clock);

            for (PublishJob job : jobRepository.findByStateAndScheduledAtLessThanEqual(PublishJobState.PENDING, now)) {
                job.transitionTo(PublishJobState.DUE_NOT_YET_DISPATCHED);
                jobRepository.save(job);
                report.setPromoted(report.getPromoted() + 1);
            }

            List<PublishJob> due = new ArrayList<>(jobRepository.findByState(PublishJobState.DUE_NOT_YET_DISPATCHED));
            due.sort(DISPATCH_ORDER);

            List<PublishJob> admitted = new ArrayList<>();
            Map<Platform, Integer> deferredByPlatform = new EnumMap<>(Platform.class);
            for (PublishJob job : due) {
                if (rateLimiter.tryAdmit(job.getPlatform())) {
                    job.transitionTo(PublishJobState.DISPATCHING);
                    job.setLastAttemptAt(now);
                    jobRepository.save(job);
                    admitted.add(job);
                } else {
                    deferredByPlatform.merge(job.getPlatform(), 1, Integer::sum);
                }
            }
            report.setAdmitted(admitted.size());
            deferredByPlatform.forEach((platform, count) ->
                    log.warn("Rate limit reached for {}, deferring {} due job(s)", platform, count));
            report.setDeferred(deferredByPlatform.values().stream().mapToInt(Integer::intValue).sum());

            dispatch(admitted, report);
            return report;
        } finally {
            tickLock.unlock();
        }
    }

    private void dispatch(List<PublishJob> admitted, TickReport report) {
        if (admitted.isEmpty()) {
            return;
        }
        Map<PublishJob, PublishCall> inFlight = new LinkedHashMap<>();
        for (PublishJob job : admitted) {
            Optional<PlatformPublisher> publisher = publisherRegistry.find(job.getPlatform());
            if (publisher.isEmpty()) {
                resolveFailure(job, new PermanentPublishException("NO_PUBLISHER",
                        "No publisher registered for platform " + job.getPlatform()), report);
                continue;
            }
            PublishCall call = new PublishCall(publisher.get(), toRequest(job));
            try {
                call.future = dispatchExecutor.submit(call);
                inFlight.put(job, call);
            } catch (RejectedExecutionException e) {
                resolveFailure(job, new TransientPublishException("DISPATCH_REJECTED", e.getMessage(), e), report);
            }
        }

        // Calls are awaited in submission order, so every earlier call has finished or been cancelled
        // by the time a later one is waited on and a dispatch thread is free for it.
        Duration dispatchTimeout = properties.getQueue().getDispatchTimeout();
        long timeoutNanos = dispatchTimeout.toNanos();
        for (Map.Entry<PublishJob, PublishCall> entry : inFlight.entrySet()) {
            PublishJob job = entry.getKey();
            PublishCall call = entry.getValue();
            try {
                if (!call.started.await(timeoutNanos, TimeUnit.NANOSECONDS)) {
                    call.future.cancel(true);
                    resolveFailure(job, new TransientPublishException("DISPATCH_QUEUE_TIMEOUT",
                            "No dispatch thread became free within " + dispatchTimeout), report);
                    continue;
                }
                long remaining = Math.max(0L, call.startedAt + timeoutNanos - System.nanoTime());
                String platformVideoId = call.future.get(remaining, TimeUnit.NANOSECONDS);
                resolveSuccess(job, platformVideoId, report);
            } catch (TimeoutException e) {
                call.future.cancel(true);
                resolveFailure(job, new TransientPublishException("TIMEOUT",
                        "Publish call exceeded " + dispatchTimeout), report);
            } catch (ExecutionException e) {
                resolveFailure(job, classify(e.getCause()), report);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                call.future.cancel(true);
                resolveFailure(job, new TransientPublishException("INTERRUPTED", "Dispatch interrupted", e), report);
            }
        }
    }

    /**
     * One publish call. The timeout runs from the moment a dispatch thread picks the call up.
     */
    private static final class PublishCall implements Callable<String> {

        private final PlatformPublisher publisher;
        private final PublishRequest request;
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startedAt;
        private Future<String> future;

        private PublishCall(PlatformPublisher publisher, PublishRequest request) {
            this.publisher = publisher;
            this.request = request;
        }

        @Override
        public String call() {
            startedAt = System.nanoTime();
            started.countDown();
            return publisher.publish(request);
        }
    }

    private PublishException classify(Throwable cause) {
        if (cause instanceof PublishException publishException) {
            return publishException;
        }
        String message = cause != null ? cause.getMessage() : "unknown error";
        return new TransientPublishException("UNEXPECTED_ERROR", message, cause);
    }

    private void resolveSuccess(PublishJob job, String platformVideoId, TickReport report) {
        job.transitionTo(PublishJobState.SUCCEEDED);
        job.setPlatformVideoId(platformVideoId);
        job.setPublishedAt(OffsetDateTime.now(clock));
        job.setLastError(null);
        jobRepository.save(job);
        report.setSucceeded(report.getSucceeded() + 1);
        log.info("Published job {} to {}: {}", job.getId(), job.getPlatform(), platformVideoId);
        eventNotifier.jobSucceeded(job);
    }

    /**
     * Retryable failures count an attempt and either back off or abandon the job once the budget is spent.
     * Permanent failures abandon the job without touching the budget.
     */
    private void resolveFailure(PublishJob job, PublishException failure, TickReport report) {
        if (failure.isRetryable()) {
            job.setAttempt(job.getAttempt() + 1);
        }
        job.setLastError(failure.describe());
        job.transitionTo(PublishJobState.FAILED);

        if (failure.isRetryable() && job.hasRetryBudget()) {
            Duration delay = retryPolicy.delayFor(job.getAttempt());
            job.transitionTo(PublishJobState.PENDING);
            job.setScheduledAt(OffsetDateTime.now(clock).plus(delay));
            jobRepository.save(job);
            report.setRetried(report.getRetried() + 1);
            log.warn("Job {} on {} failed (attempt {}/{}), retrying at {}: {}",
                    job.getId(), job.getPlatform(), job.getAttempt(), job.getMaxAttempts(),
                    job.getScheduledAt(), failure.describe());
        } else {
            job.transitionTo(PublishJobState.ABANDONED);
            jobRepository.save(job);
            report.setAbandoned(report.getAbandoned() + 1);
            log.error("Job {} on {} abandoned ({} attempt(s) used): {}",
                    job.getId(), job.getPlatform(), job.getAttempt(), failure.describe());
            eventNotifier.jobAbandoned(job);
        }
    }

    /**
     * Move abandoned jobs back to {@code PENDING} for an immediate retry. No ids means all of them.
     */
    public RetryReport retryAbandoned(List<Long> jobIds) {
        tickLock.lock();
        try {
            List<PublishJob> candidates = new ArrayList<>();
            RetryReport report = RetryReport.builder().build();
            if (jobIds == null || jobIds.isEmpty()) {
                candidates.addAll(jobRepository.findByState(PublishJobState.ABANDONED));
            } else {
                for (Long id : jobIds) {
                    Optional<PublishJob> job = jobRepository.findById(id);
                    if (job.isPresent() && job.get().getState() == PublishJobState.ABANDONED) {
                        candidates.add(job.get());
                    } else {
                        report.getSkipped().add(id);
                    }
                }
            }

            OffsetDateTime now = OffsetDateTime.now(clock);
            for (PublishJob job : candidates) {
                job.transitionTo(PublishJobState.PENDING);
                job.setAttempt(0);
                job.setScheduledAt(now);
                job.setLastError(null);
                jobRepository.save(job);
                report.getRetried().add(job.getId());
            }
            log.info("Retrying {} abandoned job(s), skipped {}", report.getRetried().size(), report.getSkipped().size());
            return report;
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Fails every job left in {@code DISPATCHING} by a previous process so it goes through normal retry.
     */
    public int recoverInterruptedDispatches() {
        tickLock.lock();
        try {
            List<PublishJob> interrupted = jobRepository.findByState(PublishJobState.DISPATCHING);
            TickReport report = new TickReport();
            for (PublishJob job : interrupted) {
                resolveFailure(job, new TransientPublishException("INTERRUPTED", "interrupted by restart"), report);
            }
            if (!interrupted.isEmpty()) {
                log.info("Recovered {} interrupted dispatch(es): {} retried, {} abandoned",
                        interrupted.size(), report.getRetried(), report.getAbandoned());
            }
            return interrupted.size();
        } finally {
            tickLock.unlock();
        }
    }

    public QueueStatusResponse status() {
        Map<PublishJobState, Long> counts = new EnumMap<>(PublishJobState.class);
        for (Object[] row : jobRepository.countGroupedByState()) {
            counts.put((PublishJobState) row[0], ((Number) row[1]).longValue());
        }

        Map<String, RateLimitStatus> rateLimits = new LinkedHashMap<>();
        for (Platform platform : publisherRegistry.registeredPlatforms()) {
            rateLimits.put(platform.name().toLowerCase(), rateLimiter.status(platform));
        }

        return QueueStatusResponse.builder()
                .pending(counts.getOrDefault(PublishJobState.PENDING, 0L))
                .dueNotYetDispatched(counts.getOrDefault(PublishJobState.DUE_NOT_YET_DISPATCHED, 0L))
                .dispatching(counts.getOrDefault(PublishJobState.DISPATCHING, 0L))
                .succeeded(counts.getOrDefault(PublishJobState.SUCCEEDED, 0L))
                .failed(counts.getOrDefault(PublishJobState.FAILED, 0L))
                .abandoned(counts.getOrDefault(PublishJobState.ABANDONED, 0L))
                .paused(paused.get())
                .rateLimits(rateLimits)
                .build();
    }

    public void pauseProcessing() {
        if (paused.compareAndSet(false, true)) {
            log.info("Queue processing paused");
        }
    }

    public void resumeProcessing() {
        if (paused.compareAndSet(true, false)) {
            log.info("Queue processing resumed");
        }
    }

    public boolean isPaused() {
        return paused.get();
    }

    public PublishJobResponse findJob(Long id) {
        return jobRepository.findById(id)
                .map(this::toResponse)
                .orElseThrow(() -> new JobNotFoundException(id));
    }

    public List<PublishJobResponse> findJobs(PublishJobState state, Platform platform) {
        return jobRepository.search(state, platform).stream()
                .map(this::toResponse)
                .toList();
    }

    private PublishRequest toRequest(PublishJob job) {
        PublishPayload payload = job.getPayload();
        return PublishRequest.builder()
                .jobId(job.getId())
                .contentId(job.getContentId())
                .platform(job.getPlatform().name().toLowerCase())
                .title(payload.getTitle())
                .description(payload.getDescription())
                .tags(payload.getTags())
                .attempt(job.getAttempt() + 1)
                .build();
    }

    private PublishJobResponse toResponse(PublishJob job) {
        return PublishJobResponse.builder()
                .id(job.getId())
                .contentId(job.getContentId())
                .platform(job.getPlatform().name().toLowerCase())
                .state(job.getState().name())
                .priority(job.getPriority())
                .scheduledAt(job.getScheduledAt())
                .attempt(job.getAttempt())
                .maxAttempts(job.getMaxAttempts())
                .lastError(job.getLastError())
                .platformVideoId(job.getPlatformVideoId())
                .title(job.getPayload() != null ? job.getPayload().getTitle() : null)
                .publishedAt(job.getPublishedAt())
                .lastAttemptAt(job.getLastAttemptAt())
                .createdAt(job.getCreatedAt())
                .build();
    }
}
