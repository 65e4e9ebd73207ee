package com.footage.platform.scheduler.publisher;

import com.footage.platform.scheduler.dto.PublishRequest;
import com.footage.platform.scheduler.dto.PublishResult;
import com.footage.platform.scheduler.dto.VideoAnalytics;
import com.footage.platform.scheduler.exception.PermanentPublishException;
import com.footage.platform.scheduler.exception.TransientPublishException;
import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.model.TimeSlot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Publishes through the platform connector service, which owns OAuth tokens and the upload itself.
 */
@Slf4j
public class ConnectorPlatformPublisher implements PlatformPublisher {

    private final Platform platform;
    private final WebClient client;
    private final Duration requestTimeout;
    private final TimeSlot defaultSlot;

    public ConnectorPlatformPublisher(Platform platform, WebClient client, Duration requestTimeout, TimeSlot defaultSlot) {
        this.platform = platform;
        this.client = client;
        this.requestTimeout = requestTimeout;
        this.defaultSlot = defaultSlot;
    }

    @Override
    public Platform getPlatform() {
        return platform;
    }

    @Override
    public String publish(PublishRequest request) {
        log.info("Publishing job {} (content {}) to {}", request.getJobId(), request.getContentId(), platform);

        PublishResult result;
        try {
            result = client.post()
                    .uri("/api/v1/{platform}/publish", platform.getPathSegment())
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(PublishResult.class)
                    .timeout(requestTimeout)
                    .block();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (e.getStatusCode().is5xxServerError() || status == 429) {
                throw new TransientPublishException("HTTP_" + status, e.getMessage(), e);
            }
            throw new PermanentPublishException("HTTP_" + status, e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            throw new TransientPublishException("CONNECTOR_ERROR",
                    platform.getDisplayName() + " publish request failed: " + e.getMessage(), e);
        }

        if (result == null) {
            throw new TransientPublishException("EMPTY_RESPONSE", "Connector returned no publish result");
        }

        if (!result.isSuccess()) {
            if (isRetryableError(result.getErrorCode())) {
                throw new TransientPublishException(result.getErrorCode(), result.getErrorMessage());
            }
            throw new PermanentPublishException(
                    result.getErrorCode() != null ? result.getErrorCode() : "REJECTED", result.getErrorMessage());
        }

        String platformVideoId = result.getPlatformPostId() != null ? result.getPlatformPostId() : result.getPublishId();
        if (platformVideoId == null) {
            // Retrying could publish twice, so a success without an id is not retried.
            throw new PermanentPublishException("MISSING_VIDEO_ID", "Publish succeeded without a video id");
        }
        return platformVideoId;
    }

    @Override
    public VideoAnalytics getAnalytics(String platformVideoId) {
        VideoAnalytics analytics = client.get()
                .uri("/api/v1/{platform}/analytics/{id}", platform.getPathSegment(), platformVideoId)
                .retrieve()
                .bodyToMono(VideoAnalytics.class)
                .timeout(requestTimeout)
                .block();

        if (analytics == null) {
            throw new IllegalStateException("Failed to get " + platform.getDisplayName() + " video analytics");
        }
        return analytics;
    }

    @Override
    public TimeSlot optimalUploadTimeDefault() {
        return defaultSlot;
    }

    static boolean isRetryableError(String errorCode) {
        return errorCode != null && (
            errorCode.contains("TIMEOUT") ||
            errorCode.contains("RATE_LIMIT") ||
            errorCode.contains("SERVICE_UNAVAILABLE") ||
            errorCode.contains("500")
        );
    }
}
