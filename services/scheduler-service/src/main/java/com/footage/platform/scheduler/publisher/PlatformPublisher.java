package com.footage.platform.scheduler.publisher;

import com.footage.platform.scheduler.dto.PublishRequest;
import com.footage.platform.scheduler.dto.VideoAnalytics;
import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.model.TimeSlot;

/**
 * Capability to publish to, and read analytics from, one external platform.
 */
public interface PlatformPublisher {

    /**
     * Get the platform this publisher handles
     */
    Platform getPlatform();

    /**
     * Publish content and return the platform's video id.
     *
     * @throws com.footage.platform.scheduler.exception.TransientPublishException for network errors,
     *         timeouts and 5xx responses
     * @throws com.footage.platform.scheduler.exception.PermanentPublishException when the platform
     *         rejects the content outright
     */
    String publish(PublishRequest request);

    /**
     * Get current analytics for a published video
     */
    VideoAnalytics getAnalytics(String platformVideoId);

    /**
     * Slot used when there is no performance history for this platform
     */
    TimeSlot optimalUploadTimeDefault();
}
