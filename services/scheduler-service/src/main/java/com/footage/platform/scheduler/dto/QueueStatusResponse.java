package com.footage.platform.scheduler.dto;

import lombok.*;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatusResponse {
    private long pending;
    private long dueNotYetDispatched;
    private long dispatching;
    private long succeeded;
    private long failed;
    private long abandoned;
    private boolean paused;
    private Map<String, RateLimitStatus> rateLimits;
}
