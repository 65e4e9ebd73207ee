package com.footage.platform.scheduler.ratelimit;

import com.footage.platform.scheduler.config.SchedulerProperties;
import com.footage.platform.scheduler.dto.RateLimitStatus;
import com.footage.platform.scheduler.model.Platform;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

@Component
public class PlatformRateLimiter {

    private final Map<Platform, RateLimitWindow> windows = new EnumMap<>(Platform.class);

    public PlatformRateLimiter(SchedulerProperties properties, RateLimitCounterStore store, Clock clock) {
        for (Platform platform : Platform.values()) {
            SchedulerProperties.PlatformSettings settings = properties.platform(platform);
            windows.put(platform, new RateLimitWindow(
                    platform, settings.getMaxPerHour(), settings.getMaxPerDay(), store, clock));
        }
    }

    public boolean tryAdmit(Platform platform) {
        return windows.get(platform).tryAdmit();
    }

    public RateLimitStatus status(Platform platform) {
        return windows.get(platform).snapshot();
    }
}
