package com.footage.platform.scheduler.ratelimit;

import com.footage.platform.scheduler.dto.RateLimitStatus;
import com.footage.platform.scheduler.model.Platform;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Hourly and daily publish counters for one platform over fixed UTC windows.
 * <p>
 * Counters live under keys derived from the window start, so rollover happens atomically when the
 * clock crosses a boundary: the next admission simply lands on a fresh key.
 */
@Slf4j
public class RateLimitWindow {

    private static final String KEY_PREFIX = "ratelimit:publish:";
    private static final DateTimeFormatter HOUR_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHH");
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final Duration HOUR_KEY_TTL = Duration.ofHours(2);
    private static final Duration DAY_KEY_TTL = Duration.ofDays(2);

    private final Platform platform;
    private final int maxPerHour;
    private final int maxPerDay;
    private final RateLimitCounterStore store;
    private final Clock clock;

    public RateLimitWindow(Platform platform, int maxPerHour, int maxPerDay, RateLimitCounterStore store, Clock clock) {
        this.platform = platform;
        this.maxPerHour = maxPerHour;
        this.maxPerDay = maxPerDay;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Count one dispatch if it fits in both the current hour and the current day.
     *
     * @return false when either ceiling is reached; nothing is counted in that case
     */
    public synchronized boolean tryAdmit() {
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        String hourKey = hourKey(now);
        String dayKey = dayKey(now);

        long hourCount = store.increment(hourKey, HOUR_KEY_TTL);
        long dayCount = store.increment(dayKey, DAY_KEY_TTL);

        if (hourCount > maxPerHour || dayCount > maxPerDay) {
            store.decrement(hourKey);
            store.decrement(dayKey);
            log.debug("Rate limit reached for {}: {}/{} this hour, {}/{} today",
                    platform, hourCount - 1, maxPerHour, dayCount - 1, maxPerDay);
            return false;
        }
        return true;
    }

    public RateLimitStatus snapshot() {
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        return RateLimitStatus.builder()
                .maxPerHour(maxPerHour)
                .maxPerDay(maxPerDay)
                .currentHour(store.get(hourKey(now)))
                .currentDay(store.get(dayKey(now)))
                .build();
    }

    private String hourKey(OffsetDateTime now) {
        return KEY_PREFIX + platform.name().toLowerCase(Locale.ROOT) + ":hour:" + HOUR_FORMAT.format(now);
    }

    private String dayKey(OffsetDateTime now) {
        return KEY_PREFIX + platform.name().toLowerCase(Locale.ROOT) + ":day:" + DAY_FORMAT.format(now);
    }
}
