package com.footage.platform.scheduler.config;

import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.model.TimeSlot;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for the publishing scheduler, bound from the {@code scheduler.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private Queue queue = new Queue();

    private Analytics analytics = new Analytics();

    private RateLimit rateLimit = new RateLimit();

    private Calendar calendar = new Calendar();

    private Driver driver = new Driver();

    private Notifications notifications = new Notifications();

    /**
     * Base URL of the platform connector that adapts content per platform.
     */
    private String platformConnectorUrl = "http://localhost:8088";

    private Map<Platform, PlatformSettings> platforms = new LinkedHashMap<>();

    public PlatformSettings platform(Platform platform) {
        PlatformSettings settings = platforms.get(platform);
        return settings != null ? settings : new PlatformSettings();
    }

    @Data
    public static class Queue {
        private Duration tickInterval = Duration.ofMinutes(1);

        /**
         * Upper bound for a single publish call before it counts as a failed attempt.
         */
        private Duration dispatchTimeout = Duration.ofMinutes(5);

        private int dispatchConcurrency = 4;

        private int maxAttempts = 3;

        private Duration backoffBase = Duration.ofMinutes(2);

        private Duration backoffMax = Duration.ofHours(1);

        private int defaultPriority = 1;
    }

    @Data
    public static class Analytics {
        private Duration fetchInterval = Duration.ofHours(4);

        private Duration recomputeInterval = Duration.ofDays(1);

        /**
         * Rolling window of samples used for fetching and for stats recomputation.
         */
        private Duration window = Duration.ofDays(30);
    }

    @Data
    public static class RateLimit {
        /**
         * Counter backend: "memory" or "redis".
         */
        private String store = "memory";
    }

    @Data
    public static class Calendar {
        private List<String> contentTypes = new ArrayList<>(List.of("action", "scenic", "educational", "tutorial"));
    }

    @Data
    public static class Driver {
        private boolean enabled = true;

        private int poolSize = 3;
    }

    @Data
    public static class Notifications {
        private boolean enabled = true;

        private String publishedRoutingKey = "post.published";

        private String abandonedRoutingKey = "post.abandoned";
    }

    @Data
    public static class PlatformSettings {
        private boolean enabled = true;

        private String connectorUrl;

        private Duration requestTimeout = Duration.ofSeconds(30);

        private int maxPerHour = 10;

        private int maxPerDay = 100;

        private int defaultDayOfWeek = 2;

        private int defaultHourOfDay = 20;

        /**
         * Days the content calendar never proposes for this platform.
         */
        private Set<DayOfWeek> excludedDays = EnumSet.noneOf(DayOfWeek.class);

        public TimeSlot defaultSlot() {
            return TimeSlot.of(defaultDayOfWeek, defaultHourOfDay);
        }
    }
}
