package com.footage.platform.scheduler.dto;

import lombok.*;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResult {
    private Long contentId;
    @Builder.Default
    private List<ScheduledJob> scheduled = new ArrayList<>();
    @Builder.Default
    private List<PlatformSkip> skipped = new ArrayList<>();

    public boolean isPartial() {
        return !scheduled.isEmpty() && !skipped.isEmpty();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScheduledJob {
        private Long jobId;
        private String platform;
        private OffsetDateTime scheduledAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlatformSkip {
        private String platform;
        private SkipReason reason;
        private String message;
    }

    public enum SkipReason {
        NO_PUBLISHER,
        ENRICHMENT_FAILED
    }
}
