package com.footage.platform.scheduler.dto;

import lombok.*;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulingStrategy {
    private String platform;
    private List<OptimalTime> optimalTimes;
    private List<String> contentTypes;
    private AudienceMetrics audienceMetrics;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OptimalTime {
        private int dayOfWeek;
        private int hour;
        private double score;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AudienceMetrics {
        private double peakEngagement;
        private double avgViews;
        private long sampleCount;
    }
}
