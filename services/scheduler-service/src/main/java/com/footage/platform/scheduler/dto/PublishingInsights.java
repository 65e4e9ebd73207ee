package com.footage.platform.scheduler.dto;

import lombok.*;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishingInsights {
    private long totalPublications;
    private double successRate;
    private double avgEngagement;
    private String topPerformingPlatform;
    private List<String> recommendations;
}
