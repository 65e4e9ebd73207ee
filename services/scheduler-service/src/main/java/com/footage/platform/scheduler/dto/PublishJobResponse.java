package com.footage.platform.scheduler.dto;

import lombok.*;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishJobResponse {
    private Long id;
    private Long contentId;
    private String platform;
    private String state;
    private Integer priority;
    private OffsetDateTime scheduledAt;
    private Integer attempt;
    private Integer maxAttempts;
    private String lastError;
    private String platformVideoId;
    private String title;
    private OffsetDateTime publishedAt;
    private OffsetDateTime lastAttemptAt;
    private OffsetDateTime createdAt;
}
