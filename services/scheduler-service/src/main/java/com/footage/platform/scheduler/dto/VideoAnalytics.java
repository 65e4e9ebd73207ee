package com.footage.platform.scheduler.dto;

import lombok.*;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoAnalytics {
    private String platformPostId;
    private Long views;
    private Long likes;
    private Long comments;
    private Long shares;
    private OffsetDateTime capturedAt;
}
