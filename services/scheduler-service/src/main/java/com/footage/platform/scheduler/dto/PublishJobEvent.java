package com.footage.platform.scheduler.dto;

import lombok.*;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishJobEvent {
    private Long jobId;
    private Long contentId;
    private String platform;
    private String state;
    private String platformVideoId;
    private String lastError;
    private Integer attempt;
    private OffsetDateTime occurredAt;
}
