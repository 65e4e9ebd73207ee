package com.footage.platform.scheduler.dto;

import lombok.*;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishRequest {
    private Long jobId;
    private Long contentId;
    private String platform;
    private String title;
    private String description;
    private List<String> tags;
    private Integer attempt;
}
