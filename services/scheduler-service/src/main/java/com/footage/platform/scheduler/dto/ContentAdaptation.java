package com.footage.platform.scheduler.dto;

import lombok.*;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentAdaptation {
    private String platform;
    private String title;
    private String caption;
    private String description;
    private List<String> hashtags;
    private List<String> tags;
}
