package com.footage.platform.scheduler.dto;

import lombok.*;

import java.util.List;

/**
 * Platform-specific metadata produced by content enrichment and handed to the publisher as-is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishPayload {
    private String title;
    private String description;
    @Builder.Default
    private List<String> tags = List.of();
}
