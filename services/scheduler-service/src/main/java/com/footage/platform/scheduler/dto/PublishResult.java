package com.footage.platform.scheduler.dto;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishResult {
    private boolean success;
    private String publishId;
    private String platformPostId;
    private String errorCode;
    private String errorMessage;
}
