package com.footage.platform.scheduler.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryReport {
    @Builder.Default
    private List<Long> retried = new ArrayList<>();
    @Builder.Default
    private List<Long> skipped = new ArrayList<>();
}
