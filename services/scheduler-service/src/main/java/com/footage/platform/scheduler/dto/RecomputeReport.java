package com.footage.platform.scheduler.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecomputeReport {
    private int rowsWritten;
    @Builder.Default
    private List<String> recomputed = new ArrayList<>();
    @Builder.Default
    private List<String> failed = new ArrayList<>();
}
