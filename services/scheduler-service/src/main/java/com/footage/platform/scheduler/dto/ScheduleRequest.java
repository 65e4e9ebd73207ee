package com.footage.platform.scheduler.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {
    @NotNull
    private Long contentId;
    @NotEmpty
    private List<String> platforms;
    private Boolean immediate;
    private String customSchedule;
    private Boolean useOptimalTiming;
    private Integer priority;

    public ScheduleOptions toOptions() {
        return ScheduleOptions.builder()
                .immediate(Boolean.TRUE.equals(immediate))
                .customSchedule(customSchedule)
                .useOptimalTiming(Boolean.TRUE.equals(useOptimalTiming))
                .priority(priority)
                .build();
    }
}
