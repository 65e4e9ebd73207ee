package com.footage.platform.scheduler.dto;

import lombok.*;

/**
 * How a schedule request picks its publish time. Precedence: immediate, then customSchedule,
 * then useOptimalTiming; with none set the content is scheduled for now.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleOptions {
    private boolean immediate;
    private String customSchedule;
    private boolean useOptimalTiming;
    private Integer priority;

    public static ScheduleOptions now() {
        return ScheduleOptions.builder().immediate(true).build();
    }

    public static ScheduleOptions optimal() {
        return ScheduleOptions.builder().useOptimalTiming(true).build();
    }
}
