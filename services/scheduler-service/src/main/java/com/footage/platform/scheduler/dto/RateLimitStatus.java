package com.footage.platform.scheduler.dto;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitStatus {
    private int maxPerHour;
    private int maxPerDay;
    private long currentHour;
    private long currentDay;
}
