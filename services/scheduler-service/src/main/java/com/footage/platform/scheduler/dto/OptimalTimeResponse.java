package com.footage.platform.scheduler.dto;

import lombok.*;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimalTimeResponse {
    private String platform;
    private int dayOfWeek;
    private int hourOfDay;
    private boolean fromHistory;
    private OffsetDateTime nextOccurrence;
}
