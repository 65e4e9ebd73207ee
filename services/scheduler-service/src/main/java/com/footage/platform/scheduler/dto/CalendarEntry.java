package com.footage.platform.scheduler.dto;

import lombok.*;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarEntry {
    private LocalDate date;
    private String platform;
    private String contentType;
    private OffsetDateTime optimalTime;
    private double estimatedReach;
}
