package com.footage.platform.scheduler.dto;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TickReport {
    private boolean paused;
    private int promoted;
    private int admitted;
    private int deferred;
    private int succeeded;
    private int retried;
    private int abandoned;

    public static TickReport pausedReport() {
        return TickReport.builder().paused(true).build();
    }
}
