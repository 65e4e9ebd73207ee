package com.footage.platform.scheduler.dto;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshReport {
    private int fetched;
    private int failed;
    private int skipped;
}
