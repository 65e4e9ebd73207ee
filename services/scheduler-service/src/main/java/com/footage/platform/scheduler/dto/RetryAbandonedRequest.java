package com.footage.platform.scheduler.dto;

import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetryAbandonedRequest {
    // empty means every abandoned job
    private List<Long> jobIds;
}
