package com.footage.platform.scheduler.entity;

import com.footage.platform.scheduler.model.Platform;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

@Entity
@Table(name = "platform_time_slot_stats",
       uniqueConstraints = @UniqueConstraint(columnNames = {"platform", "day_of_week", "hour_of_day"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformTimeSlotStats {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    // 0 = Sunday, 6 = Saturday
    @Column(name = "day_of_week", nullable = false)
    private Integer dayOfWeek;

    // 0-23 UTC
    @Column(name = "hour_of_day", nullable = false)
    private Integer hourOfDay;

    @Column(name = "avg_views")
    @Builder.Default
    private Double avgViews = 0.0;

    @Column(name = "avg_engagement")
    @Builder.Default
    private Double avgEngagement = 0.0;

    @Column(name = "sample_count")
    @Builder.Default
    private Integer sampleCount = 0;

    @Column(name = "calculated_at")
    private OffsetDateTime calculatedAt;
}
