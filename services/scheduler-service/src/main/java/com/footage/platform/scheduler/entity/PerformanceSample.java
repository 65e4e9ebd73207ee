package com.footage.platform.scheduler.entity;

import com.footage.platform.scheduler.model.Platform;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * One observation of a published video's engagement. Rows are append-only.
 */
@Entity
@Table(name = "performance_samples",
       indexes = @Index(name = "idx_performance_samples_platform_fetched", columnList = "platform, fetched_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceSample {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Column(name = "platform_video_id", nullable = false)
    private String platformVideoId;

    @Column(name = "content_id")
    private Long contentId;

    @Builder.Default
    private Long views = 0L;

    @Builder.Default
    private Long likes = 0L;

    @Builder.Default
    private Long comments = 0L;

    @Builder.Default
    private Long shares = 0L;

    @Builder.Default
    private Double engagement = 0.0;

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @Column(name = "fetched_at", nullable = false, updatable = false)
    private OffsetDateTime fetchedAt;
}
