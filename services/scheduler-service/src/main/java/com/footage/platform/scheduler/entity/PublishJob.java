package com.footage.platform.scheduler.entity;

import com.footage.platform.scheduler.dto.PublishPayload;
import com.footage.platform.scheduler.model.Platform;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "publish_jobs",
       indexes = @Index(name = "idx_publish_jobs_state_scheduled", columnList = "state, scheduled_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "content_id", nullable = false)
    private Long contentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Convert(converter = PublishPayloadConverter.class)
    @Column(columnDefinition = "TEXT")
    private PublishPayload payload;

    @Column(name = "scheduled_at", nullable = false)
    private OffsetDateTime scheduledAt;

    @Builder.Default
    private Integer priority = 1;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private PublishJobState state = PublishJobState.PENDING;

    @Builder.Default
    private Integer attempt = 0;

    @Column(name = "max_attempts")
    @Builder.Default
    private Integer maxAttempts = 3;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "platform_video_id")
    private String platformVideoId;

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @Column(name = "last_attempt_at")
    private OffsetDateTime lastAttemptAt;

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public void transitionTo(PublishJobState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    String.format("Job %d cannot move from %s to %s", id, state, next));
        }
        state = next;
    }

    public boolean hasRetryBudget() {
        return attempt < maxAttempts;
    }
}
