package com.avatarflow.pipeline.entity;

import com.avatarflow.pipeline.model.PostStatus;
import com.avatarflow.platform.connector.model.Platform;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.UUID;

@Entity
@Table(name = "scheduled_posts", indexes = {
        @Index(name = "idx_post_status_scheduled", columnList = "status, scheduled_at"),
        @Index(name = "idx_post_account", columnList = "platform_account_id"),
        @Index(name = "idx_post_artifact", columnList = "artifact_id")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledPost {

    @Id
    private UUID id;

    @Column(name = "artifact_id", nullable = false)
    private UUID artifactId;

    @Column(name = "platform_account_id", nullable = false)
    private UUID platformAccountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Column(name = "scheduled_at", nullable = false)
    private OffsetDateTime scheduledAt;

    // Account zone at scheduling time
    @Column(length = 64, nullable = false)
    private String timezone;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PostStatus status;

    @Column(name = "attempt_count")
    @Builder.Default
    private int attemptCount = 0;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "publish_started_at")
    private OffsetDateTime publishStartedAt;

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @Column(name = "platform_post_id", length = 200)
    private String platformPostId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    /**
     * Set while the post is PENDING or PUBLISHING; the unique constraint keeps one active post
     * per artifact and platform.
     */
    @Column(name = "active_key", unique = true, length = 80)
    private String activeKey;

    @PrePersist
    @PreUpdate
    public void syncActiveKey() {
        activeKey = status != null && status.isActive() ? activeKeyFor(artifactId, platform) : null;
    }

    public static String activeKeyFor(UUID artifactId, Platform platform) {
        return artifactId + ":" + platform.name();
    }

    public OffsetDateTime localScheduledAt() {
        return scheduledAt.atZoneSameInstant(ZoneId.of(timezone)).toOffsetDateTime();
    }

    public ScheduledPost copy() {
        return toBuilder().build();
    }
}
