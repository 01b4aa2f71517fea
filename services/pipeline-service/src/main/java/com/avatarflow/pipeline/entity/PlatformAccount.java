package com.avatarflow.pipeline.entity;

import com.avatarflow.platform.connector.model.Platform;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.UUID;

/**
 * A social account an avatar posts from. Posting window and cadence are expressed in the
 * account's own timezone.
 */
@Entity
@Table(name = "platform_accounts")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlatformAccount {

    @Id
    private UUID id;

    @Column(name = "avatar_id", nullable = false)
    private UUID avatarId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Column(length = 200)
    private String handle;

    @Column(nullable = false, length = 64)
    private String timezone;

    @Column(name = "posting_window_start", nullable = false)
    private LocalTime postingWindowStart;

    @Column(name = "posting_window_end", nullable = false)
    private LocalTime postingWindowEnd;

    // Null falls back to the platform default
    @Column(name = "min_spacing_minutes")
    private Integer minSpacingMinutes;

    @Column(name = "max_posts_per_day")
    private Integer maxPostsPerDay;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }

    public Duration effectiveMinSpacing() {
        return minSpacingMinutes != null
                ? Duration.ofMinutes(minSpacingMinutes)
                : platform.getDefaultMinSpacing();
    }

    public int effectiveMaxPostsPerDay() {
        return maxPostsPerDay != null ? maxPostsPerDay : platform.getDefaultMaxPostsPerDay();
    }

    public PlatformAccount copy() {
        return toBuilder().build();
    }
}
