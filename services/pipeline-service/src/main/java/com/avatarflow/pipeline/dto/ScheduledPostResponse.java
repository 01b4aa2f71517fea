package com.avatarflow.pipeline.dto;

import com.avatarflow.pipeline.entity.ScheduledPost;
import com.avatarflow.pipeline.model.PostStatus;
import com.avatarflow.platform.connector.model.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledPostResponse {
    private UUID id;
    private UUID artifactId;
    private UUID platformAccountId;
    private Platform platform;
    // In the account's timezone
    private OffsetDateTime scheduledAt;
    private String timezone;
    private PostStatus status;
    private int attemptCount;
    private String lastError;
    private String platformPostId;
    private OffsetDateTime publishedAt;
    private OffsetDateTime createdAt;

    public static ScheduledPostResponse from(ScheduledPost post) {
        return ScheduledPostResponse.builder()
                .id(post.getId())
                .artifactId(post.getArtifactId())
                .platformAccountId(post.getPlatformAccountId())
                .platform(post.getPlatform())
                .scheduledAt(post.localScheduledAt())
                .timezone(post.getTimezone())
                .status(post.getStatus())
                .attemptCount(post.getAttemptCount())
                .lastError(post.getLastError())
                .platformPostId(post.getPlatformPostId())
                .publishedAt(post.getPublishedAt())
                .createdAt(post.getCreatedAt())
                .build();
    }
}
