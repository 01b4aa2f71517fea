package com.avatarflow.platform.connector.dto;

import com.avatarflow.platform.connector.model.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishResult {
    private Platform platform;
    private boolean success;
    private String platformPostId;
    private String errorCode;
    private String errorMessage;
    private boolean retryable;
    private OffsetDateTime publishedAt;

    public static PublishResult success(Platform platform, String platformPostId) {
        return PublishResult.builder()
                .platform(platform)
                .success(true)
                .platformPostId(platformPostId)
                .publishedAt(OffsetDateTime.now())
                .build();
    }

    public static PublishResult retryableFailure(Platform platform, String errorCode, String errorMessage) {
        return PublishResult.builder()
                .platform(platform)
                .success(false)
                .retryable(true)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }

    public static PublishResult permanentFailure(Platform platform, String errorCode, String errorMessage) {
        return PublishResult.builder()
                .platform(platform)
                .success(false)
                .retryable(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }

    public String describeError() {
        return String.format("[%s] %s", errorCode, errorMessage);
    }
}
