package com.avatarflow.pipeline.dto;

import com.avatarflow.pipeline.entity.PlatformAccount;
import com.avatarflow.platform.connector.model.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformAccountResponse {
    private UUID id;
    private UUID avatarId;
    private Platform platform;
    private String handle;
    private String timezone;
    private LocalTime postingWindowStart;
    private LocalTime postingWindowEnd;
    private long minSpacingMinutes;
    private int maxPostsPerDay;

    public static PlatformAccountResponse from(PlatformAccount account) {
        return PlatformAccountResponse.builder()
                .id(account.getId())
                .avatarId(account.getAvatarId())
                .platform(account.getPlatform())
                .handle(account.getHandle())
                .timezone(account.getTimezone())
                .postingWindowStart(account.getPostingWindowStart())
                .postingWindowEnd(account.getPostingWindowEnd())
                .minSpacingMinutes(account.effectiveMinSpacing().toMinutes())
                .maxPostsPerDay(account.effectiveMaxPostsPerDay())
                .build();
    }
}
