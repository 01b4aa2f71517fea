package com.avatarflow.pipeline.dto;

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
public class RegisterAccountRequest {
    private UUID avatarId;
    private Platform platform;
    private String handle;
    private String timezone;
    private LocalTime postingWindowStart;
    private LocalTime postingWindowEnd;
    private Integer minSpacingMinutes;
    private Integer maxPostsPerDay;
}
