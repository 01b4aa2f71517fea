package com.avatarflow.pipeline.dto;

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
public class SchedulePostRequest {
    private UUID artifactId;
    private Platform platform;
    private UUID platformAccountId;
    private OffsetDateTime windowStart;
    private OffsetDateTime windowEnd;
}
