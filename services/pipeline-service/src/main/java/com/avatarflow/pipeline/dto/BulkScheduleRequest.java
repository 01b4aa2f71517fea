package com.avatarflow.pipeline.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkScheduleRequest {
    private UUID platformAccountId;
    // Scheduled in this order
    private List<UUID> artifactIds;
    private OffsetDateTime windowStart;
    private OffsetDateTime windowEnd;
}
