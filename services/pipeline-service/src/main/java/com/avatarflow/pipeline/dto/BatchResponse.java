package com.avatarflow.pipeline.dto;

import com.avatarflow.pipeline.entity.GenerationBatch;
import com.avatarflow.pipeline.model.BatchStatus;
import com.avatarflow.pipeline.model.ContentTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResponse {
    private UUID id;
    private UUID avatarId;
    private BatchStatus status;
    private int requestedCount;
    private int completedCount;
    private int failedCount;
    private boolean cancelRequested;
    private Map<ContentTier, Integer> tierDistribution;
    private BigDecimal totalCostUsd;
    private List<UUID> artifactIds;
    private OffsetDateTime createdAt;
    private OffsetDateTime completedAt;

    public static BatchResponse from(GenerationBatch batch) {
        return BatchResponse.builder()
                .id(batch.getId())
                .avatarId(batch.getAvatarId())
                .status(batch.getStatus())
                .requestedCount(batch.getRequestedCount())
                .completedCount(batch.getCompletedCount())
                .failedCount(batch.getFailedCount())
                .cancelRequested(batch.isCancelRequested())
                .tierDistribution(batch.getTierDistribution())
                .totalCostUsd(batch.getTotalCostUsd())
                .artifactIds(batch.getArtifactIds())
                .createdAt(batch.getCreatedAt())
                .completedAt(batch.getCompletedAt())
                .build();
    }
}
