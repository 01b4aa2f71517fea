package com.avatarflow.pipeline.dto;

import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.model.ArtifactStatus;
import com.avatarflow.pipeline.model.ContentTier;
import com.avatarflow.pipeline.model.SafetyVerdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactResponse {
    private UUID id;
    private UUID avatarId;
    private UUID batchId;
    private String templateId;
    private String promptUsed;
    private ContentTier tier;
    private ArtifactStatus status;
    private BigDecimal generationCostUsd;
    private Long generationLatencyMs;
    private int generationAttempts;
    private SafetyVerdict safetyVerdict;
    private Double safetyScore;
    private String storageLocator;
    private String lastError;
    private Map<String, String> metadata;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static ArtifactResponse from(ContentArtifact artifact) {
        return ArtifactResponse.builder()
                .id(artifact.getId())
                .avatarId(artifact.getAvatarId())
                .batchId(artifact.getBatchId())
                .templateId(artifact.getTemplateId())
                .promptUsed(artifact.getPromptUsed())
                .tier(artifact.getTier())
                .status(artifact.getStatus())
                .generationCostUsd(artifact.getGenerationCostUsd())
                .generationLatencyMs(artifact.getGenerationLatencyMs())
                .generationAttempts(artifact.getGenerationAttempts())
                .safetyVerdict(artifact.getSafetyVerdict())
                .safetyScore(artifact.getSafetyScore())
                .storageLocator(artifact.getStorageLocator())
                .lastError(artifact.getLastError())
                .metadata(artifact.getMetadata())
                .createdAt(artifact.getCreatedAt())
                .updatedAt(artifact.getUpdatedAt())
                .build();
    }
}
