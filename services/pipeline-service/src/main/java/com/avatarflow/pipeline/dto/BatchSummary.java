package com.avatarflow.pipeline.dto;

import com.avatarflow.pipeline.model.ArtifactStatus;
import com.avatarflow.pipeline.model.BatchStatus;
import com.avatarflow.pipeline.model.ContentTier;
import com.avatarflow.pipeline.model.SafetyVerdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Progress and statistics of one batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSummary {
    private UUID batchId;
    private BatchStatus status;
    private int requestedCount;
    private int completedCount;
    private int failedCount;
    private int unresolvedCount;
    private Map<ArtifactStatus, Long> statusDistribution;
    private Map<SafetyVerdict, Long> verdictDistribution;
    private Map<ContentTier, Long> tierDistribution;
    private BigDecimal totalCostUsd;
    private BigDecimal averageCostUsd;
    private double averageGenerationMs;
    private double safetyPassRate;
}
