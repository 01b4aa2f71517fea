package com.avatarflow.pipeline.dto;

import com.avatarflow.pipeline.model.ContentTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostSummary {
    private UUID avatarId;
    private long artifactCount;
    private BigDecimal totalCostUsd;
    private BigDecimal averageCostUsd;
    private Map<ContentTier, BigDecimal> costByTier;
}
