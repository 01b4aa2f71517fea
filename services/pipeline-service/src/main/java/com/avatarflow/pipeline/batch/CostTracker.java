package com.avatarflow.pipeline.batch;

import com.avatarflow.pipeline.dto.CostSummary;
import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.model.ContentTier;
import com.avatarflow.pipeline.store.ContentStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Aggregates generation spend per avatar from the artifacts' recorded costs.
 */
@Service
@RequiredArgsConstructor
public class CostTracker {

    private final ContentStore store;

    public CostSummary costSummary(UUID avatarId) {
        List<ContentArtifact> costed = store.listArtifactsByAvatar(avatarId).stream()
                .filter(a -> a.getGenerationCostUsd() != null)
                .collect(Collectors.toList());

        Map<ContentTier, BigDecimal> byTier = new EnumMap<>(ContentTier.class);
        BigDecimal total = BigDecimal.ZERO;
        for (ContentArtifact artifact : costed) {
            total = total.add(artifact.getGenerationCostUsd());
            byTier.merge(artifact.getTier(), artifact.getGenerationCostUsd(), BigDecimal::add);
        }

        BigDecimal average = costed.isEmpty()
                ? BigDecimal.ZERO
                : total.divide(BigDecimal.valueOf(costed.size()), 6, RoundingMode.HALF_UP);

        return CostSummary.builder()
                .avatarId(avatarId)
                .artifactCount(costed.size())
                .totalCostUsd(total)
                .averageCostUsd(average)
                .costByTier(byTier)
                .build();
    }
}
