package com.avatarflow.pipeline.batch;

import com.avatarflow.pipeline.dto.CostSummary;
import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.model.ArtifactStatus;
import com.avatarflow.pipeline.model.ContentTier;
import com.avatarflow.pipeline.store.InMemoryContentStore;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class CostTrackerTest {

    @Test
    void should_AggregateCostPerTier_When_ArtifactsHaveCosts() {
        InMemoryContentStore store = new InMemoryContentStore();
        UUID avatarId = UUID.randomUUID();
        store.createArtifact(artifact(avatarId, ContentTier.BASIC, "0.010"));
        store.createArtifact(artifact(avatarId, ContentTier.BASIC, "0.020"));
        store.createArtifact(artifact(avatarId, ContentTier.PREMIUM, "0.030"));
        store.createArtifact(artifact(avatarId, ContentTier.BASIC, null));
        store.createArtifact(artifact(UUID.randomUUID(), ContentTier.BASIC, "5.000"));

        CostSummary summary = new CostTracker(store).costSummary(avatarId);

        assertThat(summary.getArtifactCount()).isEqualTo(3);
        assertThat(summary.getTotalCostUsd()).isEqualByComparingTo("0.060");
        assertThat(summary.getAverageCostUsd()).isEqualByComparingTo("0.020");
        assertThat(summary.getCostByTier().get(ContentTier.BASIC)).isEqualByComparingTo("0.030");
        assertThat(summary.getCostByTier().get(ContentTier.PREMIUM)).isEqualByComparingTo("0.030");
    }

    @Test
    void should_ReportZero_When_AvatarHasNoArtifacts() {
        CostSummary summary = new CostTracker(new InMemoryContentStore()).costSummary(UUID.randomUUID());

        assertThat(summary.getArtifactCount()).isZero();
        assertThat(summary.getTotalCostUsd()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    private static ContentArtifact artifact(UUID avatarId, ContentTier tier, String cost) {
        return ContentArtifact.builder()
                .avatarId(avatarId)
                .tier(tier)
                .status(ArtifactStatus.ELIGIBLE)
                .generationCostUsd(cost != null ? new BigDecimal(cost) : null)
                .build();
    }
}
