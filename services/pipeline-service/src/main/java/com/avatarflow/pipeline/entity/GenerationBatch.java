package com.avatarflow.pipeline.entity;

import com.avatarflow.pipeline.model.BatchStatus;
import com.avatarflow.pipeline.model.ContentTier;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "generation_batches")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GenerationBatch {

    @Id
    private UUID id;

    @Column(name = "avatar_id", nullable = false)
    private UUID avatarId;

    @Column(name = "avatar_model_ref", length = 500)
    private String avatarModelRef;

    @Column(name = "requested_count", nullable = false)
    private int requestedCount;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "generation_batch_tiers", joinColumns = @JoinColumn(name = "batch_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "tier", length = 20)
    @Column(name = "unit_count")
    @Builder.Default
    private Map<ContentTier, Integer> tierDistribution = new EnumMap<>(ContentTier.class);

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private BatchStatus status;

    @Column(name = "completed_count")
    @Builder.Default
    private int completedCount = 0;

    @Column(name = "failed_count")
    @Builder.Default
    private int failedCount = 0;

    @Column(name = "total_cost_usd", precision = 14, scale = 6)
    @Builder.Default
    private BigDecimal totalCostUsd = BigDecimal.ZERO;

    @Column(name = "cancel_requested")
    @Builder.Default
    private boolean cancelRequested = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    // Append-only, in creation order
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "generation_batch_artifacts", joinColumns = @JoinColumn(name = "batch_id"))
    @OrderColumn(name = "position")
    @Column(name = "artifact_id")
    @Builder.Default
    private List<UUID> artifactIds = new ArrayList<>();

    public int resolvedCount() {
        return completedCount + failedCount;
    }

    public GenerationBatch copy() {
        Map<ContentTier, Integer> tiers = new EnumMap<>(ContentTier.class);
        tiers.putAll(tierDistribution);
        return toBuilder()
                .tierDistribution(tiers)
                .artifactIds(new ArrayList<>(artifactIds))
                .build();
    }
}
