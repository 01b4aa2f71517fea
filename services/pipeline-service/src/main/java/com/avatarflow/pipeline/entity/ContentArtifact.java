package com.avatarflow.pipeline.entity;

import com.avatarflow.pipeline.model.ArtifactStatus;
import com.avatarflow.pipeline.model.ContentTier;
import com.avatarflow.pipeline.model.SafetyVerdict;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "content_artifacts", indexes = {
        @Index(name = "idx_artifact_avatar_status", columnList = "avatar_id, status"),
        @Index(name = "idx_artifact_batch", columnList = "batch_id")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ContentArtifact {

    @Id
    private UUID id;

    @Column(name = "avatar_id", nullable = false)
    private UUID avatarId;

    @Column(name = "batch_id")
    private UUID batchId;

    // Null when the unit ran from a custom prompt
    @Column(name = "template_id", length = 100)
    private String templateId;

    @Column(name = "prompt_used", length = 4000)
    private String promptUsed;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private ContentTier tier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ArtifactStatus status;

    @Column(name = "generation_cost_usd", precision = 12, scale = 6)
    private BigDecimal generationCostUsd;

    @Column(name = "generation_latency_ms")
    private Long generationLatencyMs;

    @Column(name = "generation_attempts")
    @Builder.Default
    private int generationAttempts = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "safety_verdict", length = 20)
    private SafetyVerdict safetyVerdict;

    @Column(name = "safety_score")
    private Double safetyScore;

    @Column(name = "safety_checked_at")
    private OffsetDateTime safetyCheckedAt;

    @Column(name = "storage_locator", length = 1000)
    private String storageLocator;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "content_artifact_metadata", joinColumns = @JoinColumn(name = "artifact_id"))
    @MapKeyColumn(name = "meta_key", length = 100)
    @Column(name = "meta_value", length = 1000)
    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    public ContentArtifact copy() {
        return toBuilder().metadata(new HashMap<>(metadata)).build();
    }
}
