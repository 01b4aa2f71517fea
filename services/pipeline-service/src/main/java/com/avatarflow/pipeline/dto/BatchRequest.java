package com.avatarflow.pipeline.dto;

import com.avatarflow.pipeline.model.ContentTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRequest {
    private UUID avatarId;
    private String avatarModelRef;
    private Integer requestedCount;
    private Map<ContentTier, Integer> tierDistribution;

    // Used for units the template selector has nothing for
    private String customPrompt;

    // Write a caption for every unit; defaults to true
    private Boolean includeHooks;

    // Per-call provider timeout; falls back to pipeline.generation.call-timeout
    private Integer generationTimeoutSeconds;
}
