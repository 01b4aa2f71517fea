package com.avatarflow.pipeline.generation;

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
public class GenerationRequest {
    private UUID artifactId;
    private String prompt;
    private ContentTier tier;
    // Reference to the avatar's trained model, opaque to the pipeline
    private String avatarModelRef;
    @Builder.Default
    private Map<String, String> templateParams = Map.of();
}
