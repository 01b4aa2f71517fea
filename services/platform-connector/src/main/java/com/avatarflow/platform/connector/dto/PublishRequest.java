package com.avatarflow.platform.connector.dto;

import com.avatarflow.platform.connector.model.Platform;
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
public class PublishRequest {

    /**
     * Stable across retries of the same scheduled post; connectors forward it so the
     * platform can drop a duplicate publish.
     */
    private String idempotencyKey;

    private Platform platform;
    private UUID platformAccountId;
    private UUID artifactId;
    private UUID avatarId;

    // Content
    private String mediaLocator;
    private String caption;
    private String tier;

    private int attempt;

    @Builder.Default
    private Map<String, String> metadata = Map.of();
}
