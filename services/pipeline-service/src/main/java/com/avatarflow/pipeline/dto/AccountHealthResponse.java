package com.avatarflow.pipeline.dto;

import com.avatarflow.pipeline.entity.PlatformAccountHealth;
import com.avatarflow.pipeline.model.AccountHealth;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountHealthResponse {
    private UUID platformAccountId;
    private AccountHealth health;
    private int consecutiveFailures;
    private OffsetDateTime backoffUntil;
    private OffsetDateTime lastSuccessAt;
    private OffsetDateTime lastFailureAt;
    private String lastError;
    private boolean requiresReset;

    public static AccountHealthResponse from(PlatformAccountHealth health) {
        return AccountHealthResponse.builder()
                .platformAccountId(health.getPlatformAccountId())
                .health(health.getHealth())
                .consecutiveFailures(health.getConsecutiveFailures())
                .backoffUntil(health.getBackoffUntil())
                .lastSuccessAt(health.getLastSuccessAt())
                .lastFailureAt(health.getLastFailureAt())
                .lastError(health.getLastError())
                .requiresReset(health.getHealth() == AccountHealth.SUSPENDED)
                .build();
    }
}
