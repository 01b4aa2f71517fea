package com.avatarflow.pipeline.entity;

import com.avatarflow.pipeline.model.AccountHealth;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "platform_account_health")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlatformAccountHealth {

    @Id
    @Column(name = "platform_account_id")
    private UUID platformAccountId;

    @Column(name = "consecutive_failures")
    @Builder.Default
    private int consecutiveFailures = 0;

    @Column(name = "backoff_until")
    private OffsetDateTime backoffUntil;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AccountHealth health = AccountHealth.HEALTHY;

    @Column(name = "last_success_at")
    private OffsetDateTime lastSuccessAt;

    @Column(name = "last_failure_at")
    private OffsetDateTime lastFailureAt;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    /**
     * Compare-and-set token. 0 means the record has never been stored.
     */
    @Column(nullable = false)
    private long version;

    public static PlatformAccountHealth initial(UUID platformAccountId) {
        return PlatformAccountHealth.builder()
                .platformAccountId(platformAccountId)
                .health(AccountHealth.HEALTHY)
                .version(0)
                .build();
    }

    public boolean isBackingOff(OffsetDateTime now) {
        return backoffUntil != null && backoffUntil.isAfter(now);
    }

    public PlatformAccountHealth copy() {
        return toBuilder().build();
    }
}
