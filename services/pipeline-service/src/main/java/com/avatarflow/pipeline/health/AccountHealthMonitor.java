package com.avatarflow.pipeline.health;

import com.avatarflow.pipeline.config.PipelineProperties;
import com.avatarflow.pipeline.entity.PlatformAccountHealth;
import com.avatarflow.pipeline.exception.ResourceNotFoundException;
import com.avatarflow.pipeline.exception.StorageConflictException;
import com.avatarflow.pipeline.model.AccountHealth;
import com.avatarflow.pipeline.store.ContentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Tracks consecutive publish failures per platform account and turns them into backoff and
 * health states. This is the only writer of account health records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountHealthMonitor {

    private final ContentStore store;
    private final PipelineProperties properties;
    private final Clock clock;

    /**
     * Health of the account; an account never seen by the monitor is healthy.
     */
    public PlatformAccountHealth getHealth(UUID platformAccountId) {
        return store.getPlatformAccountHealth(platformAccountId)
                .orElseGet(() -> PlatformAccountHealth.initial(platformAccountId));
    }

    public List<PlatformAccountHealth> listByHealth(AccountHealth health) {
        return store.listAccountHealth(health);
    }

    public PlatformAccountHealth recordOutcome(UUID platformAccountId, boolean success, boolean retryable) {
        return recordOutcome(platformAccountId, success, retryable, null);
    }

    public PlatformAccountHealth recordOutcome(UUID platformAccountId, boolean success, boolean retryable, String error) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return update(platformAccountId, current -> success
                ? applySuccess(current, now)
                : applyFailure(current, now, retryable, error));
    }

    /**
     * Operator reset. The only way out of SUSPENDED.
     */
    public PlatformAccountHealth resetAccount(UUID platformAccountId) {
        if (store.findPlatformAccount(platformAccountId).isEmpty()) {
            throw ResourceNotFoundException.of("Platform account", platformAccountId);
        }
        PlatformAccountHealth reset = update(platformAccountId, current -> {
            current.setHealth(AccountHealth.HEALTHY);
            current.setConsecutiveFailures(0);
            current.setBackoffUntil(null);
            current.setLastError(null);
            return current;
        });
        log.info("Account {} reset to HEALTHY", platformAccountId);
        return reset;
    }

    /**
     * Backoff after {@code consecutiveFailures} failures: base * 2^min(n, cap).
     */
    public Duration backoffFor(int consecutiveFailures) {
        PipelineProperties.Health config = properties.getHealth();
        int exponent = Math.min(consecutiveFailures, config.getBackoffExponentCap());
        return config.getBaseBackoff().multipliedBy(1L << exponent);
    }

    private PlatformAccountHealth applySuccess(PlatformAccountHealth current, OffsetDateTime now) {
        current.setConsecutiveFailures(0);
        current.setBackoffUntil(null);
        current.setLastSuccessAt(now);
        current.setLastError(null);
        if (current.getHealth() == AccountHealth.DEGRADED) {
            log.info("Account {} recovered, DEGRADED -> HEALTHY", current.getPlatformAccountId());
            current.setHealth(AccountHealth.HEALTHY);
        }
        return current;
    }

    private PlatformAccountHealth applyFailure(PlatformAccountHealth current, OffsetDateTime now,
                                               boolean retryable, String error) {
        PipelineProperties.Health config = properties.getHealth();
        int failures = current.getConsecutiveFailures() + 1;
        current.setConsecutiveFailures(failures);
        current.setBackoffUntil(now.plus(backoffFor(failures)));
        current.setLastFailureAt(now);
        current.setLastError(error);

        AccountHealth previous = current.getHealth();
        if (previous != AccountHealth.SUSPENDED) {
            if (failures >= config.getSuspendedThreshold()) {
                current.setHealth(AccountHealth.SUSPENDED);
            } else if (failures >= config.getDegradedThreshold()) {
                current.setHealth(AccountHealth.DEGRADED);
            }
        }

        if (current.getHealth() != previous) {
            if (current.getHealth() == AccountHealth.SUSPENDED) {
                log.error("HEALTH ALERT: account {} SUSPENDED after {} consecutive failures, last error: {}",
                        current.getPlatformAccountId(), failures, error);
            } else {
                log.warn("Account {} {} -> {} after {} consecutive failures",
                        current.getPlatformAccountId(), previous, current.getHealth(), failures);
            }
        } else {
            log.debug("Account {} failure #{} ({}), backing off until {}", current.getPlatformAccountId(),
                    failures, retryable ? "retryable" : "permanent", current.getBackoffUntil());
        }
        return current;
    }

    private PlatformAccountHealth update(UUID platformAccountId, UnaryOperator<PlatformAccountHealth> change) {
        int maxAttempts = Math.max(1, properties.getHealth().getMaxUpdateAttempts());
        StorageConflictException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            PlatformAccountHealth current = getHealth(platformAccountId);
            long expectedVersion = current.getVersion();
            PlatformAccountHealth next = change.apply(current.copy());
            try {
                return store.upsertPlatformAccountHealth(next, expectedVersion);
            } catch (StorageConflictException e) {
                lastConflict = e;
                log.debug("Health update for {} lost a race (attempt {}), re-reading", platformAccountId, attempt);
            }
        }
        throw lastConflict;
    }
}
