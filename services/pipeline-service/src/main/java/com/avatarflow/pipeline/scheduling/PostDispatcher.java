package com.avatarflow.pipeline.scheduling;

import com.avatarflow.pipeline.config.PipelineProperties;
import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.entity.PlatformAccount;
import com.avatarflow.pipeline.entity.PlatformAccountHealth;
import com.avatarflow.pipeline.entity.ScheduledPost;
import com.avatarflow.pipeline.exception.PipelineException;
import com.avatarflow.pipeline.exception.StorageConflictException;
import com.avatarflow.pipeline.health.AccountHealthMonitor;
import com.avatarflow.pipeline.model.AccountHealth;
import com.avatarflow.pipeline.model.ArtifactStatus;
import com.avatarflow.pipeline.model.PostStatus;
import com.avatarflow.pipeline.store.ContentStore;
import com.avatarflow.platform.connector.PlatformPublisher;
import com.avatarflow.platform.connector.PublisherRegistry;
import com.avatarflow.platform.connector.dto.PublishRequest;
import com.avatarflow.platform.connector.dto.PublishResult;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The publishing loop. One sweep per tick, guarded by {@link DispatchLock}: recover posts
 * stuck in PUBLISHING, then publish due posts, at most one per account per tick.
 * <p>
 * The post id travels as the idempotency key on every attempt, so a publish retried after a
 * crash or timeout is dropped by platforms that honour the key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostDispatcher {

    private final ContentStore store;
    private final PublisherRegistry publisherRegistry;
    private final AccountHealthMonitor healthMonitor;
    private final DistributionScheduler distributionScheduler;
    private final DispatchLock dispatchLock;
    private final PipelineProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${pipeline.dispatch.tick-ms:30000}",
               initialDelayString = "${pipeline.dispatch.initial-delay-ms:10000}")
    public void scheduledTick() {
        DispatchReport report = dispatchDuePosts();
        if (report.getExamined() > 0 || report.getRecovered() > 0) {
            log.info("Dispatch tick: {}", report);
        }
    }

    public DispatchReport dispatchDuePosts() {
        if (!dispatchLock.tryAcquire()) {
            log.debug("Another dispatch sweep is running, skipping tick");
            return DispatchReport.skipped();
        }
        try {
            return sweep();
        } finally {
            dispatchLock.release();
        }
    }

    private DispatchReport sweep() {
        PipelineProperties.Dispatch config = properties.getDispatch();
        OffsetDateTime now = OffsetDateTime.now(clock);
        DispatchReport report = DispatchReport.builder().lockAcquired(true).build();

        report.setRecovered(recoverStalled(now));

        List<ScheduledPost> due = store.listDuePosts(now, config.getBatchSize());
        Set<UUID> accountsThisTick = new HashSet<>();

        for (ScheduledPost post : due) {
            report.setExamined(report.getExamined() + 1);
            UUID accountId = post.getPlatformAccountId();
            if (!accountsThisTick.add(accountId)) {
                report.setDeferred(report.getDeferred() + 1);
                continue;
            }

            Optional<PlatformAccount> account = store.findPlatformAccount(accountId);
            if (account.isEmpty()) {
                failWithoutAttempt(post, "Platform account " + accountId + " no longer exists");
                report.setFailed(report.getFailed() + 1);
                continue;
            }

            PlatformAccountHealth health = healthMonitor.getHealth(accountId);
            if (health.getHealth() == AccountHealth.SUSPENDED) {
                report.setHeld(report.getHeld() + 1);
                continue;
            }
            if (health.isBackingOff(now)) {
                log.debug("Account {} backing off until {}, deferring post {}", accountId,
                        health.getBackoffUntil(), post.getId());
                report.setDeferred(report.getDeferred() + 1);
                continue;
            }
            Duration minGap = SlotPlanner.minimumGap(account.get().effectiveMinSpacing(),
                    properties.getScheduling().jitterRatioFor(post.getPlatform()));
            if (health.getLastSuccessAt() != null && health.getLastSuccessAt().plus(minGap).isAfter(now)) {
                log.debug("Account {} published at {}, deferring post {}", accountId,
                        health.getLastSuccessAt(), post.getId());
                report.setDeferred(report.getDeferred() + 1);
                continue;
            }

            if (!dispatchLock.renew()) {
                log.warn("Dispatch lock lost after {} post(s), leaving the rest for the next tick",
                        report.getExamined() - 1);
                report.setDeferred(report.getDeferred() + 1);
                break;
            }

            try {
                switch (publish(post, now)) {
                    case PUBLISHED -> report.setPublished(report.getPublished() + 1);
                    case RETRY -> report.setRetried(report.getRetried() + 1);
                    case FAILED -> report.setFailed(report.getFailed() + 1);
                    case SKIPPED -> report.setDeferred(report.getDeferred() + 1);
                }
            } catch (PipelineException e) {
                log.warn("Post {} changed while publishing, outcome not recorded: {}", post.getId(), e.getMessage());
                report.setConflicts(report.getConflicts() + 1);
            }
        }
        return report;
    }

    /**
     * A publish must finish well inside the stall timeout and the lock lease, or a second
     * sweep could take the same post over while it is still in flight.
     */
    @PostConstruct
    public void validateTimeouts() {
        PipelineProperties.Dispatch config = properties.getDispatch();
        Duration publishTimeout = config.getPublishTimeout();
        if (config.getStallTimeout().compareTo(publishTimeout) <= 0) {
            throw new IllegalStateException(String.format(
                    "pipeline.dispatch.stall-timeout (%s) must exceed publish-timeout (%s)",
                    config.getStallTimeout(), publishTimeout));
        }
        if (config.getLock() == PipelineProperties.LockType.REDIS
                && config.getLockLease().compareTo(publishTimeout) <= 0) {
            throw new IllegalStateException(String.format(
                    "pipeline.dispatch.lock-lease (%s) must exceed publish-timeout (%s)",
                    config.getLockLease(), publishTimeout));
        }
    }

    private enum Outcome { PUBLISHED, RETRY, FAILED, SKIPPED }

    private Outcome publish(ScheduledPost post, OffsetDateTime now) {
        Optional<ContentArtifact> artifact = store.findArtifact(post.getArtifactId());
        if (artifact.isEmpty()) {
            failWithoutAttempt(post, "Artifact " + post.getArtifactId() + " no longer exists");
            return Outcome.FAILED;
        }

        ScheduledPost publishing;
        try {
            publishing = store.updateScheduledPost(post.getId(), PostStatus.PENDING, p -> {
                p.setStatus(PostStatus.PUBLISHING);
                p.setAttemptCount(p.getAttemptCount() + 1);
                p.setPublishStartedAt(now);
                p.setUpdatedAt(now);
            });
        } catch (StorageConflictException e) {
            log.debug("Post {} changed before publishing: {}", post.getId(), e.getMessage());
            return Outcome.SKIPPED;
        }

        PublishResult result = callPublisher(publishing, artifact.get());
        return applyResult(publishing, result);
    }

    private PublishResult callPublisher(ScheduledPost post, ContentArtifact artifact) {
        Optional<PlatformPublisher> publisher = publisherRegistry.find(post.getPlatform());
        if (publisher.isEmpty()) {
            return PublishResult.permanentFailure(post.getPlatform(), "NO_PUBLISHER",
                    "No publisher configured for " + post.getPlatform());
        }

        PublishRequest request = PublishRequest.builder()
                .idempotencyKey(post.getId().toString())
                .platform(post.getPlatform())
                .platformAccountId(post.getPlatformAccountId())
                .artifactId(artifact.getId())
                .avatarId(artifact.getAvatarId())
                .mediaLocator(artifact.getStorageLocator())
                .caption(artifact.getMetadata().get("caption"))
                .tier(artifact.getTier().name())
                .attempt(post.getAttemptCount())
                .metadata(new HashMap<>(artifact.getMetadata()))
                .build();

        try {
            PublishResult result = publisher.get().publish(request, properties.getDispatch().getPublishTimeout());
            if (result == null) {
                return PublishResult.retryableFailure(post.getPlatform(), "EMPTY_RESULT", "Publisher returned nothing");
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Publisher for {} threw on post {}: {}", post.getPlatform(), post.getId(), e.getMessage(), e);
            return PublishResult.retryableFailure(post.getPlatform(), "INTERNAL_ERROR", e.getMessage());
        }
    }

    private Outcome applyResult(ScheduledPost post, PublishResult result) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UUID accountId = post.getPlatformAccountId();

        if (result.isSuccess()) {
            store.updateScheduledPost(post.getId(), PostStatus.PUBLISHING, p -> {
                p.setStatus(PostStatus.PUBLISHED);
                p.setPublishedAt(now);
                p.setPlatformPostId(result.getPlatformPostId());
                p.setLastError(null);
                p.setUpdatedAt(now);
            });
            markArtifactPublished(post.getArtifactId());
            healthMonitor.recordOutcome(accountId, true, false);
            log.info("Published post {} to {} as {}", post.getId(), post.getPlatform().getDisplayName(),
                    result.getPlatformPostId());
            return Outcome.PUBLISHED;
        }

        String error = result.describeError();
        int maxAttempts = properties.getDispatch().getMaxAttempts();
        boolean retry = result.isRetryable() && post.getAttemptCount() < maxAttempts;

        if (retry) {
            store.updateScheduledPost(post.getId(), PostStatus.PUBLISHING, p -> {
                p.setStatus(PostStatus.PENDING);
                p.setLastError(error);
                p.setUpdatedAt(now);
            });
            log.warn("Publish attempt {}/{} of post {} failed, will retry: {}", post.getAttemptCount(),
                    maxAttempts, post.getId(), error);
        } else {
            store.updateScheduledPost(post.getId(), PostStatus.PUBLISHING, p -> {
                p.setStatus(PostStatus.FAILED);
                p.setLastError(error);
                p.setUpdatedAt(now);
            });
            log.warn("Post {} on {} FAILED after {} attempt(s), needs operator attention: {}", post.getId(),
                    post.getPlatform().getDisplayName(), post.getAttemptCount(), error);
            distributionScheduler.releaseArtifactIfIdle(post.getArtifactId());
        }

        healthMonitor.recordOutcome(accountId, false, result.isRetryable(), error);
        return retry ? Outcome.RETRY : Outcome.FAILED;
    }

    private void markArtifactPublished(UUID artifactId) {
        try {
            store.findArtifact(artifactId)
                    .filter(a -> a.getStatus() == ArtifactStatus.SCHEDULED)
                    .ifPresent(a -> store.updateArtifact(artifactId, ArtifactStatus.SCHEDULED, u -> {
                        u.setStatus(ArtifactStatus.PUBLISHED);
                        u.setUpdatedAt(OffsetDateTime.now(clock));
                    }));
        } catch (PipelineException e) {
            log.warn("Could not mark artifact {} published: {}", artifactId, e.getMessage());
        }
    }

    private int recoverStalled(OffsetDateTime now) {
        PipelineProperties.Dispatch config = properties.getDispatch();
        int recovered = 0;
        for (ScheduledPost post : store.listStalledPosts(now.minus(config.getStallTimeout()))) {
            boolean exhausted = post.getAttemptCount() >= config.getMaxAttempts();
            try {
                store.updateScheduledPost(post.getId(), PostStatus.PUBLISHING, p -> {
                    p.setStatus(exhausted ? PostStatus.FAILED : PostStatus.PENDING);
                    p.setLastError("Publish interrupted after starting at " + post.getPublishStartedAt());
                    p.setUpdatedAt(now);
                });
                recovered++;
                if (exhausted) {
                    log.warn("Stalled post {} has no attempts left, marked FAILED", post.getId());
                    distributionScheduler.releaseArtifactIfIdle(post.getArtifactId());
                } else {
                    log.warn("Recovered stalled post {}, will retry with the same idempotency key", post.getId());
                }
            } catch (StorageConflictException e) {
                log.debug("Stalled post {} moved on: {}", post.getId(), e.getMessage());
            }
        }
        return recovered;
    }

    private void failWithoutAttempt(ScheduledPost post, String reason) {
        try {
            store.updateScheduledPost(post.getId(), PostStatus.PENDING, p -> {
                p.setStatus(PostStatus.FAILED);
                p.setLastError(reason);
                p.setUpdatedAt(OffsetDateTime.now(clock));
            });
            log.warn("Post {} FAILED: {}", post.getId(), reason);
        } catch (StorageConflictException e) {
            log.debug("Post {} moved on: {}", post.getId(), e.getMessage());
        }
    }
}
