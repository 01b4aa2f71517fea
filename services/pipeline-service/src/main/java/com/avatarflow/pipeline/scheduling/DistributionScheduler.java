package com.avatarflow.pipeline.scheduling;

import com.avatarflow.pipeline.config.PipelineProperties;
import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.entity.PlatformAccount;
import com.avatarflow.pipeline.entity.PlatformAccountHealth;
import com.avatarflow.pipeline.entity.ScheduledPost;
import com.avatarflow.pipeline.exception.AccountUnavailableException;
import com.avatarflow.pipeline.exception.DuplicateScheduleException;
import com.avatarflow.pipeline.exception.InvalidRequestException;
import com.avatarflow.pipeline.exception.PipelineException;
import com.avatarflow.pipeline.exception.ResourceNotFoundException;
import com.avatarflow.pipeline.exception.StorageConflictException;
import com.avatarflow.pipeline.health.AccountHealthMonitor;
import com.avatarflow.pipeline.model.AccountHealth;
import com.avatarflow.pipeline.model.ArtifactStatus;
import com.avatarflow.pipeline.model.PostStatus;
import com.avatarflow.pipeline.store.ContentStore;
import com.avatarflow.platform.connector.model.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Creates scheduled posts for eligible artifacts. Scheduling is serialized per platform
 * account so two concurrent calls can never claim slots closer than the minimum gap.
 * Accounts map onto a fixed set of lock stripes; two accounts sharing a stripe only wait
 * on each other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributionScheduler {

    private final ContentStore store;
    private final SlotPlanner slotPlanner;
    private final AccountHealthMonitor healthMonitor;
    private final PipelineProperties properties;
    private final Clock clock;

    static final int LOCK_STRIPES = 64;

    private final Object[] accountLocks = newStripes();

    public ScheduledPost scheduleArtifact(UUID artifactId, Platform platform, UUID platformAccountId,
                                          TargetWindow targetWindow) {
        if (artifactId == null || platform == null || platformAccountId == null) {
            throw new InvalidRequestException("artifactId, platform and platformAccountId are required");
        }
        TargetWindow window = checkWindow(targetWindow);

        synchronized (lockFor(platformAccountId)) {
            return scheduleLocked(artifactId, platform, platformAccountId, window);
        }
    }

    /**
     * Schedule several artifacts on one account in list order, holding the account lock for
     * the whole list so each slot respects the spacing and daily cap of the ones before it.
     * An artifact that cannot be scheduled is reported and the rest still go ahead.
     *
     * @throws ResourceNotFoundException when the account does not exist
     */
    public BulkScheduleResult scheduleArtifacts(UUID platformAccountId, List<UUID> artifactIds,
                                                TargetWindow targetWindow) {
        if (platformAccountId == null || artifactIds == null || artifactIds.isEmpty()) {
            throw new InvalidRequestException("platformAccountId and at least one artifactId are required");
        }
        TargetWindow window = checkWindow(targetWindow);
        PlatformAccount account = store.findPlatformAccount(platformAccountId)
                .orElseThrow(() -> ResourceNotFoundException.of("Platform account", platformAccountId));

        BulkScheduleResult result = new BulkScheduleResult();
        synchronized (lockFor(platformAccountId)) {
            for (UUID artifactId : artifactIds) {
                if (artifactId == null) {
                    result.getFailures().add(failure(null, new InvalidRequestException("artifactId is required")));
                    continue;
                }
                try {
                    result.getScheduled().add(scheduleLocked(artifactId, account.getPlatform(), platformAccountId, window));
                } catch (PipelineException e) {
                    log.info("Skipped artifact {} in bulk schedule for account {}: {}", artifactId,
                            platformAccountId, e.getMessage());
                    result.getFailures().add(failure(artifactId, e));
                }
            }
        }
        log.info("Bulk scheduled {} of {} artifacts on account {}", result.getScheduled().size(),
                artifactIds.size(), platformAccountId);
        return result;
    }

    private static BulkScheduleResult.Failure failure(UUID artifactId, PipelineException e) {
        return BulkScheduleResult.Failure.builder()
                .artifactId(artifactId)
                .code(e.getErrorCode().getCode())
                .message(e.getMessage())
                .build();
    }

    private static TargetWindow checkWindow(TargetWindow targetWindow) {
        TargetWindow window = targetWindow != null ? targetWindow : TargetWindow.openEnded();
        if (window.getStart() != null && window.getEnd() != null && window.getEnd().isBefore(window.getStart())) {
            throw new InvalidRequestException("Target window ends before it starts");
        }
        return window;
    }

    Object lockFor(UUID platformAccountId) {
        return accountLocks[Math.floorMod(platformAccountId.hashCode(), LOCK_STRIPES)];
    }

    private static Object[] newStripes() {
        Object[] stripes = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new Object();
        }
        return stripes;
    }

    private ScheduledPost scheduleLocked(UUID artifactId, Platform platform, UUID platformAccountId,
                                         TargetWindow window) {
        ContentArtifact artifact = store.findArtifact(artifactId)
                .orElseThrow(() -> ResourceNotFoundException.of("Artifact", artifactId));
        if (!artifact.getStatus().isSchedulable()) {
            throw new InvalidRequestException(String.format(
                    "Artifact %s is %s and cannot be scheduled", artifactId, artifact.getStatus()));
        }

        PlatformAccount account = store.findPlatformAccount(platformAccountId)
                .orElseThrow(() -> ResourceNotFoundException.of("Platform account", platformAccountId));
        if (account.getPlatform() != platform) {
            throw new InvalidRequestException(String.format(
                    "Account %s belongs to %s, not %s", platformAccountId, account.getPlatform(), platform));
        }
        if (!account.getAvatarId().equals(artifact.getAvatarId())) {
            throw new InvalidRequestException(String.format(
                    "Account %s does not belong to avatar %s", platformAccountId, artifact.getAvatarId()));
        }
        if (!properties.getScheduling().isTierAllowed(platform, artifact.getTier())) {
            throw new InvalidRequestException(String.format(
                    "%s content is not allowed on %s", artifact.getTier(), platform.getDisplayName()));
        }

        PlatformAccountHealth health = healthMonitor.getHealth(platformAccountId);
        if (health.getHealth() == AccountHealth.SUSPENDED) {
            throw new AccountUnavailableException("Account " + platformAccountId + " is suspended until reset");
        }
        if (store.findActivePost(artifactId, platform).isPresent()) {
            throw new DuplicateScheduleException(String.format(
                    "Artifact %s already has an active post on %s", artifactId, platform));
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Instant anchor = now.toInstant();
        if (window.getStart() != null && window.getStart().toInstant().isAfter(anchor)) {
            anchor = window.getStart().toInstant();
        }
        if (health.isBackingOff(now) && health.getBackoffUntil().toInstant().isAfter(anchor)) {
            anchor = health.getBackoffUntil().toInstant();
        }

        OffsetDateTime slot = slotPlanner.nextSlot(account, occupiedSlots(platformAccountId), anchor,
                properties.getScheduling().jitterRatioFor(platform),
                properties.getScheduling().getMaxLookaheadDays());
        if (window.getEnd() != null && slot.isAfter(window.getEnd())) {
            log.info("Slot {} for artifact {} falls after the requested window end {}", slot, artifactId, window.getEnd());
        }

        ScheduledPost post = store.createScheduledPost(ScheduledPost.builder()
                .artifactId(artifactId)
                .platformAccountId(platformAccountId)
                .platform(platform)
                .scheduledAt(slot)
                .timezone(account.getTimezone())
                .status(PostStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build());

        markArtifactScheduled(artifact, post);

        log.info("Scheduled artifact {} on {} account {} at {}", artifactId, platform.getDisplayName(),
                platformAccountId, slot);
        return post;
    }

    private List<Instant> occupiedSlots(UUID platformAccountId) {
        return store.listPostsForAccount(platformAccountId).stream()
                .filter(p -> p.getStatus().isActive() || p.getStatus() == PostStatus.PUBLISHED)
                .map(p -> p.getStatus() == PostStatus.PUBLISHED && p.getPublishedAt() != null
                        ? p.getPublishedAt().toInstant()
                        : p.getScheduledAt().toInstant())
                .collect(Collectors.toList());
    }

    private void markArtifactScheduled(ContentArtifact artifact, ScheduledPost post) {
        if (artifact.getStatus() != ArtifactStatus.ELIGIBLE) {
            return;
        }
        try {
            store.updateArtifact(artifact.getId(), ArtifactStatus.ELIGIBLE, a -> {
                a.setStatus(ArtifactStatus.SCHEDULED);
                a.setUpdatedAt(OffsetDateTime.now(clock));
            });
        } catch (StorageConflictException e) {
            ArtifactStatus current = store.findArtifact(artifact.getId())
                    .map(ContentArtifact::getStatus)
                    .orElse(ArtifactStatus.FAILED);
            if (current == ArtifactStatus.SCHEDULED || current == ArtifactStatus.PUBLISHED) {
                return;
            }
            store.updateScheduledPost(post.getId(), PostStatus.PENDING, p -> p.setStatus(PostStatus.CANCELLED));
            throw new StorageConflictException(String.format(
                    "Artifact %s moved to %s while being scheduled", artifact.getId(), current));
        }
    }

    public ScheduledPost cancelScheduledPost(UUID postId) {
        ScheduledPost post = getPost(postId);
        if (post.getStatus() == PostStatus.PUBLISHING) {
            throw new InvalidRequestException("Post " + postId + " is being published and cannot be cancelled");
        }
        if (post.getStatus() != PostStatus.PENDING) {
            throw new InvalidRequestException("Post " + postId + " is already " + post.getStatus());
        }
        ScheduledPost cancelled = store.updateScheduledPost(postId, PostStatus.PENDING, p -> {
            p.setStatus(PostStatus.CANCELLED);
            p.setUpdatedAt(OffsetDateTime.now(clock));
        });
        releaseArtifactIfIdle(post.getArtifactId());
        log.info("Cancelled post {} for artifact {}", postId, post.getArtifactId());
        return cancelled;
    }

    /**
     * Return a SCHEDULED artifact to ELIGIBLE once none of its posts is active any more.
     */
    public void releaseArtifactIfIdle(UUID artifactId) {
        boolean active = store.listPostsForArtifact(artifactId).stream().anyMatch(p -> p.getStatus().isActive());
        if (active) {
            return;
        }
        try {
            store.findArtifact(artifactId)
                    .filter(a -> a.getStatus() == ArtifactStatus.SCHEDULED)
                    .ifPresent(a -> store.updateArtifact(artifactId, ArtifactStatus.SCHEDULED, u -> {
                        u.setStatus(ArtifactStatus.ELIGIBLE);
                        u.setUpdatedAt(OffsetDateTime.now(clock));
                    }));
        } catch (PipelineException e) {
            log.warn("Could not release artifact {}: {}", artifactId, e.getMessage());
        }
    }

    public ScheduledPost getPost(UUID postId) {
        return store.findScheduledPost(postId)
                .orElseThrow(() -> ResourceNotFoundException.of("Scheduled post", postId));
    }

    public List<ScheduledPost> listPostsForArtifact(UUID artifactId) {
        return store.listPostsForArtifact(artifactId);
    }

    public List<ScheduledPost> listPostsForAccount(UUID platformAccountId) {
        return store.listPostsForAccount(platformAccountId);
    }

    /**
     * Posts still waiting to go out or being published, earliest first.
     */
    public List<ScheduledPost> listActivePostsForAccount(UUID platformAccountId) {
        return store.listActivePostsForAccount(platformAccountId);
    }
}
