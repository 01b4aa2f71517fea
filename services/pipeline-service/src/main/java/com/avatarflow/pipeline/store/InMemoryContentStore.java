package com.avatarflow.pipeline.store;

import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.entity.GenerationBatch;
import com.avatarflow.pipeline.entity.PlatformAccount;
import com.avatarflow.pipeline.entity.PlatformAccountHealth;
import com.avatarflow.pipeline.entity.ScheduledPost;
import com.avatarflow.pipeline.exception.DuplicateScheduleException;
import com.avatarflow.pipeline.exception.InvalidRequestException;
import com.avatarflow.pipeline.exception.ResourceNotFoundException;
import com.avatarflow.pipeline.exception.StorageConflictException;
import com.avatarflow.pipeline.model.AccountHealth;
import com.avatarflow.pipeline.model.ArtifactStatus;
import com.avatarflow.pipeline.model.BatchCounter;
import com.avatarflow.pipeline.model.BatchStatus;
import com.avatarflow.pipeline.model.PostStatus;
import com.avatarflow.platform.connector.model.Platform;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Map-backed store. Each record is replaced atomically through {@link ConcurrentHashMap#compute};
 * mutations run against a copy so a failed guard leaves the stored record untouched.
 */
public class InMemoryContentStore implements ContentStore {

    private final Map<UUID, ContentArtifact> artifacts = new ConcurrentHashMap<>();
    private final Map<UUID, GenerationBatch> batches = new ConcurrentHashMap<>();
    private final Map<UUID, ScheduledPost> posts = new ConcurrentHashMap<>();
    private final Map<UUID, PlatformAccount> accounts = new ConcurrentHashMap<>();
    private final Map<UUID, PlatformAccountHealth> health = new ConcurrentHashMap<>();

    // Serializes writes that touch the active (artifact, platform) slot
    private final Object postMonitor = new Object();

    // ---- Artifacts ----

    @Override
    public ContentArtifact createArtifact(ContentArtifact artifact) {
        ContentArtifact stored = artifact.copy();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID());
        }
        if (artifacts.putIfAbsent(stored.getId(), stored) != null) {
            throw new StorageConflictException("Artifact already exists: " + stored.getId());
        }
        return stored.copy();
    }

    @Override
    public Optional<ContentArtifact> findArtifact(UUID artifactId) {
        return Optional.ofNullable(artifacts.get(artifactId)).map(ContentArtifact::copy);
    }

    @Override
    public ContentArtifact updateArtifact(UUID artifactId, ArtifactStatus expectedStatus,
                                          Consumer<ContentArtifact> mutation) {
        ContentArtifact updated = artifacts.compute(artifactId, (id, current) -> {
            if (current == null) {
                throw ResourceNotFoundException.of("Artifact", id);
            }
            ContentArtifact working = current.copy();
            StoreGuards.applyArtifactMutation(working, expectedStatus, mutation);
            return working;
        });
        return updated.copy();
    }

    @Override
    public List<ContentArtifact> listEligibleArtifacts(UUID avatarId) {
        return listArtifacts(a -> a.getAvatarId().equals(avatarId) && a.getStatus() == ArtifactStatus.ELIGIBLE);
    }

    @Override
    public List<ContentArtifact> listArtifactsByBatch(UUID batchId) {
        return listArtifacts(a -> batchId.equals(a.getBatchId()));
    }

    @Override
    public List<ContentArtifact> listArtifactsByAvatar(UUID avatarId) {
        return listArtifacts(a -> a.getAvatarId().equals(avatarId));
    }

    @Override
    public List<ContentArtifact> listArtifactsByStatus(ArtifactStatus status) {
        return listArtifacts(a -> a.getStatus() == status);
    }

    private List<ContentArtifact> listArtifacts(Predicate<ContentArtifact> filter) {
        return artifacts.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(ContentArtifact::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(ContentArtifact::copy)
                .collect(Collectors.toList());
    }

    // ---- Batches ----

    @Override
    public GenerationBatch createBatch(GenerationBatch batch) {
        GenerationBatch stored = batch.copy();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID());
        }
        if (batches.putIfAbsent(stored.getId(), stored) != null) {
            throw new StorageConflictException("Batch already exists: " + stored.getId());
        }
        return stored.copy();
    }

    @Override
    public Optional<GenerationBatch> findBatch(UUID batchId) {
        return Optional.ofNullable(batches.get(batchId)).map(GenerationBatch::copy);
    }

    @Override
    public void appendBatchArtifact(UUID batchId, UUID artifactId) {
        mutateBatch(batchId, batch -> batch.getArtifactIds().add(artifactId));
    }

    @Override
    public GenerationBatch incrementBatchCounter(UUID batchId, BatchCounter counter) {
        return mutateBatch(batchId, batch -> {
            if (batch.resolvedCount() >= batch.getRequestedCount()) {
                throw new StorageConflictException(String.format(
                        "Batch %s already resolved %d of %d units", batchId,
                        batch.resolvedCount(), batch.getRequestedCount()));
            }
            if (counter == BatchCounter.COMPLETED) {
                batch.setCompletedCount(batch.getCompletedCount() + 1);
            } else {
                batch.setFailedCount(batch.getFailedCount() + 1);
            }
        });
    }

    @Override
    public GenerationBatch addBatchCost(UUID batchId, BigDecimal costUsd) {
        return mutateBatch(batchId, batch -> batch.setTotalCostUsd(batch.getTotalCostUsd().add(costUsd)));
    }

    @Override
    public GenerationBatch updateBatch(UUID batchId, BatchStatus expectedStatus, Consumer<GenerationBatch> mutation) {
        return mutateBatch(batchId, batch -> {
            if (batch.getStatus() != expectedStatus) {
                throw new StorageConflictException(String.format(
                        "Batch %s is %s, expected %s", batchId, batch.getStatus(), expectedStatus));
            }
            mutation.accept(batch);
        });
    }

    @Override
    public GenerationBatch requestBatchCancel(UUID batchId) {
        return mutateBatch(batchId, batch -> batch.setCancelRequested(true));
    }

    private GenerationBatch mutateBatch(UUID batchId, Consumer<GenerationBatch> mutation) {
        GenerationBatch updated = batches.compute(batchId, (id, current) -> {
            if (current == null) {
                throw ResourceNotFoundException.of("Batch", id);
            }
            GenerationBatch working = current.copy();
            mutation.accept(working);
            return working;
        });
        return updated.copy();
    }

    // ---- Scheduled posts ----

    @Override
    public ScheduledPost createScheduledPost(ScheduledPost post) {
        synchronized (postMonitor) {
            if (post.getStatus().isActive() && findActivePost(post.getArtifactId(), post.getPlatform()).isPresent()) {
                throw new DuplicateScheduleException(String.format(
                        "Artifact %s already has an active post on %s", post.getArtifactId(), post.getPlatform()));
            }
            ScheduledPost stored = post.copy();
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID());
            }
            stored.syncActiveKey();
            posts.put(stored.getId(), stored);
            return stored.copy();
        }
    }

    @Override
    public Optional<ScheduledPost> findScheduledPost(UUID postId) {
        return Optional.ofNullable(posts.get(postId)).map(ScheduledPost::copy);
    }

    @Override
    public ScheduledPost updateScheduledPost(UUID postId, PostStatus expectedStatus, Consumer<ScheduledPost> mutation) {
        synchronized (postMonitor) {
            ScheduledPost current = posts.get(postId);
            if (current == null) {
                throw ResourceNotFoundException.of("Scheduled post", postId);
            }
            if (current.getStatus() != expectedStatus) {
                throw new StorageConflictException(String.format(
                        "Post %s is %s, expected %s", postId, current.getStatus(), expectedStatus));
            }
            ScheduledPost working = current.copy();
            mutation.accept(working);
            if (!working.getArtifactId().equals(current.getArtifactId()) || working.getPlatform() != current.getPlatform()) {
                throw new InvalidRequestException("Post " + postId + " cannot move to another artifact or platform");
            }
            working.syncActiveKey();
            posts.put(postId, working);
            return working.copy();
        }
    }

    @Override
    public Optional<ScheduledPost> findActivePost(UUID artifactId, Platform platform) {
        return posts.values().stream()
                .filter(p -> p.getArtifactId().equals(artifactId) && p.getPlatform() == platform)
                .filter(p -> p.getStatus().isActive())
                .findFirst()
                .map(ScheduledPost::copy);
    }

    @Override
    public List<ScheduledPost> listActivePostsForAccount(UUID platformAccountId) {
        return listPosts(p -> p.getPlatformAccountId().equals(platformAccountId) && p.getStatus().isActive());
    }

    @Override
    public List<ScheduledPost> listPostsForAccount(UUID platformAccountId) {
        return listPosts(p -> p.getPlatformAccountId().equals(platformAccountId));
    }

    @Override
    public List<ScheduledPost> listPostsForArtifact(UUID artifactId) {
        return listPosts(p -> p.getArtifactId().equals(artifactId));
    }

    @Override
    public List<ScheduledPost> listDuePosts(OffsetDateTime now, int limit) {
        return posts.values().stream()
                .filter(p -> p.getStatus() == PostStatus.PENDING && !p.getScheduledAt().isAfter(now))
                .sorted(Comparator.comparing(ScheduledPost::getScheduledAt))
                .limit(limit)
                .map(ScheduledPost::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<ScheduledPost> listStalledPosts(OffsetDateTime startedBefore) {
        return listPosts(p -> p.getStatus() == PostStatus.PUBLISHING
                && p.getPublishStartedAt() != null
                && p.getPublishStartedAt().isBefore(startedBefore));
    }

    private List<ScheduledPost> listPosts(Predicate<ScheduledPost> filter) {
        return posts.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(ScheduledPost::getScheduledAt))
                .map(ScheduledPost::copy)
                .collect(Collectors.toList());
    }

    // ---- Platform accounts ----

    @Override
    public PlatformAccount savePlatformAccount(PlatformAccount account) {
        PlatformAccount stored = account.copy();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID());
        }
        accounts.put(stored.getId(), stored);
        return stored.copy();
    }

    @Override
    public Optional<PlatformAccount> findPlatformAccount(UUID platformAccountId) {
        return Optional.ofNullable(accounts.get(platformAccountId)).map(PlatformAccount::copy);
    }

    @Override
    public Optional<PlatformAccountHealth> getPlatformAccountHealth(UUID platformAccountId) {
        return Optional.ofNullable(health.get(platformAccountId)).map(PlatformAccountHealth::copy);
    }

    @Override
    public PlatformAccountHealth upsertPlatformAccountHealth(PlatformAccountHealth record, long expectedVersion) {
        PlatformAccountHealth updated = health.compute(record.getPlatformAccountId(), (id, current) -> {
            long storedVersion = current == null ? 0 : current.getVersion();
            if (storedVersion != expectedVersion) {
                throw new StorageConflictException(String.format(
                        "Health of account %s is at version %d, expected %d", id, storedVersion, expectedVersion));
            }
            PlatformAccountHealth working = record.copy();
            working.setVersion(expectedVersion + 1);
            return working;
        });
        return updated.copy();
    }

    @Override
    public List<PlatformAccountHealth> listAccountHealth(AccountHealth state) {
        return health.values().stream()
                .filter(h -> h.getHealth() == state)
                .map(PlatformAccountHealth::copy)
                .collect(Collectors.toList());
    }
}
