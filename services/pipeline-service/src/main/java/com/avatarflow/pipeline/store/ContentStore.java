package com.avatarflow.pipeline.store;

import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.entity.GenerationBatch;
import com.avatarflow.pipeline.entity.PlatformAccount;
import com.avatarflow.pipeline.entity.PlatformAccountHealth;
import com.avatarflow.pipeline.entity.ScheduledPost;
import com.avatarflow.pipeline.model.AccountHealth;
import com.avatarflow.pipeline.model.ArtifactStatus;
import com.avatarflow.pipeline.model.BatchCounter;
import com.avatarflow.pipeline.model.BatchStatus;
import com.avatarflow.pipeline.model.PostStatus;
import com.avatarflow.platform.connector.model.Platform;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Durable state of the pipeline: artifacts, batches, scheduled posts, platform accounts and
 * their health.
 * <p>
 * Every mutating operation is atomic for the record it touches. Guarded updates take the
 * status the caller last observed and fail with
 * {@link com.avatarflow.pipeline.exception.StorageConflictException} when the stored record has
 * moved on, so concurrent writers never overwrite each other silently. Returned entities are
 * snapshots; changing them has no effect on the store.
 */
public interface ContentStore {

    // ---- Artifacts ----

    ContentArtifact createArtifact(ContentArtifact artifact);

    Optional<ContentArtifact> findArtifact(UUID artifactId);

    /**
     * Apply {@code mutation} if the artifact is still in {@code expectedStatus}. A status change
     * made by the mutation must be allowed by {@link ArtifactStatus#canTransitionTo}; the tier
     * can never change.
     */
    ContentArtifact updateArtifact(UUID artifactId, ArtifactStatus expectedStatus, Consumer<ContentArtifact> mutation);

    default ContentArtifact updateArtifactStatus(UUID artifactId, ArtifactStatus from, ArtifactStatus to) {
        return updateArtifact(artifactId, from, artifact -> artifact.setStatus(to));
    }

    List<ContentArtifact> listEligibleArtifacts(UUID avatarId);

    List<ContentArtifact> listArtifactsByBatch(UUID batchId);

    List<ContentArtifact> listArtifactsByAvatar(UUID avatarId);

    List<ContentArtifact> listArtifactsByStatus(ArtifactStatus status);

    // ---- Batches ----

    GenerationBatch createBatch(GenerationBatch batch);

    Optional<GenerationBatch> findBatch(UUID batchId);

    void appendBatchArtifact(UUID batchId, UUID artifactId);

    /**
     * Increment one counter, refusing once completed + failed has reached the requested count.
     */
    GenerationBatch incrementBatchCounter(UUID batchId, BatchCounter counter);

    GenerationBatch addBatchCost(UUID batchId, BigDecimal costUsd);

    GenerationBatch updateBatch(UUID batchId, BatchStatus expectedStatus, Consumer<GenerationBatch> mutation);

    default GenerationBatch updateBatchStatus(UUID batchId, BatchStatus from, BatchStatus to) {
        return updateBatch(batchId, from, batch -> batch.setStatus(to));
    }

    GenerationBatch requestBatchCancel(UUID batchId);

    // ---- Scheduled posts ----

    /**
     * Store a new post. Fails with
     * {@link com.avatarflow.pipeline.exception.DuplicateScheduleException} when the artifact
     * already has an active post on the same platform.
     */
    ScheduledPost createScheduledPost(ScheduledPost post);

    Optional<ScheduledPost> findScheduledPost(UUID postId);

    ScheduledPost updateScheduledPost(UUID postId, PostStatus expectedStatus, Consumer<ScheduledPost> mutation);

    Optional<ScheduledPost> findActivePost(UUID artifactId, Platform platform);

    List<ScheduledPost> listActivePostsForAccount(UUID platformAccountId);

    List<ScheduledPost> listPostsForAccount(UUID platformAccountId);

    List<ScheduledPost> listPostsForArtifact(UUID artifactId);

    /**
     * PENDING posts due at or before {@code now}, earliest first.
     */
    List<ScheduledPost> listDuePosts(OffsetDateTime now, int limit);

    /**
     * PUBLISHING posts whose attempt started before {@code startedBefore}.
     */
    List<ScheduledPost> listStalledPosts(OffsetDateTime startedBefore);

    // ---- Platform accounts ----

    PlatformAccount savePlatformAccount(PlatformAccount account);

    Optional<PlatformAccount> findPlatformAccount(UUID platformAccountId);

    Optional<PlatformAccountHealth> getPlatformAccountHealth(UUID platformAccountId);

    /**
     * Compare-and-set write of a health record. {@code expectedVersion} is the version the caller
     * read, 0 for a record that did not exist. The stored record gets {@code expectedVersion + 1}.
     */
    PlatformAccountHealth upsertPlatformAccountHealth(PlatformAccountHealth health, long expectedVersion);

    List<PlatformAccountHealth> listAccountHealth(AccountHealth health);
}
