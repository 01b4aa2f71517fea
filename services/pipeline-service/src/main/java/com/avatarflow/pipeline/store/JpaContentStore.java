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
import com.avatarflow.pipeline.repository.ContentArtifactRepository;
import com.avatarflow.pipeline.repository.GenerationBatchRepository;
import com.avatarflow.pipeline.repository.PlatformAccountHealthRepository;
import com.avatarflow.pipeline.repository.PlatformAccountRepository;
import com.avatarflow.pipeline.repository.ScheduledPostRepository;
import com.avatarflow.platform.connector.model.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Relational store on Spring Data JPA. Guarded updates lock the row for the duration of the
 * transaction; the active-post rule is backed by a unique {@code active_key} column.
 */
@Slf4j
@RequiredArgsConstructor
public class JpaContentStore implements ContentStore {

    private static final EnumSet<PostStatus> ACTIVE = EnumSet.of(PostStatus.PENDING, PostStatus.PUBLISHING);

    private final ContentArtifactRepository artifactRepository;
    private final GenerationBatchRepository batchRepository;
    private final ScheduledPostRepository postRepository;
    private final PlatformAccountRepository accountRepository;
    private final PlatformAccountHealthRepository healthRepository;

    // ---- Artifacts ----

    @Override
    @Transactional
    public ContentArtifact createArtifact(ContentArtifact artifact) {
        ContentArtifact toSave = artifact.copy();
        if (toSave.getId() == null) {
            toSave.setId(UUID.randomUUID());
        } else if (artifactRepository.existsById(toSave.getId())) {
            throw new StorageConflictException("Artifact already exists: " + toSave.getId());
        }
        return artifactRepository.save(toSave);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ContentArtifact> findArtifact(UUID artifactId) {
        return artifactRepository.findById(artifactId);
    }

    @Override
    @Transactional
    public ContentArtifact updateArtifact(UUID artifactId, ArtifactStatus expectedStatus,
                                          Consumer<ContentArtifact> mutation) {
        ContentArtifact artifact = artifactRepository.findByIdForUpdate(artifactId)
                .orElseThrow(() -> ResourceNotFoundException.of("Artifact", artifactId));
        StoreGuards.applyArtifactMutation(artifact, expectedStatus, mutation);
        return artifactRepository.save(artifact);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ContentArtifact> listEligibleArtifacts(UUID avatarId) {
        return artifactRepository.findByAvatarIdAndStatusOrderByCreatedAtAsc(avatarId, ArtifactStatus.ELIGIBLE);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ContentArtifact> listArtifactsByBatch(UUID batchId) {
        return artifactRepository.findByBatchIdOrderByCreatedAtAsc(batchId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ContentArtifact> listArtifactsByAvatar(UUID avatarId) {
        return artifactRepository.findByAvatarIdOrderByCreatedAtAsc(avatarId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ContentArtifact> listArtifactsByStatus(ArtifactStatus status) {
        return artifactRepository.findByStatusOrderByCreatedAtAsc(status);
    }

    // ---- Batches ----

    @Override
    @Transactional
    public GenerationBatch createBatch(GenerationBatch batch) {
        GenerationBatch toSave = batch.copy();
        if (toSave.getId() == null) {
            toSave.setId(UUID.randomUUID());
        } else if (batchRepository.existsById(toSave.getId())) {
            throw new StorageConflictException("Batch already exists: " + toSave.getId());
        }
        return batchRepository.save(toSave);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GenerationBatch> findBatch(UUID batchId) {
        return batchRepository.findById(batchId);
    }

    @Override
    @Transactional
    public void appendBatchArtifact(UUID batchId, UUID artifactId) {
        GenerationBatch batch = lockBatch(batchId);
        batch.getArtifactIds().add(artifactId);
        batchRepository.save(batch);
    }

    @Override
    @Transactional
    public GenerationBatch incrementBatchCounter(UUID batchId, BatchCounter counter) {
        int updated = counter == BatchCounter.COMPLETED
                ? batchRepository.incrementCompleted(batchId)
                : batchRepository.incrementFailed(batchId);
        GenerationBatch batch = batchRepository.findById(batchId)
                .orElseThrow(() -> ResourceNotFoundException.of("Batch", batchId));
        if (updated == 0) {
            throw new StorageConflictException(String.format(
                    "Batch %s already resolved %d of %d units", batchId,
                    batch.resolvedCount(), batch.getRequestedCount()));
        }
        return batch;
    }

    @Override
    @Transactional
    public GenerationBatch addBatchCost(UUID batchId, BigDecimal costUsd) {
        if (batchRepository.addCost(batchId, costUsd) == 0) {
            throw ResourceNotFoundException.of("Batch", batchId);
        }
        return batchRepository.findById(batchId)
                .orElseThrow(() -> ResourceNotFoundException.of("Batch", batchId));
    }

    @Override
    @Transactional
    public GenerationBatch updateBatch(UUID batchId, BatchStatus expectedStatus, Consumer<GenerationBatch> mutation) {
        GenerationBatch batch = lockBatch(batchId);
        if (batch.getStatus() != expectedStatus) {
            throw new StorageConflictException(String.format(
                    "Batch %s is %s, expected %s", batchId, batch.getStatus(), expectedStatus));
        }
        mutation.accept(batch);
        return batchRepository.save(batch);
    }

    @Override
    @Transactional
    public GenerationBatch requestBatchCancel(UUID batchId) {
        if (batchRepository.markCancelRequested(batchId) == 0) {
            throw ResourceNotFoundException.of("Batch", batchId);
        }
        return batchRepository.findById(batchId)
                .orElseThrow(() -> ResourceNotFoundException.of("Batch", batchId));
    }

    private GenerationBatch lockBatch(UUID batchId) {
        return batchRepository.findByIdForUpdate(batchId)
                .orElseThrow(() -> ResourceNotFoundException.of("Batch", batchId));
    }

    // ---- Scheduled posts ----

    @Override
    @Transactional
    public ScheduledPost createScheduledPost(ScheduledPost post) {
        if (post.getStatus().isActive()
                && postRepository.findByActiveKey(ScheduledPost.activeKeyFor(post.getArtifactId(), post.getPlatform())).isPresent()) {
            throw duplicate(post);
        }
        ScheduledPost toSave = post.copy();
        if (toSave.getId() == null) {
            toSave.setId(UUID.randomUUID());
        }
        try {
            return postRepository.saveAndFlush(toSave);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent schedule of artifact {} on {} lost the race", post.getArtifactId(), post.getPlatform());
            throw duplicate(post);
        }
    }

    private static DuplicateScheduleException duplicate(ScheduledPost post) {
        return new DuplicateScheduleException(String.format(
                "Artifact %s already has an active post on %s", post.getArtifactId(), post.getPlatform()));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScheduledPost> findScheduledPost(UUID postId) {
        return postRepository.findById(postId);
    }

    @Override
    @Transactional
    public ScheduledPost updateScheduledPost(UUID postId, PostStatus expectedStatus, Consumer<ScheduledPost> mutation) {
        ScheduledPost post = postRepository.findByIdForUpdate(postId)
                .orElseThrow(() -> ResourceNotFoundException.of("Scheduled post", postId));
        if (post.getStatus() != expectedStatus) {
            throw new StorageConflictException(String.format(
                    "Post %s is %s, expected %s", postId, post.getStatus(), expectedStatus));
        }
        UUID artifactId = post.getArtifactId();
        Platform platform = post.getPlatform();
        mutation.accept(post);
        if (!artifactId.equals(post.getArtifactId()) || platform != post.getPlatform()) {
            throw new InvalidRequestException("Post " + postId + " cannot move to another artifact or platform");
        }
        return postRepository.saveAndFlush(post);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScheduledPost> findActivePost(UUID artifactId, Platform platform) {
        return postRepository.findByActiveKey(ScheduledPost.activeKeyFor(artifactId, platform));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledPost> listActivePostsForAccount(UUID platformAccountId) {
        return postRepository.findByPlatformAccountIdAndStatusInOrderByScheduledAtAsc(platformAccountId, ACTIVE);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledPost> listPostsForAccount(UUID platformAccountId) {
        return postRepository.findByPlatformAccountIdOrderByScheduledAtAsc(platformAccountId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledPost> listPostsForArtifact(UUID artifactId) {
        return postRepository.findByArtifactIdOrderByScheduledAtAsc(artifactId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledPost> listDuePosts(OffsetDateTime now, int limit) {
        return postRepository.findDue(PostStatus.PENDING, now, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledPost> listStalledPosts(OffsetDateTime startedBefore) {
        return postRepository.findStartedBefore(PostStatus.PUBLISHING, startedBefore);
    }

    // ---- Platform accounts ----

    @Override
    @Transactional
    public PlatformAccount savePlatformAccount(PlatformAccount account) {
        PlatformAccount toSave = account.copy();
        if (toSave.getId() == null) {
            toSave.setId(UUID.randomUUID());
        }
        return accountRepository.save(toSave);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PlatformAccount> findPlatformAccount(UUID platformAccountId) {
        return accountRepository.findById(platformAccountId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PlatformAccountHealth> getPlatformAccountHealth(UUID platformAccountId) {
        return healthRepository.findById(platformAccountId);
    }

    @Override
    @Transactional
    public PlatformAccountHealth upsertPlatformAccountHealth(PlatformAccountHealth record, long expectedVersion) {
        UUID accountId = record.getPlatformAccountId();
        Optional<PlatformAccountHealth> current = healthRepository.findByIdForUpdate(accountId);
        long storedVersion = current.map(PlatformAccountHealth::getVersion).orElse(0L);
        if (storedVersion != expectedVersion) {
            throw new StorageConflictException(String.format(
                    "Health of account %s is at version %d, expected %d", accountId, storedVersion, expectedVersion));
        }

        PlatformAccountHealth target = current.orElseGet(() -> PlatformAccountHealth.initial(accountId));
        target.setConsecutiveFailures(record.getConsecutiveFailures());
        target.setBackoffUntil(record.getBackoffUntil());
        target.setHealth(record.getHealth());
        target.setLastSuccessAt(record.getLastSuccessAt());
        target.setLastFailureAt(record.getLastFailureAt());
        target.setLastError(record.getLastError());
        target.setVersion(expectedVersion + 1);
        try {
            return healthRepository.saveAndFlush(target);
        } catch (DataIntegrityViolationException e) {
            throw new StorageConflictException("Health of account " + accountId + " was created concurrently");
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<PlatformAccountHealth> listAccountHealth(AccountHealth health) {
        return healthRepository.findByHealth(health);
    }
}
