package com.avatarflow.pipeline.store;

import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.entity.GenerationBatch;
import com.avatarflow.pipeline.entity.PlatformAccount;
import com.avatarflow.pipeline.entity.PlatformAccountHealth;
import com.avatarflow.pipeline.entity.ScheduledPost;
import com.avatarflow.pipeline.exception.DuplicateScheduleException;
import com.avatarflow.pipeline.exception.InvalidRequestException;
import com.avatarflow.pipeline.exception.StorageConflictException;
import com.avatarflow.pipeline.model.AccountHealth;
import com.avatarflow.pipeline.model.ArtifactStatus;
import com.avatarflow.pipeline.model.BatchCounter;
import com.avatarflow.pipeline.model.BatchStatus;
import com.avatarflow.pipeline.model.ContentTier;
import com.avatarflow.pipeline.model.PostStatus;
import com.avatarflow.pipeline.repository.ContentArtifactRepository;
import com.avatarflow.pipeline.repository.GenerationBatchRepository;
import com.avatarflow.pipeline.repository.PlatformAccountHealthRepository;
import com.avatarflow.pipeline.repository.PlatformAccountRepository;
import com.avatarflow.pipeline.repository.ScheduledPostRepository;
import com.avatarflow.platform.connector.model.Platform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs without a surrounding test transaction so every store call commits on its own,
 * the way the services use it.
 */
@DataJpaTest
@Import(JpaContentStore.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaContentStoreTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 10, 13, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private JpaContentStore store;

    @Autowired
    private ContentArtifactRepository artifactRepository;

    @Autowired
    private GenerationBatchRepository batchRepository;

    @Autowired
    private ScheduledPostRepository postRepository;

    @Autowired
    private PlatformAccountRepository accountRepository;

    @Autowired
    private PlatformAccountHealthRepository healthRepository;

    private UUID avatarId;

    @BeforeEach
    void setUp() {
        postRepository.deleteAll();
        artifactRepository.deleteAll();
        batchRepository.deleteAll();
        healthRepository.deleteAll();
        accountRepository.deleteAll();
        avatarId = UUID.randomUUID();
    }

    @Test
    void should_PersistArtifactWithMetadata_When_Created() {
        ContentArtifact created = store.createArtifact(artifact(ArtifactStatus.REQUESTED, Map.of("caption", "Morning run")));

        ContentArtifact stored = store.findArtifact(created.getId()).orElseThrow();
        assertThat(stored.getTier()).isEqualTo(ContentTier.BASIC);
        assertThat(stored.getMetadata()).containsEntry("caption", "Morning run");
    }

    @Test
    void should_ApplyGuardedUpdate_When_StatusMatches() {
        ContentArtifact created = store.createArtifact(artifact(ArtifactStatus.PENDING_SAFETY, Map.of()));

        store.updateArtifact(created.getId(), ArtifactStatus.PENDING_SAFETY, a -> {
            a.setStatus(ArtifactStatus.SAFE);
            a.setSafetyScore(0.02);
        });

        ContentArtifact stored = store.findArtifact(created.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(ArtifactStatus.SAFE);
        assertThat(stored.getSafetyScore()).isEqualTo(0.02);
    }

    @Test
    void should_ThrowConflictAndRollBack_When_StatusIsStale() {
        ContentArtifact created = store.createArtifact(artifact(ArtifactStatus.ELIGIBLE, Map.of()));

        assertThatThrownBy(() -> store.updateArtifact(created.getId(), ArtifactStatus.SAFE,
                a -> a.setLastError("should not stick")))
                .isInstanceOf(StorageConflictException.class);
        assertThatThrownBy(() -> store.updateArtifact(created.getId(), ArtifactStatus.ELIGIBLE,
                a -> a.setStatus(ArtifactStatus.PUBLISHED)))
                .isInstanceOf(InvalidRequestException.class);

        ContentArtifact stored = store.findArtifact(created.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(ArtifactStatus.ELIGIBLE);
        assertThat(stored.getLastError()).isNull();
    }

    @Test
    void should_StopCountingAtRequestedCount_When_BatchIsFullyResolved() {
        GenerationBatch batch = store.createBatch(GenerationBatch.builder()
                .avatarId(avatarId)
                .requestedCount(2)
                .tierDistribution(new EnumMap<>(Map.of(ContentTier.BASIC, 2)))
                .status(BatchStatus.RUNNING)
                .createdAt(NOW)
                .build());

        store.incrementBatchCounter(batch.getId(), BatchCounter.COMPLETED);
        GenerationBatch afterSecond = store.incrementBatchCounter(batch.getId(), BatchCounter.FAILED);

        assertThat(afterSecond.getCompletedCount()).isEqualTo(1);
        assertThat(afterSecond.getFailedCount()).isEqualTo(1);
        assertThatThrownBy(() -> store.incrementBatchCounter(batch.getId(), BatchCounter.COMPLETED))
                .isInstanceOf(StorageConflictException.class);
    }

    @Test
    void should_AccumulateCostAndArtifactIds_When_UnitsFinish() {
        GenerationBatch batch = store.createBatch(GenerationBatch.builder()
                .avatarId(avatarId)
                .requestedCount(2)
                .status(BatchStatus.RUNNING)
                .createdAt(NOW)
                .build());
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        store.appendBatchArtifact(batch.getId(), first);
        store.appendBatchArtifact(batch.getId(), second);
        store.addBatchCost(batch.getId(), new BigDecimal("0.0125"));
        store.addBatchCost(batch.getId(), new BigDecimal("0.0125"));

        GenerationBatch stored = store.findBatch(batch.getId()).orElseThrow();
        assertThat(stored.getArtifactIds()).containsExactly(first, second);
        assertThat(stored.getTotalCostUsd()).isEqualByComparingTo("0.025");
    }

    @Test
    void should_RejectSecondActivePost_When_ArtifactAlreadyScheduledOnPlatform() {
        UUID artifactId = UUID.randomUUID();
        UUID accountId = UUID.randomUUID();
        ScheduledPost first = store.createScheduledPost(post(artifactId, accountId, NOW));

        assertThatThrownBy(() -> store.createScheduledPost(post(artifactId, accountId, NOW.plusHours(4))))
                .isInstanceOf(DuplicateScheduleException.class);

        store.updateScheduledPost(first.getId(), PostStatus.PENDING, p -> p.setStatus(PostStatus.CANCELLED));
        ScheduledPost replacement = store.createScheduledPost(post(artifactId, accountId, NOW.plusHours(4)));

        assertThat(store.findActivePost(artifactId, Platform.TIKTOK)).map(ScheduledPost::getId)
                .contains(replacement.getId());
        assertThat(store.listPostsForArtifact(artifactId)).hasSize(2);
    }

    @Test
    void should_ListDueAndStalledPosts_When_Queried() {
        UUID accountId = UUID.randomUUID();
        ScheduledPost due = store.createScheduledPost(post(UUID.randomUUID(), accountId, NOW.minusMinutes(10)));
        store.createScheduledPost(post(UUID.randomUUID(), accountId, NOW.plusHours(2)));
        ScheduledPost publishing = store.createScheduledPost(post(UUID.randomUUID(), accountId, NOW.minusHours(1)));
        store.updateScheduledPost(publishing.getId(), PostStatus.PENDING, p -> {
            p.setStatus(PostStatus.PUBLISHING);
            p.setPublishStartedAt(NOW.minusMinutes(30));
        });

        assertThat(store.listDuePosts(NOW, 10)).extracting(ScheduledPost::getId).containsExactly(due.getId());
        assertThat(store.listStalledPosts(NOW.minusMinutes(10))).extracting(ScheduledPost::getId)
                .containsExactly(publishing.getId());
        assertThat(store.listActivePostsForAccount(accountId)).hasSize(3);
    }

    @Test
    void should_EnforceHealthVersion_When_Upserting() {
        PlatformAccount account = store.savePlatformAccount(PlatformAccount.builder()
                .avatarId(avatarId)
                .platform(Platform.TIKTOK)
                .handle("@ava")
                .timezone("America/Mexico_City")
                .postingWindowStart(LocalTime.of(9, 0))
                .postingWindowEnd(LocalTime.of(21, 0))
                .createdAt(NOW)
                .build());

        PlatformAccountHealth created = store.upsertPlatformAccountHealth(
                PlatformAccountHealth.initial(account.getId()), 0);
        PlatformAccountHealth degraded = created.copy();
        degraded.setHealth(AccountHealth.DEGRADED);
        degraded.setConsecutiveFailures(5);
        store.upsertPlatformAccountHealth(degraded, created.getVersion());

        assertThatThrownBy(() -> store.upsertPlatformAccountHealth(degraded, created.getVersion()))
                .isInstanceOf(StorageConflictException.class);
        PlatformAccountHealth stored = store.getPlatformAccountHealth(account.getId()).orElseThrow();
        assertThat(stored.getVersion()).isEqualTo(2);
        assertThat(stored.getConsecutiveFailures()).isEqualTo(5);
        assertThat(store.listAccountHealth(AccountHealth.DEGRADED)).hasSize(1);
    }

    private ContentArtifact artifact(ArtifactStatus status, Map<String, String> metadata) {
        return ContentArtifact.builder()
                .avatarId(avatarId)
                .tier(ContentTier.BASIC)
                .status(status)
                .promptUsed("portrait, soft light")
                .metadata(new HashMap<>(metadata))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private static ScheduledPost post(UUID artifactId, UUID accountId, OffsetDateTime at) {
        return ScheduledPost.builder()
                .artifactId(artifactId)
                .platformAccountId(accountId)
                .platform(Platform.TIKTOK)
                .scheduledAt(at)
                .timezone("America/Mexico_City")
                .status(PostStatus.PENDING)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
