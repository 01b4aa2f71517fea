package com.avatarflow.pipeline;

import com.avatarflow.pipeline.batch.BatchOrchestrator;
import com.avatarflow.pipeline.config.PipelineProperties;
import com.avatarflow.pipeline.dto.BatchRequest;
import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.entity.GenerationBatch;
import com.avatarflow.pipeline.entity.PlatformAccount;
import com.avatarflow.pipeline.entity.ScheduledPost;
import com.avatarflow.pipeline.generation.GenerationProvider;
import com.avatarflow.pipeline.generation.GenerationRequest;
import com.avatarflow.pipeline.generation.GenerationResult;
import com.avatarflow.pipeline.generation.LibraryTemplateSelector;
import com.avatarflow.pipeline.generation.TemplateHookProvider;
import com.avatarflow.pipeline.generation.TemplateLibrary;
import com.avatarflow.pipeline.health.AccountHealthMonitor;
import com.avatarflow.pipeline.model.ContentTier;
import com.avatarflow.pipeline.model.SafetyVerdict;
import com.avatarflow.pipeline.safety.SafetyClassification;
import com.avatarflow.pipeline.safety.SafetyGate;
import com.avatarflow.pipeline.scheduling.DispatchReport;
import com.avatarflow.pipeline.scheduling.DistributionScheduler;
import com.avatarflow.pipeline.scheduling.LocalDispatchLock;
import com.avatarflow.pipeline.scheduling.PostDispatcher;
import com.avatarflow.pipeline.scheduling.SlotPlanner;
import com.avatarflow.pipeline.store.InMemoryContentStore;
import com.avatarflow.pipeline.support.MutableClock;
import com.avatarflow.platform.connector.PublisherRegistry;
import com.avatarflow.platform.connector.dto.PublishRequest;
import com.avatarflow.platform.connector.memory.InMemoryPlatformPublisher;
import com.avatarflow.platform.connector.model.Platform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Batch generation through to publishing, wired with in-memory collaborators.
 */
class PipelineFlowTest {

    private InMemoryContentStore store;
    private MutableClock clock;
    private BatchOrchestrator orchestrator;
    private DistributionScheduler scheduler;
    private PostDispatcher dispatcher;
    private InMemoryPlatformPublisher tiktokPublisher;
    private UUID avatarId;

    @BeforeEach
    void setUp() {
        store = new InMemoryContentStore();
        clock = MutableClock.at("2026-03-10T13:00:00Z");
        PipelineProperties properties = new PipelineProperties();
        properties.getGeneration().setRetryBackoff(Duration.ZERO);

        GenerationProvider provider = mock(GenerationProvider.class);
        when(provider.generate(any(GenerationRequest.class), any(Duration.class))).thenReturn(GenerationResult.builder()
                .binaryLocator("s3://avatars/render.png")
                .costUsd(new BigDecimal("0.01"))
                .latencyMs(900)
                .build());
        SafetyGate safetyGate = mock(SafetyGate.class);
        when(safetyGate.classify(anyString(), anyString(), any(ContentTier.class)))
                .thenReturn(SafetyClassification.builder().verdict(SafetyVerdict.SAFE).score(0.01).build());

        orchestrator = new BatchOrchestrator(store, provider, safetyGate, Runnable::run,
                new LibraryTemplateSelector(new TemplateLibrary()), new TemplateHookProvider(), properties, clock);
        AccountHealthMonitor healthMonitor = new AccountHealthMonitor(store, properties, clock);
        scheduler = new DistributionScheduler(store, new SlotPlanner(new Random(5)), healthMonitor, properties, clock);
        tiktokPublisher = new InMemoryPlatformPublisher(Platform.TIKTOK);
        dispatcher = new PostDispatcher(store, new PublisherRegistry(List.of(tiktokPublisher)), healthMonitor,
                scheduler, new LocalDispatchLock(), properties, clock);
        avatarId = UUID.randomUUID();
    }

    @Test
    void should_PublishWithGeneratedCaption_When_BatchArtifactIsScheduled() {
        PlatformAccount account = store.savePlatformAccount(PlatformAccount.builder()
                .avatarId(avatarId)
                .platform(Platform.TIKTOK)
                .handle("@ava")
                .timezone("UTC")
                .postingWindowStart(LocalTime.of(9, 0))
                .postingWindowEnd(LocalTime.of(21, 0))
                .build());
        Map<ContentTier, Integer> tiers = new EnumMap<>(ContentTier.class);
        tiers.put(ContentTier.BASIC, 1);

        GenerationBatch batch = orchestrator.startBatch(BatchRequest.builder()
                .avatarId(avatarId)
                .avatarModelRef("lora://ava-v3")
                .requestedCount(1)
                .tierDistribution(tiers)
                .build());
        ContentArtifact artifact = store.listEligibleArtifacts(avatarId).get(0);
        assertThat(artifact.getBatchId()).isEqualTo(batch.getId());
        String caption = artifact.getMetadata().get("caption");
        assertThat(caption).isNotBlank();

        ScheduledPost post = scheduler.scheduleArtifact(artifact.getId(), Platform.TIKTOK, account.getId(), null);
        clock.set(post.getScheduledAt().toInstant());
        DispatchReport report = dispatcher.dispatchDuePosts();

        assertThat(report.getPublished()).isEqualTo(1);
        assertThat(tiktokPublisher.getRequests()).extracting(PublishRequest::getCaption).containsExactly(caption);
    }
}
