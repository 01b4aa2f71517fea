package com.avatarflow.pipeline.batch;

import com.avatarflow.pipeline.config.PipelineProperties;
import com.avatarflow.pipeline.dto.BatchRequest;
import com.avatarflow.pipeline.dto.BatchSummary;
import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.entity.GenerationBatch;
import com.avatarflow.pipeline.exception.InvalidRequestException;
import com.avatarflow.pipeline.exception.PermanentProviderException;
import com.avatarflow.pipeline.exception.PipelineException;
import com.avatarflow.pipeline.exception.ResourceNotFoundException;
import com.avatarflow.pipeline.exception.TransientProviderException;
import com.avatarflow.pipeline.generation.ContentTemplate;
import com.avatarflow.pipeline.generation.GenerationProvider;
import com.avatarflow.pipeline.generation.GenerationRequest;
import com.avatarflow.pipeline.generation.GenerationResult;
import com.avatarflow.pipeline.generation.HookProvider;
import com.avatarflow.pipeline.generation.TemplateSelector;
import com.avatarflow.pipeline.model.ArtifactStatus;
import com.avatarflow.pipeline.model.BatchCounter;
import com.avatarflow.pipeline.model.BatchStatus;
import com.avatarflow.pipeline.model.ContentTier;
import com.avatarflow.pipeline.model.SafetyVerdict;
import com.avatarflow.pipeline.safety.SafetyClassification;
import com.avatarflow.pipeline.safety.SafetyGate;
import com.avatarflow.pipeline.store.ContentStore;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns a batch request into content artifacts.
 * <p>
 * Each unit runs on the shared generation pool: create the artifact, call the provider with
 * retries, run the safety gate and record the verdict. A unit resolves exactly once, as
 * completed (a verdict was reached) or failed (generation never succeeded), and the batch
 * takes its terminal status when the last unit resolves.
 */
@Slf4j
@Service
public class BatchOrchestrator {

    private final ContentStore store;
    private final GenerationProvider generationProvider;
    private final SafetyGate safetyGate;
    private final Executor executor;
    private final TemplateSelector defaultSelector;
    private final HookProvider hookProvider;
    private final PipelineProperties properties;
    private final Clock clock;

    private final Map<UUID, BatchExecution> executions = new ConcurrentHashMap<>();

    public BatchOrchestrator(ContentStore store,
                             GenerationProvider generationProvider,
                             SafetyGate safetyGate,
                             @Qualifier("generationExecutor") Executor executor,
                             TemplateSelector defaultSelector,
                             HookProvider hookProvider,
                             PipelineProperties properties,
                             Clock clock) {
        this.store = store;
        this.generationProvider = generationProvider;
        this.safetyGate = safetyGate;
        this.executor = executor;
        this.defaultSelector = defaultSelector;
        this.hookProvider = hookProvider;
        this.properties = properties;
        this.clock = clock;
    }

    public GenerationBatch startBatch(BatchRequest request) {
        return startBatch(request, defaultSelector);
    }

    public GenerationBatch startBatch(BatchRequest request, TemplateSelector selector) {
        validate(request);
        List<WorkItem> items = plan(request, selector);
        Duration timeout = request.getGenerationTimeoutSeconds() != null
                ? Duration.ofSeconds(request.getGenerationTimeoutSeconds())
                : properties.getGeneration().getCallTimeout();

        Map<ContentTier, Integer> distribution = new EnumMap<>(ContentTier.class);
        request.getTierDistribution().forEach((tier, count) -> {
            if (count > 0) {
                distribution.put(tier, count);
            }
        });

        GenerationBatch batch = store.createBatch(GenerationBatch.builder()
                .avatarId(request.getAvatarId())
                .avatarModelRef(request.getAvatarModelRef())
                .requestedCount(request.getRequestedCount())
                .tierDistribution(distribution)
                .status(BatchStatus.QUEUED)
                .createdAt(now())
                .build());
        UUID batchId = batch.getId();

        BatchExecution execution = new BatchExecution(items.size());
        executions.put(batchId, execution);
        store.updateBatchStatus(batchId, BatchStatus.QUEUED, BatchStatus.RUNNING);

        log.info("Started batch {} for avatar {}: {} units {}", batchId, request.getAvatarId(),
                items.size(), distribution);

        for (WorkItem item : items) {
            try {
                executor.execute(() -> runUnit(batch, execution, item, timeout));
            } catch (RejectedExecutionException e) {
                log.error("Generation pool rejected unit {} of batch {}", item.getIndex(), batchId);
                resolveUnit(batchId, execution, BatchCounter.FAILED);
            }
        }

        return getBatch(batchId);
    }

    public GenerationBatch cancelBatch(UUID batchId) {
        GenerationBatch batch = getBatch(batchId);
        if (batch.getStatus().isTerminal()) {
            log.info("Batch {} already {}, nothing to cancel", batchId, batch.getStatus());
            return batch;
        }
        store.requestBatchCancel(batchId);
        BatchExecution execution = executions.get(batchId);
        if (execution != null) {
            execution.cancel();
        }
        log.info("Cancellation requested for batch {}", batchId);
        return getBatch(batchId);
    }

    public GenerationBatch getBatch(UUID batchId) {
        return store.findBatch(batchId)
                .orElseThrow(() -> ResourceNotFoundException.of("Batch", batchId));
    }

    public BatchSummary summarize(UUID batchId) {
        GenerationBatch batch = getBatch(batchId);
        List<ContentArtifact> artifacts = store.listArtifactsByBatch(batchId);

        List<ContentArtifact> generated = artifacts.stream()
                .filter(a -> a.getGenerationCostUsd() != null)
                .collect(Collectors.toList());
        BigDecimal averageCost = generated.isEmpty()
                ? BigDecimal.ZERO
                : batch.getTotalCostUsd().divide(BigDecimal.valueOf(generated.size()), 6, RoundingMode.HALF_UP);
        double averageLatency = generated.stream()
                .map(ContentArtifact::getGenerationLatencyMs)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .average()
                .orElse(0);

        Map<SafetyVerdict, Long> verdicts = artifacts.stream()
                .filter(a -> a.getSafetyVerdict() != null)
                .collect(Collectors.groupingBy(ContentArtifact::getSafetyVerdict,
                        () -> new EnumMap<>(SafetyVerdict.class), Collectors.counting()));
        long classified = verdicts.values().stream().mapToLong(Long::longValue).sum();

        return BatchSummary.builder()
                .batchId(batchId)
                .status(batch.getStatus())
                .requestedCount(batch.getRequestedCount())
                .completedCount(batch.getCompletedCount())
                .failedCount(batch.getFailedCount())
                .unresolvedCount(batch.getRequestedCount() - batch.resolvedCount())
                .statusDistribution(countBy(artifacts, ContentArtifact::getStatus, ArtifactStatus.class))
                .verdictDistribution(verdicts)
                .tierDistribution(countBy(artifacts, ContentArtifact::getTier, ContentTier.class))
                .totalCostUsd(batch.getTotalCostUsd())
                .averageCostUsd(averageCost)
                .averageGenerationMs(averageLatency)
                .safetyPassRate(classified == 0 ? 0 : (double) verdicts.getOrDefault(SafetyVerdict.SAFE, 0L) / classified)
                .build();
    }

    private static <E extends Enum<E>> Map<E, Long> countBy(List<ContentArtifact> artifacts,
                                                           Function<ContentArtifact, E> key, Class<E> type) {
        return artifacts.stream().collect(Collectors.groupingBy(key, () -> new EnumMap<>(type), Collectors.counting()));
    }

    // ---- planning ----

    private void validate(BatchRequest request) {
        if (request.getAvatarId() == null) {
            throw new InvalidRequestException("avatarId is required");
        }
        if (request.getRequestedCount() == null || request.getRequestedCount() <= 0) {
            throw new InvalidRequestException("requestedCount must be positive");
        }
        if (request.getTierDistribution() == null || request.getTierDistribution().isEmpty()) {
            throw new InvalidRequestException("tierDistribution is required");
        }
        int sum = 0;
        for (Map.Entry<ContentTier, Integer> entry : request.getTierDistribution().entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null || entry.getValue() < 0) {
                throw new InvalidRequestException("tierDistribution has an invalid entry: " + entry);
            }
            sum += entry.getValue();
        }
        if (sum != request.getRequestedCount()) {
            throw new InvalidRequestException(String.format(
                    "tierDistribution sums to %d but requestedCount is %d", sum, request.getRequestedCount()));
        }
        if (request.getGenerationTimeoutSeconds() != null && request.getGenerationTimeoutSeconds() <= 0) {
            throw new InvalidRequestException("generationTimeoutSeconds must be positive");
        }
    }

    private List<WorkItem> plan(BatchRequest request, TemplateSelector selector) {
        List<WorkItem> items = new ArrayList<>();
        List<String> usedTemplateIds = new ArrayList<>();
        String customPrompt = request.getCustomPrompt();
        boolean withHooks = !Boolean.FALSE.equals(request.getIncludeHooks());

        for (ContentTier tier : ContentTier.values()) {
            int count = request.getTierDistribution().getOrDefault(tier, 0);
            for (int i = 0; i < count; i++) {
                Optional<ContentTemplate> template = selector.select(request.getAvatarId(), tier, usedTemplateIds);
                if (template.isPresent()) {
                    ContentTemplate t = template.get();
                    usedTemplateIds.add(t.getId());
                    items.add(new WorkItem(items.size(), tier, t.getId(), t.getCategory(), t.renderPrompt(), t.params(),
                            t.getTags() != null ? t.getTags() : List.of(), withHooks));
                } else if (customPrompt != null && !customPrompt.isBlank()) {
                    items.add(new WorkItem(items.size(), tier, null, "custom", customPrompt, Map.of(),
                            List.of(), withHooks));
                } else {
                    throw new InvalidRequestException("No template available for tier " + tier
                            + " and no customPrompt supplied");
                }
            }
        }
        return items;
    }

    // ---- unit execution ----

    private void runUnit(GenerationBatch batch, BatchExecution execution, WorkItem item, Duration timeout) {
        UUID batchId = batch.getId();
        if (execution.isCancelled()) {
            log.debug("Skipping unit {} of cancelled batch {}", item.getIndex(), batchId);
            if (execution.skipUnit()) {
                finish(batchId, execution);
            }
            return;
        }

        AtomicReference<UUID> artifactRef = new AtomicReference<>();
        BatchCounter outcome;
        try {
            outcome = processUnit(batch, item, timeout, artifactRef);
        } catch (RuntimeException e) {
            log.error("Unit {} of batch {} failed unexpectedly: {}", item.getIndex(), batchId, e.getMessage(), e);
            failUnfinishedArtifact(artifactRef.get(), "Unexpected error: " + e.getMessage());
            outcome = BatchCounter.FAILED;
        }
        resolveUnit(batchId, execution, outcome);
    }

    private BatchCounter processUnit(GenerationBatch batch, WorkItem item, Duration timeout,
                                     AtomicReference<UUID> artifactRef) {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("template_category", item.getCategory());
        if (item.isWithHook()) {
            writeHook(item).ifPresent(caption -> metadata.put("caption", caption));
        }

        ContentArtifact artifact = store.createArtifact(ContentArtifact.builder()
                .avatarId(batch.getAvatarId())
                .batchId(batch.getId())
                .templateId(item.getTemplateId())
                .promptUsed(item.getPrompt())
                .tier(item.getTier())
                .status(ArtifactStatus.REQUESTED)
                .metadata(metadata)
                .createdAt(now())
                .updatedAt(now())
                .build());
        UUID artifactId = artifact.getId();
        artifactRef.set(artifactId);
        store.appendBatchArtifact(batch.getId(), artifactId);
        store.updateArtifact(artifactId, ArtifactStatus.REQUESTED, a -> {
            a.setStatus(ArtifactStatus.GENERATING);
            a.setUpdatedAt(now());
        });

        GenerationRequest request = GenerationRequest.builder()
                .artifactId(artifactId)
                .prompt(item.getPrompt())
                .tier(item.getTier())
                .avatarModelRef(batch.getAvatarModelRef())
                .templateParams(item.getParams())
                .build();

        GenerationResult result = generateWithRetry(artifactId, request, timeout);
        if (result == null) {
            return BatchCounter.FAILED;
        }

        store.updateArtifact(artifactId, ArtifactStatus.GENERATING, a -> {
            a.setStatus(ArtifactStatus.PENDING_SAFETY);
            a.setStorageLocator(result.getBinaryLocator());
            a.setGenerationCostUsd(result.getCostUsd());
            a.setGenerationLatencyMs(result.getLatencyMs());
            a.setLastError(null);
            a.setUpdatedAt(now());
        });
        if (result.getCostUsd() != null && result.getCostUsd().signum() > 0) {
            store.addBatchCost(batch.getId(), result.getCostUsd());
        }

        SafetyClassification classification = classify(artifactId, result.getBinaryLocator(), item);
        SafetyVerdict verdict = classification.getVerdict();
        store.updateArtifact(artifactId, ArtifactStatus.PENDING_SAFETY, a -> {
            a.setStatus(toStatus(verdict));
            a.setSafetyVerdict(verdict);
            a.setSafetyScore(classification.getScore());
            a.setSafetyCheckedAt(now());
            if (!classification.getFlags().isEmpty()) {
                a.getMetadata().put("safety_flags", String.join(",", classification.getFlags()));
            }
            a.setUpdatedAt(now());
        });

        if (verdict == SafetyVerdict.SAFE) {
            store.updateArtifact(artifactId, ArtifactStatus.SAFE, a -> {
                a.setStatus(ArtifactStatus.ELIGIBLE);
                a.setUpdatedAt(now());
            });
        } else {
            log.info("Artifact {} classified {} (score {})", artifactId, verdict, classification.getScore());
        }
        return BatchCounter.COMPLETED;
    }

    private GenerationResult generateWithRetry(UUID artifactId, GenerationRequest request, Duration timeout) {
        PipelineProperties.Generation config = properties.getGeneration();
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            int current = attempt;
            store.updateArtifact(artifactId, ArtifactStatus.GENERATING, a -> a.setGenerationAttempts(current));
            try {
                return generationProvider.generate(request, timeout);
            } catch (TransientProviderException e) {
                lastError = e.getMessage();
                log.warn("Generation attempt {}/{} for artifact {} failed: {}", attempt, maxAttempts, artifactId, lastError);
                if (attempt < maxAttempts && !pause(config.getRetryBackoff().multipliedBy(attempt))) {
                    lastError = "Interrupted while waiting to retry";
                    break;
                }
            } catch (PermanentProviderException e) {
                lastError = e.getMessage();
                log.error("Generation for artifact {} refused: {}", artifactId, lastError);
                break;
            }
        }

        markFailed(artifactId, ArtifactStatus.GENERATING, lastError);
        return null;
    }

    /**
     * Transient gate errors are retried like generation errors. When the gate still cannot
     * answer, the artifact is held as borderline so it never goes out unreviewed.
     */
    private SafetyClassification classify(UUID artifactId, String locator, WorkItem item) {
        PipelineProperties.Generation config = properties.getGeneration();
        int maxAttempts = Math.max(1, config.getMaxAttempts());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                SafetyClassification classification = safetyGate.classify(locator, item.getPrompt(), item.getTier());
                if (classification == null || classification.getVerdict() == null) {
                    log.error("Safety gate returned no verdict for artifact {}", artifactId);
                    break;
                }
                return classification;
            } catch (TransientProviderException e) {
                log.warn("Safety check attempt {}/{} for artifact {} failed: {}", attempt, maxAttempts,
                        artifactId, e.getMessage());
                if (attempt < maxAttempts && !pause(config.getRetryBackoff().multipliedBy(attempt))) {
                    break;
                }
            } catch (RuntimeException e) {
                log.error("Safety gate failed on artifact {}: {}", artifactId, e.getMessage(), e);
                break;
            }
        }

        log.error("Safety gate unavailable for artifact {}, holding it for review", artifactId);
        return SafetyClassification.builder()
                .verdict(SafetyVerdict.BORDERLINE)
                .flags(List.of("safety_gate_unavailable"))
                .build();
    }

    private static ArtifactStatus toStatus(SafetyVerdict verdict) {
        return switch (verdict) {
            case SAFE -> ArtifactStatus.SAFE;
            case BORDERLINE -> ArtifactStatus.BORDERLINE;
            case REJECTED -> ArtifactStatus.REJECTED;
        };
    }

    private void markFailed(UUID artifactId, ArtifactStatus from, String error) {
        try {
            store.updateArtifact(artifactId, from, a -> {
                a.setStatus(ArtifactStatus.FAILED);
                a.setLastError(error);
                a.setUpdatedAt(now());
            });
        } catch (PipelineException e) {
            log.error("Could not mark artifact {} failed: {}", artifactId, e.getMessage());
        }
    }

    private Optional<String> writeHook(WorkItem item) {
        try {
            return hookProvider.hookFor(item.getCategory(), item.getTags())
                    .filter(caption -> !caption.isBlank());
        } catch (RuntimeException e) {
            log.warn("Could not write caption for unit {}: {}", item.getIndex(), e.getMessage());
            return Optional.empty();
        }
    }

    private void failUnfinishedArtifact(UUID artifactId, String error) {
        if (artifactId == null) {
            return;
        }
        try {
            store.findArtifact(artifactId)
                    .filter(a -> a.getStatus().canTransitionTo(ArtifactStatus.FAILED))
                    .ifPresent(a -> markFailed(artifactId, a.getStatus(), error));
        } catch (PipelineException e) {
            log.error("Could not read artifact {} after unit failure: {}", artifactId, e.getMessage());
        }
    }

    private boolean pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ---- resolution ----

    private void resolveUnit(UUID batchId, BatchExecution execution, BatchCounter outcome) {
        try {
            store.incrementBatchCounter(batchId, outcome);
        } catch (PipelineException e) {
            log.error("Could not record {} unit for batch {}: {}", outcome, batchId, e.getMessage());
        }
        if (execution.resolveUnit()) {
            finish(batchId, execution);
        }
    }

    private void finish(UUID batchId, BatchExecution execution) {
        if (!execution.markFinished()) {
            return;
        }
        try {
            GenerationBatch batch = getBatch(batchId);
            BatchStatus terminal = terminalStatus(batch, execution.skippedCount());
            GenerationBatch done = store.updateBatch(batchId, BatchStatus.RUNNING, b -> {
                b.setStatus(terminal);
                b.setCompletedAt(now());
            });
            log.info("Batch {} finished {}: {} completed, {} failed, {} skipped, cost ${}", batchId, terminal,
                    done.getCompletedCount(), done.getFailedCount(), execution.skippedCount(), done.getTotalCostUsd());
        } catch (PipelineException e) {
            log.error("Could not finalize batch {}: {}", batchId, e.getMessage());
        } finally {
            executions.remove(batchId);
        }
    }

    static BatchStatus terminalStatus(GenerationBatch batch, int skipped) {
        if (skipped > 0) {
            return BatchStatus.CANCELLED;
        }
        if (batch.getFailedCount() >= batch.getRequestedCount()) {
            return BatchStatus.FAILED;
        }
        if (batch.getFailedCount() == 0) {
            return BatchStatus.COMPLETED;
        }
        return BatchStatus.PARTIALLY_FAILED;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    @Getter
    @RequiredArgsConstructor
    private static class WorkItem {
        private final int index;
        private final ContentTier tier;
        private final String templateId;
        private final String category;
        private final String prompt;
        private final Map<String, String> params;
        private final List<String> tags;
        private final boolean withHook;
    }
}
