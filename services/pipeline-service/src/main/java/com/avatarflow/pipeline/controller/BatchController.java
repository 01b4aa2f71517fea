package com.avatarflow.pipeline.controller;

import com.avatarflow.pipeline.batch.BatchOrchestrator;
import com.avatarflow.pipeline.batch.CostTracker;
import com.avatarflow.pipeline.dto.ArtifactResponse;
import com.avatarflow.pipeline.dto.BatchRequest;
import com.avatarflow.pipeline.dto.BatchResponse;
import com.avatarflow.pipeline.dto.BatchSummary;
import com.avatarflow.pipeline.dto.CostSummary;
import com.avatarflow.pipeline.dto.ReviewRequest;
import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.exception.ResourceNotFoundException;
import com.avatarflow.pipeline.safety.BorderlineReviewService;
import com.avatarflow.pipeline.store.ContentStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/pipeline")
@RequiredArgsConstructor
public class BatchController {

    private final BatchOrchestrator batchOrchestrator;
    private final BorderlineReviewService reviewService;
    private final CostTracker costTracker;
    private final ContentStore store;

    @PostMapping("/batches")
    public ResponseEntity<BatchResponse> startBatch(@RequestBody BatchRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(BatchResponse.from(batchOrchestrator.startBatch(request)));
    }

    @GetMapping("/batches/{batchId}")
    public ResponseEntity<BatchResponse> getBatch(@PathVariable UUID batchId) {
        return ResponseEntity.ok(BatchResponse.from(batchOrchestrator.getBatch(batchId)));
    }

    @GetMapping("/batches/{batchId}/summary")
    public ResponseEntity<BatchSummary> summarize(@PathVariable UUID batchId) {
        return ResponseEntity.ok(batchOrchestrator.summarize(batchId));
    }

    @GetMapping("/batches/{batchId}/artifacts")
    public ResponseEntity<List<ArtifactResponse>> batchArtifacts(@PathVariable UUID batchId) {
        batchOrchestrator.getBatch(batchId);
        return ResponseEntity.ok(toResponses(store.listArtifactsByBatch(batchId)));
    }

    @PostMapping("/batches/{batchId}/cancel")
    public ResponseEntity<BatchResponse> cancelBatch(@PathVariable UUID batchId) {
        return ResponseEntity.ok(BatchResponse.from(batchOrchestrator.cancelBatch(batchId)));
    }

    @GetMapping("/artifacts/{artifactId}")
    public ResponseEntity<ArtifactResponse> getArtifact(@PathVariable UUID artifactId) {
        return ResponseEntity.ok(ArtifactResponse.from(store.findArtifact(artifactId)
                .orElseThrow(() -> ResourceNotFoundException.of("Artifact", artifactId))));
    }

    @GetMapping("/avatars/{avatarId}/artifacts/eligible")
    public ResponseEntity<List<ArtifactResponse>> eligibleArtifacts(@PathVariable UUID avatarId) {
        return ResponseEntity.ok(toResponses(store.listEligibleArtifacts(avatarId)));
    }

    @GetMapping("/avatars/{avatarId}/costs")
    public ResponseEntity<CostSummary> costs(@PathVariable UUID avatarId) {
        return ResponseEntity.ok(costTracker.costSummary(avatarId));
    }

    @PostMapping("/artifacts/{artifactId}/approve")
    public ResponseEntity<ArtifactResponse> approve(@PathVariable UUID artifactId,
                                                    @RequestBody(required = false) ReviewRequest review) {
        return ResponseEntity.ok(ArtifactResponse.from(reviewService.approve(artifactId, review)));
    }

    @PostMapping("/artifacts/{artifactId}/reject")
    public ResponseEntity<ArtifactResponse> reject(@PathVariable UUID artifactId,
                                                   @RequestBody(required = false) ReviewRequest review) {
        return ResponseEntity.ok(ArtifactResponse.from(reviewService.reject(artifactId, review)));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Pipeline Service is running");
    }

    private static List<ArtifactResponse> toResponses(List<ContentArtifact> artifacts) {
        return artifacts.stream().map(ArtifactResponse::from).collect(Collectors.toList());
    }
}
