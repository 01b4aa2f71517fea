package com.avatarflow.pipeline.controller;

import com.avatarflow.pipeline.dto.BulkScheduleRequest;
import com.avatarflow.pipeline.dto.BulkScheduleResponse;
import com.avatarflow.pipeline.dto.ScheduledPostResponse;
import com.avatarflow.pipeline.dto.SchedulePostRequest;
import com.avatarflow.pipeline.scheduling.DispatchReport;
import com.avatarflow.pipeline.scheduling.DistributionScheduler;
import com.avatarflow.pipeline.scheduling.PostDispatcher;
import com.avatarflow.pipeline.scheduling.TargetWindow;
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
public class DistributionController {

    private final DistributionScheduler distributionScheduler;
    private final PostDispatcher postDispatcher;

    @PostMapping("/posts")
    public ResponseEntity<ScheduledPostResponse> schedule(@RequestBody SchedulePostRequest request) {
        TargetWindow window = new TargetWindow(request.getWindowStart(), request.getWindowEnd());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ScheduledPostResponse.from(distributionScheduler.scheduleArtifact(
                        request.getArtifactId(), request.getPlatform(), request.getPlatformAccountId(), window)));
    }

    @PostMapping("/posts/bulk")
    public ResponseEntity<BulkScheduleResponse> scheduleBulk(@RequestBody BulkScheduleRequest request) {
        TargetWindow window = new TargetWindow(request.getWindowStart(), request.getWindowEnd());
        return ResponseEntity.ok(BulkScheduleResponse.from(distributionScheduler.scheduleArtifacts(
                request.getPlatformAccountId(), request.getArtifactIds(), window)));
    }

    @GetMapping("/posts/{postId}")
    public ResponseEntity<ScheduledPostResponse> getPost(@PathVariable UUID postId) {
        return ResponseEntity.ok(ScheduledPostResponse.from(distributionScheduler.getPost(postId)));
    }

    @DeleteMapping("/posts/{postId}")
    public ResponseEntity<ScheduledPostResponse> cancelPost(@PathVariable UUID postId) {
        return ResponseEntity.ok(ScheduledPostResponse.from(distributionScheduler.cancelScheduledPost(postId)));
    }

    @GetMapping("/artifacts/{artifactId}/posts")
    public ResponseEntity<List<ScheduledPostResponse>> artifactPosts(@PathVariable UUID artifactId) {
        return ResponseEntity.ok(distributionScheduler.listPostsForArtifact(artifactId).stream()
                .map(ScheduledPostResponse::from)
                .collect(Collectors.toList()));
    }

    /**
     * Runs one dispatch sweep now instead of waiting for the next tick.
     */
    @PostMapping("/dispatch")
    public ResponseEntity<DispatchReport> dispatch() {
        return ResponseEntity.ok(postDispatcher.dispatchDuePosts());
    }
}
