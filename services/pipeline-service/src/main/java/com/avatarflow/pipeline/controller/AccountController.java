package com.avatarflow.pipeline.controller;

import com.avatarflow.pipeline.account.PlatformAccountService;
import com.avatarflow.pipeline.dto.AccountHealthResponse;
import com.avatarflow.pipeline.dto.PlatformAccountResponse;
import com.avatarflow.pipeline.dto.RegisterAccountRequest;
import com.avatarflow.pipeline.dto.ScheduledPostResponse;
import com.avatarflow.pipeline.entity.ScheduledPost;
import com.avatarflow.pipeline.health.AccountHealthMonitor;
import com.avatarflow.pipeline.model.AccountHealth;
import com.avatarflow.pipeline.scheduling.DistributionScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/pipeline/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final PlatformAccountService accountService;
    private final AccountHealthMonitor healthMonitor;
    private final DistributionScheduler distributionScheduler;

    @PostMapping
    public ResponseEntity<PlatformAccountResponse> register(@RequestBody RegisterAccountRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(PlatformAccountResponse.from(accountService.register(request)));
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<PlatformAccountResponse> get(@PathVariable UUID accountId) {
        return ResponseEntity.ok(PlatformAccountResponse.from(accountService.get(accountId)));
    }

    @GetMapping("/{accountId}/posts")
    public ResponseEntity<List<ScheduledPostResponse>> posts(@PathVariable UUID accountId,
                                                             @RequestParam(defaultValue = "false") boolean activeOnly) {
        accountService.get(accountId);
        List<ScheduledPost> posts = activeOnly
                ? distributionScheduler.listActivePostsForAccount(accountId)
                : distributionScheduler.listPostsForAccount(accountId);
        return ResponseEntity.ok(posts.stream()
                .map(ScheduledPostResponse::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/{accountId}/health")
    public ResponseEntity<AccountHealthResponse> health(@PathVariable UUID accountId) {
        accountService.get(accountId);
        return ResponseEntity.ok(AccountHealthResponse.from(healthMonitor.getHealth(accountId)));
    }

    @PostMapping("/{accountId}/health/reset")
    public ResponseEntity<AccountHealthResponse> reset(@PathVariable UUID accountId) {
        return ResponseEntity.ok(AccountHealthResponse.from(healthMonitor.resetAccount(accountId)));
    }

    @GetMapping("/health")
    public ResponseEntity<List<AccountHealthResponse>> byHealth(@RequestParam AccountHealth status) {
        return ResponseEntity.ok(healthMonitor.listByHealth(status).stream()
                .map(AccountHealthResponse::from)
                .collect(Collectors.toList()));
    }
}
