package com.avatarflow.pipeline.controller;

import com.avatarflow.pipeline.account.PlatformAccountService;
import com.avatarflow.pipeline.dto.RegisterAccountRequest;
import com.avatarflow.pipeline.entity.PlatformAccount;
import com.avatarflow.pipeline.entity.PlatformAccountHealth;
import com.avatarflow.pipeline.entity.ScheduledPost;
import com.avatarflow.pipeline.exception.InvalidRequestException;
import com.avatarflow.pipeline.exception.ResourceNotFoundException;
import com.avatarflow.pipeline.health.AccountHealthMonitor;
import com.avatarflow.pipeline.model.AccountHealth;
import com.avatarflow.pipeline.model.PostStatus;
import com.avatarflow.pipeline.scheduling.DistributionScheduler;
import com.avatarflow.platform.connector.model.Platform;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AccountController.class)
class AccountControllerTest {

    private static final UUID ACCOUNT_ID = UUID.fromString("3c8f1d2e-2222-4000-8000-000000000003");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PlatformAccountService accountService;

    @MockBean
    private AccountHealthMonitor healthMonitor;

    @MockBean
    private DistributionScheduler distributionScheduler;

    private PlatformAccount account() {
        return PlatformAccount.builder()
                .id(ACCOUNT_ID)
                .avatarId(UUID.randomUUID())
                .platform(Platform.TIKTOK)
                .handle("@leo.lifts")
                .timezone("America/Mexico_City")
                .postingWindowStart(LocalTime.of(9, 0))
                .postingWindowEnd(LocalTime.of(21, 0))
                .build();
    }

    @Test
    void should_RegisterAccountWithEffectiveSpacing_When_RequestIsValid() throws Exception {
        when(accountService.register(any(RegisterAccountRequest.class))).thenReturn(account());

        mockMvc.perform(post("/api/v1/pipeline/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"avatarId\":\"" + UUID.randomUUID() + "\",\"platform\":\"TIKTOK\","
                                + "\"handle\":\"@leo.lifts\",\"timezone\":\"America/Mexico_City\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(ACCOUNT_ID.toString()))
                .andExpect(jsonPath("$.platform").value("TIKTOK"))
                .andExpect(jsonPath("$.minSpacingMinutes").value(180))
                .andExpect(jsonPath("$.maxPostsPerDay").value(5));
    }

    @Test
    void should_Return400_When_TimezoneIsUnknown() throws Exception {
        when(accountService.register(any(RegisterAccountRequest.class)))
                .thenThrow(new InvalidRequestException("Unknown timezone: Mars/Olympus"));

        mockMvc.perform(post("/api/v1/pipeline/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"platform\":\"TIKTOK\",\"timezone\":\"Mars/Olympus\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown timezone: Mars/Olympus"));
    }

    @Test
    void should_ListOnlyActivePosts_When_ActiveOnlyIsSet() throws Exception {
        when(accountService.get(ACCOUNT_ID)).thenReturn(account());
        when(distributionScheduler.listActivePostsForAccount(ACCOUNT_ID)).thenReturn(List.of(ScheduledPost.builder()
                .id(UUID.randomUUID())
                .artifactId(UUID.randomUUID())
                .platformAccountId(ACCOUNT_ID)
                .platform(Platform.TIKTOK)
                .scheduledAt(OffsetDateTime.parse("2026-03-10T15:12:00Z"))
                .timezone("America/Mexico_City")
                .status(PostStatus.PENDING)
                .build()));

        mockMvc.perform(get("/api/v1/pipeline/accounts/{id}/posts", ACCOUNT_ID).param("activeOnly", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].status").value("PENDING"));

        verify(distributionScheduler, never()).listPostsForAccount(any());
    }

    @Test
    void should_FlagResetRequired_When_AccountIsSuspended() throws Exception {
        when(accountService.get(ACCOUNT_ID)).thenReturn(account());
        when(healthMonitor.getHealth(ACCOUNT_ID)).thenReturn(PlatformAccountHealth.builder()
                .platformAccountId(ACCOUNT_ID)
                .health(AccountHealth.SUSPENDED)
                .consecutiveFailures(10)
                .lastFailureAt(OffsetDateTime.parse("2026-03-10T15:00:00Z"))
                .lastError("HTTP 401 from connector")
                .build());

        mockMvc.perform(get("/api/v1/pipeline/accounts/{id}/health", ACCOUNT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.health").value("SUSPENDED"))
                .andExpect(jsonPath("$.consecutiveFailures").value(10))
                .andExpect(jsonPath("$.requiresReset").value(true));
    }

    @Test
    void should_Return404AndSkipHealthLookup_When_AccountIsUnknown() throws Exception {
        when(accountService.get(ACCOUNT_ID)).thenThrow(ResourceNotFoundException.of("Platform account", ACCOUNT_ID));

        mockMvc.perform(get("/api/v1/pipeline/accounts/{id}/health", ACCOUNT_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("P002"));

        verify(healthMonitor, never()).getHealth(any());
    }

    @Test
    void should_ReturnHealthyRecord_When_AccountIsReset() throws Exception {
        when(healthMonitor.resetAccount(ACCOUNT_ID)).thenReturn(PlatformAccountHealth.initial(ACCOUNT_ID));

        mockMvc.perform(post("/api/v1/pipeline/accounts/{id}/health/reset", ACCOUNT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.health").value("HEALTHY"))
                .andExpect(jsonPath("$.consecutiveFailures").value(0))
                .andExpect(jsonPath("$.requiresReset").value(false));
    }

    @Test
    void should_FilterByHealthState_When_StatusParamGiven() throws Exception {
        PlatformAccountHealth degraded = PlatformAccountHealth.initial(ACCOUNT_ID);
        degraded.setHealth(AccountHealth.DEGRADED);
        degraded.setConsecutiveFailures(6);
        when(healthMonitor.listByHealth(AccountHealth.DEGRADED)).thenReturn(List.of(degraded));

        mockMvc.perform(get("/api/v1/pipeline/accounts/health").param("status", "DEGRADED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].platformAccountId").value(ACCOUNT_ID.toString()))
                .andExpect(jsonPath("$[0].health").value("DEGRADED"));
    }
}
