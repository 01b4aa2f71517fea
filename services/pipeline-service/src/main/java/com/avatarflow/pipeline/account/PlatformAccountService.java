package com.avatarflow.pipeline.account;

import com.avatarflow.pipeline.dto.RegisterAccountRequest;
import com.avatarflow.pipeline.entity.PlatformAccount;
import com.avatarflow.pipeline.exception.InvalidRequestException;
import com.avatarflow.pipeline.exception.ResourceNotFoundException;
import com.avatarflow.pipeline.store.ContentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlatformAccountService {

    static final LocalTime DEFAULT_WINDOW_START = LocalTime.of(9, 0);
    static final LocalTime DEFAULT_WINDOW_END = LocalTime.of(21, 0);

    private final ContentStore store;
    private final Clock clock;

    public PlatformAccount register(RegisterAccountRequest request) {
        if (request.getAvatarId() == null) {
            throw new InvalidRequestException("avatarId is required");
        }
        if (request.getPlatform() == null) {
            throw new InvalidRequestException("platform is required");
        }
        if (request.getTimezone() == null) {
            throw new InvalidRequestException("timezone is required");
        }
        try {
            ZoneId.of(request.getTimezone());
        } catch (DateTimeException e) {
            throw new InvalidRequestException("Unknown timezone: " + request.getTimezone());
        }

        LocalTime start = request.getPostingWindowStart() != null ? request.getPostingWindowStart() : DEFAULT_WINDOW_START;
        LocalTime end = request.getPostingWindowEnd() != null ? request.getPostingWindowEnd() : DEFAULT_WINDOW_END;
        if (!start.isBefore(end)) {
            throw new InvalidRequestException("Posting window must start before it ends: " + start + " - " + end);
        }
        if (request.getMinSpacingMinutes() != null && request.getMinSpacingMinutes() <= 0) {
            throw new InvalidRequestException("minSpacingMinutes must be positive");
        }
        if (request.getMaxPostsPerDay() != null && request.getMaxPostsPerDay() <= 0) {
            throw new InvalidRequestException("maxPostsPerDay must be positive");
        }

        PlatformAccount account = store.savePlatformAccount(PlatformAccount.builder()
                .avatarId(request.getAvatarId())
                .platform(request.getPlatform())
                .handle(request.getHandle())
                .timezone(request.getTimezone())
                .postingWindowStart(start)
                .postingWindowEnd(end)
                .minSpacingMinutes(request.getMinSpacingMinutes())
                .maxPostsPerDay(request.getMaxPostsPerDay())
                .createdAt(OffsetDateTime.now(clock))
                .build());

        log.info("Registered {} account {} for avatar {} ({} {}-{})", account.getPlatform(), account.getId(),
                account.getAvatarId(), account.getTimezone(), start, end);
        return account;
    }

    public PlatformAccount get(UUID platformAccountId) {
        return store.findPlatformAccount(platformAccountId)
                .orElseThrow(() -> ResourceNotFoundException.of("Platform account", platformAccountId));
    }
}
