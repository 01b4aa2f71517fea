package com.avatarflow.pipeline.scheduling;

import com.avatarflow.pipeline.entity.PlatformAccount;
import com.avatarflow.pipeline.exception.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Picks publication times that look human: spaced around the account's base cadence with
 * random jitter, inside the account's local posting window and under its daily cap.
 * <p>
 * Every slot handed out is at least {@code base * (1 - jitterRatio)} away from every occupied
 * slot of the account.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotPlanner {

    private static final int MAX_ITERATIONS = 10_000;

    private final Random random;

    public static Duration minimumGap(Duration base, double jitterRatio) {
        return Duration.ofSeconds(Math.round(base.getSeconds() * (1 - jitterRatio)));
    }

    /**
     * @param occupied        times already taken on the account (active and published posts)
     * @param anchor          earliest acceptable time
     * @param jitterRatio     jitter as a fraction of the base spacing, 0 to 1
     * @param maxLookaheadDays how far past the anchor the search may go
     * @return the slot, in the account's timezone
     */
    public OffsetDateTime nextSlot(PlatformAccount account, List<Instant> occupied, Instant anchor,
                                   double jitterRatio, int maxLookaheadDays) {
        if (jitterRatio < 0 || jitterRatio >= 1) {
            throw new InvalidRequestException("Jitter ratio must be in [0, 1): " + jitterRatio);
        }
        ZoneId zone = account.zone();
        Duration base = account.effectiveMinSpacing();
        long jitterSeconds = Math.round(base.getSeconds() * jitterRatio);
        Duration minGap = minimumGap(base, jitterRatio);
        int maxPerDay = account.effectiveMaxPostsPerDay();
        LocalTime windowStart = account.getPostingWindowStart();
        LocalTime windowEnd = account.getPostingWindowEnd();

        Instant start = anchor.truncatedTo(ChronoUnit.SECONDS);
        Instant deadline = start.plus(Duration.ofDays(maxLookaheadDays));

        Instant latest = occupied.stream().max(Comparator.naturalOrder()).orElse(null);
        Instant candidate;
        if (latest == null || latest.plus(base).isBefore(start)) {
            candidate = start.plusSeconds(draw(0, jitterSeconds));
        } else {
            candidate = latest.plus(base).plusSeconds(draw(-jitterSeconds, jitterSeconds));
            if (candidate.isBefore(start)) {
                candidate = start.plusSeconds(draw(0, jitterSeconds));
            }
        }

        for (int i = 0; i < MAX_ITERATIONS; i++) {
            if (candidate.isAfter(deadline)) {
                break;
            }
            ZonedDateTime local = candidate.atZone(zone);
            LocalDate day = local.toLocalDate();

            if (local.toLocalTime().isBefore(windowStart)) {
                candidate = openingOf(day, windowStart, zone, jitterSeconds);
                continue;
            }
            if (!local.toLocalTime().isBefore(windowEnd)) {
                candidate = openingOf(day.plusDays(1), windowStart, zone, jitterSeconds);
                continue;
            }
            if (countOnDay(occupied, day, zone) >= maxPerDay) {
                candidate = openingOf(day.plusDays(1), windowStart, zone, jitterSeconds);
                continue;
            }
            Instant conflict = firstConflict(occupied, candidate, minGap);
            if (conflict != null) {
                candidate = conflict.plus(base).plusSeconds(draw(-jitterSeconds, jitterSeconds));
                continue;
            }
            return candidate.atZone(zone).toOffsetDateTime();
        }

        throw new InvalidRequestException(String.format(
                "No free slot for account %s within %d days of %s", account.getId(), maxLookaheadDays, anchor));
    }

    private Instant openingOf(LocalDate day, LocalTime windowStart, ZoneId zone, long jitterSeconds) {
        return day.atTime(windowStart).atZone(zone).toInstant().plusSeconds(draw(0, jitterSeconds));
    }

    private static long countOnDay(List<Instant> occupied, LocalDate day, ZoneId zone) {
        return occupied.stream()
                .filter(o -> o.atZone(zone).toLocalDate().equals(day))
                .count();
    }

    private static Instant firstConflict(List<Instant> occupied, Instant candidate, Duration minGap) {
        return occupied.stream()
                .filter(o -> Duration.between(o, candidate).abs().compareTo(minGap) < 0)
                .max(Comparator.naturalOrder())
                .orElse(null);
    }

    // Uniform whole seconds in [min, max]
    private long draw(long min, long max) {
        if (max <= min) {
            return min;
        }
        return min + (long) Math.floor(random.nextDouble() * (max - min + 1));
    }
}
