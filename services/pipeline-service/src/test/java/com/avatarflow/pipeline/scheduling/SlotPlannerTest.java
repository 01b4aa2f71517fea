package com.avatarflow.pipeline.scheduling;

import com.avatarflow.pipeline.entity.PlatformAccount;
import com.avatarflow.pipeline.exception.InvalidRequestException;
import com.avatarflow.platform.connector.model.Platform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlotPlannerTest {

    private static final Instant ANCHOR = Instant.parse("2026-03-10T13:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2026, 3, 10);

    private SlotPlanner planner;
    private PlatformAccount account;

    @BeforeEach
    void setUp() {
        planner = new SlotPlanner(new Random(42));
        account = PlatformAccount.builder()
                .id(UUID.randomUUID())
                .avatarId(UUID.randomUUID())
                .platform(Platform.TIKTOK)
                .timezone("America/Mexico_City")
                .postingWindowStart(LocalTime.of(9, 0))
                .postingWindowEnd(LocalTime.of(21, 0))
                .build();
    }

    @Test
    void should_ComputeMinimumGap_When_JitterApplied() {
        assertThat(SlotPlanner.minimumGap(Duration.ofHours(3), 0.2)).isEqualTo(Duration.ofMinutes(144));
        assertThat(SlotPlanner.minimumGap(Duration.ofHours(1), 0)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void should_PlaceFourSpacedSlotsInsideWindow_When_SchedulingADay() {
        List<Instant> occupied = new ArrayList<>();
        List<OffsetDateTime> slots = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            OffsetDateTime slot = planner.nextSlot(account, occupied, ANCHOR, 0.2, 14);
            slots.add(slot);
            occupied.add(slot.toInstant());
        }

        assertThat(slots).allSatisfy(slot -> {
            assertThat(slot.toLocalDate()).isEqualTo(DAY);
            assertThat(slot.toLocalTime()).isBetween(LocalTime.of(9, 0), LocalTime.of(21, 0));
            assertThat(slot.getOffset().getTotalSeconds()).isEqualTo(-6 * 3600);
        });
        for (int i = 1; i < slots.size(); i++) {
            Duration gap = Duration.between(slots.get(i - 1), slots.get(i));
            assertThat(gap).isGreaterThanOrEqualTo(Duration.ofMinutes(144));
        }
    }

    @Test
    void should_StartAtWindowOpening_When_AnchorIsBeforeWindow() {
        OffsetDateTime slot = planner.nextSlot(account, List.of(), ANCHOR, 0.2, 14);

        // 07:00 local anchor, opening at 09:00 plus up to 36 minutes of jitter
        assertThat(slot.toLocalTime()).isBetween(LocalTime.of(9, 0), LocalTime.of(9, 36));
    }

    @Test
    void should_RollToNextDay_When_AnchorIsAfterWindowEnd() {
        Instant lateEvening = Instant.parse("2026-03-11T03:30:00Z");

        OffsetDateTime slot = planner.nextSlot(account, List.of(), lateEvening, 0.2, 14);

        assertThat(slot.toLocalDate()).isEqualTo(DAY.plusDays(1));
        assertThat(slot.toLocalTime()).isBetween(LocalTime.of(9, 0), LocalTime.of(9, 36));
    }

    @Test
    void should_MoveToNextDay_When_DailyCapIsReached() {
        account.setMaxPostsPerDay(2);
        List<Instant> occupied = List.of(
                Instant.parse("2026-03-10T15:00:00Z"),
                Instant.parse("2026-03-10T18:00:00Z"));

        OffsetDateTime slot = planner.nextSlot(account, occupied, ANCHOR, 0.2, 14);

        assertThat(slot.toLocalDate()).isEqualTo(DAY.plusDays(1));
    }

    @Test
    void should_KeepMinimumGap_When_OccupiedSlotsAreOutOfOrder() {
        List<Instant> occupied = List.of(
                Instant.parse("2026-03-10T20:00:00Z"),
                Instant.parse("2026-03-10T15:30:00Z"));

        OffsetDateTime slot = planner.nextSlot(account, occupied, ANCHOR, 0.2, 14);

        for (Instant taken : occupied) {
            assertThat(Duration.between(taken, slot.toInstant()).abs()).isGreaterThanOrEqualTo(Duration.ofMinutes(144));
        }
    }

    @Test
    void should_UseExactSpacing_When_JitterIsZero() {
        OffsetDateTime first = planner.nextSlot(account, List.of(), Instant.parse("2026-03-10T16:00:00Z"), 0, 14);
        OffsetDateTime second = planner.nextSlot(account, List.of(first.toInstant()), first.toInstant(), 0, 14);

        assertThat(first.toInstant()).isEqualTo(Instant.parse("2026-03-10T16:00:00Z"));
        assertThat(Duration.between(first, second)).isEqualTo(Duration.ofHours(3));
    }

    @Test
    void should_Fail_When_NoSlotFitsInLookahead() {
        account.setMaxPostsPerDay(1);
        List<Instant> occupied = new ArrayList<>();
        for (int day = 0; day < 3; day++) {
            occupied.add(Instant.parse("2026-03-10T16:00:00Z").plus(Duration.ofDays(day)));
        }

        assertThatThrownBy(() -> planner.nextSlot(account, occupied, ANCHOR, 0.2, 2))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("No free slot");
    }

    @Test
    void should_RejectJitterRatio_When_OutOfRange() {
        assertThatThrownBy(() -> planner.nextSlot(account, List.of(), ANCHOR, 1.0, 14))
                .isInstanceOf(InvalidRequestException.class);
    }
}
