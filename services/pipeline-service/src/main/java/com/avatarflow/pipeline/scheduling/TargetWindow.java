package com.avatarflow.pipeline.scheduling;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Caller's preferred publication range. The start is a hard lower bound; the end is a hint
 * and a slot past it is still accepted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TargetWindow {
    private OffsetDateTime start;
    private OffsetDateTime end;

    public static TargetWindow openEnded() {
        return new TargetWindow(null, null);
    }
}
