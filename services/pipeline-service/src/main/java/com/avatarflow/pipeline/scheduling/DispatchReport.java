package com.avatarflow.pipeline.scheduling;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a single dispatch tick did.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchReport {
    private boolean lockAcquired;
    private int examined;
    private int published;
    private int retried;
    private int failed;
    // Left PENDING for a later tick: backoff, spacing, or another post of the account went this tick
    private int deferred;
    // Left PENDING because the account is suspended
    private int held;
    private int recovered;
    // Posts changed by someone else while this sweep was publishing them
    private int conflicts;

    public static DispatchReport skipped() {
        return DispatchReport.builder().lockAcquired(false).build();
    }
}
