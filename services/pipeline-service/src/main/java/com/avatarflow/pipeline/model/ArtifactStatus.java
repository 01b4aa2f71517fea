package com.avatarflow.pipeline.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a content artifact.
 * <pre>
 * REQUESTED -> GENERATING -> PENDING_SAFETY -> SAFE | BORDERLINE | REJECTED
 * SAFE -> ELIGIBLE,  BORDERLINE -> ELIGIBLE | REJECTED
 * ELIGIBLE -> SCHEDULED -> PUBLISHED,  SCHEDULED -> ELIGIBLE
 * </pre>
 * Any state short of PUBLISHED that is not already terminal may move to FAILED.
 */
public enum ArtifactStatus {
    REQUESTED,
    GENERATING,
    PENDING_SAFETY,
    SAFE,
    BORDERLINE,
    REJECTED,
    ELIGIBLE,
    SCHEDULED,
    PUBLISHED,
    FAILED;

    private static final Map<ArtifactStatus, Set<ArtifactStatus>> TRANSITIONS = new EnumMap<>(ArtifactStatus.class);

    static {
        TRANSITIONS.put(REQUESTED, EnumSet.of(GENERATING, FAILED));
        TRANSITIONS.put(GENERATING, EnumSet.of(PENDING_SAFETY, FAILED));
        TRANSITIONS.put(PENDING_SAFETY, EnumSet.of(SAFE, BORDERLINE, REJECTED, FAILED));
        TRANSITIONS.put(SAFE, EnumSet.of(ELIGIBLE, FAILED));
        TRANSITIONS.put(BORDERLINE, EnumSet.of(ELIGIBLE, REJECTED, FAILED));
        TRANSITIONS.put(ELIGIBLE, EnumSet.of(SCHEDULED, FAILED));
        TRANSITIONS.put(SCHEDULED, EnumSet.of(PUBLISHED, ELIGIBLE, FAILED));
        TRANSITIONS.put(REJECTED, EnumSet.noneOf(ArtifactStatus.class));
        TRANSITIONS.put(PUBLISHED, EnumSet.noneOf(ArtifactStatus.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(ArtifactStatus.class));
    }

    public boolean canTransitionTo(ArtifactStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<ArtifactStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Whether the artifact has cleared safety and may get a new scheduled post.
     * SCHEDULED and PUBLISHED artifacts can still go out on another platform.
     */
    public boolean isSchedulable() {
        return this == ELIGIBLE || this == SCHEDULED || this == PUBLISHED;
    }
}
