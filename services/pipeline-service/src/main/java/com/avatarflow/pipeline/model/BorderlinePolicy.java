package com.avatarflow.pipeline.model;

/**
 * What happens to artifacts the safety gate could not clear outright.
 */
public enum BorderlinePolicy {
    /** Wait for an explicit approve or reject. */
    MANUAL,
    /** Promote to ELIGIBLE once the review window has elapsed without a decision. */
    AUTO_APPROVE
}
