package com.avatarflow.pipeline.model;

/**
 * Per-batch progress counters. Their sum never exceeds the requested count.
 */
public enum BatchCounter {
    COMPLETED,
    FAILED
}
