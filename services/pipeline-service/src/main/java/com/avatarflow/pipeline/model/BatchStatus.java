package com.avatarflow.pipeline.model;

public enum BatchStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    PARTIALLY_FAILED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIALLY_FAILED || this == FAILED || this == CANCELLED;
    }
}
