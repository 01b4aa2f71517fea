package com.avatarflow.pipeline.model;

public enum PostStatus {
    PENDING,
    PUBLISHING,
    PUBLISHED,
    FAILED,
    CANCELLED;

    /**
     * Active posts occupy the (artifact, platform) slot.
     */
    public boolean isActive() {
        return this == PENDING || this == PUBLISHING;
    }
}
