package com.avatarflow.pipeline.model;

public enum SafetyVerdict {
    SAFE,
    BORDERLINE,
    REJECTED
}
