package com.avatarflow.pipeline.model;

public enum AccountHealth {
    HEALTHY,
    DEGRADED,
    // Stays until an operator resets the account
    SUSPENDED
}
