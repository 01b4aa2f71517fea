package com.avatarflow.pipeline.model;

/**
 * Content tier of an artifact. Fixed at creation; decides which platforms may carry it.
 */
public enum ContentTier {
    BASIC,
    PREMIUM,
    CUSTOM
}
