package com.avatarflow.platform.connector.model;

import lombok.Getter;

import java.time.Duration;

@Getter
public enum Platform {
    INSTAGRAM(
        "Instagram",
        Duration.ofHours(4),    // base spacing between posts
        3,                      // posts per day
        2200                    // caption length
    ),
    TIKTOK(
        "TikTok",
        Duration.ofHours(3),
        5,
        2200
    ),
    TWITTER(
        "X (Twitter)",
        Duration.ofHours(1),
        10,
        280
    ),
    ONLYFANS(
        "OnlyFans",
        Duration.ofHours(6),
        2,
        1000
    );

    private final String displayName;
    private final Duration defaultMinSpacing;
    private final int defaultMaxPostsPerDay;
    private final int maxCaptionLength;

    Platform(String displayName, Duration defaultMinSpacing, int defaultMaxPostsPerDay, int maxCaptionLength) {
        this.displayName = displayName;
        this.defaultMinSpacing = defaultMinSpacing;
        this.defaultMaxPostsPerDay = defaultMaxPostsPerDay;
        this.maxCaptionLength = maxCaptionLength;
    }

    /**
     * Trim a caption to this platform's limit, keeping whole words where possible.
     */
    public String fitCaption(String caption) {
        if (caption == null || caption.length() <= maxCaptionLength) {
            return caption;
        }
        String cut = caption.substring(0, maxCaptionLength - 3);
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > maxCaptionLength / 2) {
            cut = cut.substring(0, lastSpace);
        }
        return cut + "...";
    }
}
