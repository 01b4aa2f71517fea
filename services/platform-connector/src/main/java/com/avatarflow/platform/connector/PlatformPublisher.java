package com.avatarflow.platform.connector;

import com.avatarflow.platform.connector.dto.PublishRequest;
import com.avatarflow.platform.connector.dto.PublishResult;
import com.avatarflow.platform.connector.model.Platform;

import java.time.Duration;

/**
 * Common contract for all social platform publishers.
 * One implementation per {@link Platform}; callers select it through {@link PublisherRegistry}.
 */
public interface PlatformPublisher {

    /**
     * Get the platform this publisher handles
     */
    Platform getPlatform();

    /**
     * Publish one artifact to the platform.
     * <p>
     * Implementations never throw for platform-side problems: rate limits, timeouts and
     * transient network errors come back as {@code retryable} failures, policy rejections and
     * credential problems as permanent ones. The call must complete within {@code timeout}.
     */
    PublishResult publish(PublishRequest request, Duration timeout);

    /**
     * Whether the platform honours {@link PublishRequest#getIdempotencyKey()}. Without it a
     * retried publish is best-effort and may duplicate.
     */
    default boolean supportsIdempotencyKeys() {
        return true;
    }
}
