package com.avatarflow.platform.connector;

import com.avatarflow.platform.connector.model.Platform;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Selects the publisher variant for a platform.
 */
@Slf4j
public class PublisherRegistry {

    private final Map<Platform, PlatformPublisher> publishers = new EnumMap<>(Platform.class);

    public PublisherRegistry(List<PlatformPublisher> publishers) {
        for (PlatformPublisher publisher : publishers) {
            PlatformPublisher previous = this.publishers.putIfAbsent(publisher.getPlatform(), publisher);
            if (previous != null) {
                throw new IllegalStateException("Duplicate publisher registered for " + publisher.getPlatform());
            }
            if (!publisher.supportsIdempotencyKeys()) {
                log.warn("Publisher for {} ignores idempotency keys; retried publishes are best-effort",
                        publisher.getPlatform().getDisplayName());
            }
        }
    }

    public Optional<PlatformPublisher> find(Platform platform) {
        return Optional.ofNullable(publishers.get(platform));
    }

    public Set<Platform> supportedPlatforms() {
        return Collections.unmodifiableSet(publishers.keySet());
    }
}
