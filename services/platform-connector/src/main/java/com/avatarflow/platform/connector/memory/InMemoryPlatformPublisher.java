package com.avatarflow.platform.connector.memory;

import com.avatarflow.platform.connector.PlatformPublisher;
import com.avatarflow.platform.connector.dto.PublishRequest;
import com.avatarflow.platform.connector.dto.PublishResult;
import com.avatarflow.platform.connector.model.Platform;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Publisher that keeps posts in memory. Used when no connector is configured for a platform
 * and as the scripted adapter in tests.
 * <p>
 * Honours idempotency keys: a key that already published returns the original result
 * without publishing again. Queued outcomes are consumed one per call before the default
 * success path applies.
 * <p>
 * Only the most recent {@code retention} keys and requests are kept, so a long-running
 * service does not grow without bound. A retry for a key older than that publishes again.
 */
@Slf4j
public class InMemoryPlatformPublisher implements PlatformPublisher {

    public static final int DEFAULT_RETENTION = 10_000;

    private final Platform platform;
    private final int retention;
    private final Map<String, PublishResult> publishedByKey;
    private final Queue<PublishResult> scriptedOutcomes = new ConcurrentLinkedQueue<>();
    private final Deque<PublishRequest> requests = new ArrayDeque<>();
    private final AtomicInteger published = new AtomicInteger();

    public InMemoryPlatformPublisher(Platform platform) {
        this(platform, DEFAULT_RETENTION);
    }

    public InMemoryPlatformPublisher(Platform platform, int retention) {
        if (retention <= 0) {
            throw new IllegalArgumentException("retention must be positive");
        }
        this.platform = platform;
        this.retention = retention;
        this.publishedByKey = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PublishResult> eldest) {
                return size() > InMemoryPlatformPublisher.this.retention;
            }
        };
    }

    @Override
    public Platform getPlatform() {
        return platform;
    }

    @Override
    public synchronized PublishResult publish(PublishRequest request, Duration timeout) {
        requests.addLast(request);
        if (requests.size() > retention) {
            requests.removeFirst();
        }

        PublishResult previous = publishedByKey.get(request.getIdempotencyKey());
        if (previous != null) {
            log.info("Duplicate publish for key {} on {} ignored", request.getIdempotencyKey(), platform);
            return previous;
        }

        PublishResult scripted = scriptedOutcomes.poll();
        PublishResult result = scripted != null
                ? scripted
                : PublishResult.success(platform, platform.name().toLowerCase() + "-" + request.getIdempotencyKey());

        if (result.isSuccess()) {
            publishedByKey.put(request.getIdempotencyKey(), result);
            published.incrementAndGet();
        }
        return result;
    }

    public void enqueueOutcome(PublishResult outcome) {
        scriptedOutcomes.add(outcome);
    }

    /**
     * The retained requests, oldest first.
     */
    public synchronized List<PublishRequest> getRequests() {
        return new ArrayList<>(requests);
    }

    public int publishedCount() {
        return published.get();
    }

    synchronized int retainedKeyCount() {
        return publishedByKey.size();
    }
}
