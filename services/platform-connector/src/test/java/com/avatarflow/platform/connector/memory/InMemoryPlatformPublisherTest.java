package com.avatarflow.platform.connector.memory;

import com.avatarflow.platform.connector.dto.PublishRequest;
import com.avatarflow.platform.connector.dto.PublishResult;
import com.avatarflow.platform.connector.model.Platform;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryPlatformPublisherTest {

    private final InMemoryPlatformPublisher publisher = new InMemoryPlatformPublisher(Platform.INSTAGRAM);

    private static PublishRequest request(String key) {
        return PublishRequest.builder().idempotencyKey(key).platform(Platform.INSTAGRAM).build();
    }

    @Test
    void should_PublishOnce_When_SameIdempotencyKeyRetried() {
        PublishResult first = publisher.publish(request("k1"), Duration.ofSeconds(1));
        PublishResult second = publisher.publish(request("k1"), Duration.ofSeconds(1));

        assertThat(first.isSuccess()).isTrue();
        assertThat(second.getPlatformPostId()).isEqualTo(first.getPlatformPostId());
        assertThat(publisher.publishedCount()).isEqualTo(1);
        assertThat(publisher.getRequests()).hasSize(2);
    }

    @Test
    void should_ReturnScriptedOutcomes_InOrder() {
        publisher.enqueueOutcome(PublishResult.retryableFailure(Platform.INSTAGRAM, "RATE_LIMITED", "slow down"));

        PublishResult first = publisher.publish(request("k2"), Duration.ofSeconds(1));
        PublishResult second = publisher.publish(request("k2"), Duration.ofSeconds(1));

        assertThat(first.isRetryable()).isTrue();
        assertThat(second.isSuccess()).isTrue();
        assertThat(publisher.publishedCount()).isEqualTo(1);
    }

    @Test
    void should_KeepOnlyRecentRequestsAndKeys_When_RetentionIsExceeded() {
        InMemoryPlatformPublisher bounded = new InMemoryPlatformPublisher(Platform.INSTAGRAM, 3);

        for (int i = 0; i < 10; i++) {
            bounded.publish(request("k" + i), Duration.ofSeconds(1));
        }

        assertThat(bounded.getRequests()).extracting(PublishRequest::getIdempotencyKey)
                .containsExactly("k7", "k8", "k9");
        assertThat(bounded.retainedKeyCount()).isEqualTo(3);
        assertThat(bounded.publishedCount()).isEqualTo(10);
        assertThat(bounded.publish(request("k9"), Duration.ofSeconds(1)).getPlatformPostId())
                .isEqualTo("instagram-k9");
        assertThat(bounded.publishedCount()).isEqualTo(10);
    }
}
