package com.avatarflow.pipeline.safety;

import com.avatarflow.pipeline.exception.TransientProviderException;
import com.avatarflow.pipeline.model.ContentTier;
import com.avatarflow.pipeline.model.SafetyVerdict;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModerationSafetyGateTest {

    private static ModerationSafetyGate gate(ExchangeFunction exchange, String apiKey) {
        return new ModerationSafetyGate(WebClient.builder().exchangeFunction(exchange), "http://moderation.local",
                apiKey, "omni-moderation-latest", Duration.ofSeconds(2));
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    @Test
    void should_ClassifySafe_When_ScoresAreInsideBasicBand() {
        SafetyClassification result = ModerationSafetyGate.classifyScores(
                Map.of("sexual", 0.05, "violence", 0.01, "hate", 0.0), ContentTier.BASIC);

        assertThat(result.getVerdict()).isEqualTo(SafetyVerdict.SAFE);
        assertThat(result.getScore()).isEqualTo(0.05);
        assertThat(result.getFlags()).isEmpty();
    }

    @Test
    void should_ClassifyBorderline_When_ScoreIsBetweenBandAndRejection() {
        SafetyClassification result = ModerationSafetyGate.classifyScores(
                Map.of("sexual", 0.45), ContentTier.BASIC);

        assertThat(result.getVerdict()).isEqualTo(SafetyVerdict.BORDERLINE);
    }

    @Test
    void should_AcceptHigherScores_When_TierIsPremium() {
        SafetyClassification result = ModerationSafetyGate.classifyScores(
                Map.of("sexual", 0.45), ContentTier.PREMIUM);

        assertThat(result.getVerdict()).isEqualTo(SafetyVerdict.SAFE);
    }

    @Test
    void should_Reject_When_AnyCategoryExceedsThreshold() {
        SafetyClassification result = ModerationSafetyGate.classifyScores(
                Map.of("sexual", 0.1, "harassment", 0.75), ContentTier.CUSTOM);

        assertThat(result.getVerdict()).isEqualTo(SafetyVerdict.REJECTED);
        assertThat(result.getFlags()).containsExactly("harassment");
        assertThat(result.getScore()).isEqualTo(0.75);
    }

    @Test
    void should_HoldForReview_When_NoApiKeyConfigured() {
        ModerationSafetyGate gate = gate(req -> Mono.error(new AssertionError("must not call")), "");

        SafetyClassification result = gate.classify("s3://avatars/a.png", "portrait", ContentTier.BASIC);

        assertThat(result.getVerdict()).isEqualTo(SafetyVerdict.BORDERLINE);
        assertThat(result.getFlags()).containsExactly("unreviewed");
    }

    @Test
    void should_SendBearerTokenAndParseScores_When_EndpointResponds() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        ModerationSafetyGate gate = gate(req -> {
            captured.set(req);
            return Mono.just(json(HttpStatus.OK,
                    "{\"id\":\"modr-1\",\"results\":[{\"flagged\":false,"
                            + "\"category_scores\":{\"sexual\":0.02,\"violence\":0.01}}]}"));
        }, "sk-test");

        SafetyClassification result = gate.classify("https://cdn.local/a.png", "portrait", ContentTier.BASIC);

        assertThat(result.getVerdict()).isEqualTo(SafetyVerdict.SAFE);
        assertThat(result.getCategoryScores()).containsEntry("sexual", 0.02);
        assertThat(captured.get().url().getPath()).isEqualTo("/v1/moderations");
        assertThat(captured.get().headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test");
    }

    @Test
    void should_ThrowTransient_When_EndpointFails() {
        ModerationSafetyGate gate = gate(req -> Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "{}")), "sk-test");

        assertThatThrownBy(() -> gate.classify("https://cdn.local/a.png", "portrait", ContentTier.BASIC))
                .isInstanceOf(TransientProviderException.class);
    }

    @Test
    void should_ThrowTransient_When_ResponseHasNoResults() {
        ModerationSafetyGate gate = gate(req -> Mono.just(json(HttpStatus.OK, "{\"results\":[]}")), "sk-test");

        assertThatThrownBy(() -> gate.classify("https://cdn.local/a.png", "portrait", ContentTier.BASIC))
                .isInstanceOf(TransientProviderException.class)
                .hasMessageContaining("no results");
    }
}
