package com.avatarflow.pipeline.generation;

import com.avatarflow.pipeline.exception.PermanentProviderException;
import com.avatarflow.pipeline.exception.TransientProviderException;
import com.avatarflow.pipeline.model.ContentTier;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpGenerationProviderTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private static HttpGenerationProvider provider(ExchangeFunction exchange) {
        return new HttpGenerationProvider(WebClient.builder().exchangeFunction(exchange), "http://inference.local");
    }

    private static GenerationRequest request() {
        return GenerationRequest.builder()
                .artifactId(UUID.randomUUID())
                .prompt("athletic woman in fitted sportswear, gym environment")
                .tier(ContentTier.BASIC)
                .avatarModelRef("lora://ava-v3")
                .templateParams(Map.of("pose", "mid-workout"))
                .build();
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    @Test
    void should_MapResult_When_ProviderReturnsImage() {
        HttpGenerationProvider provider = provider(req -> Mono.just(json(HttpStatus.OK,
                "{\"image_url\":\"https://cdn.local/r.png\",\"cost_usd\":0.0125,\"latency_ms\":8400,\"cold_start\":true}")));

        GenerationResult result = provider.generate(request(), TIMEOUT);

        assertThat(result.getBinaryLocator()).isEqualTo("https://cdn.local/r.png");
        assertThat(result.getCostUsd()).isEqualByComparingTo("0.0125");
        assertThat(result.getLatencyMs()).isEqualTo(8400);
        assertThat(result.isColdStart()).isTrue();
    }

    @Test
    void should_ThrowTransient_When_ProviderIsOverloaded() {
        HttpGenerationProvider provider = provider(req -> Mono.just(json(HttpStatus.TOO_MANY_REQUESTS, "{}")));

        assertThatThrownBy(() -> provider.generate(request(), TIMEOUT))
                .isInstanceOf(TransientProviderException.class)
                .hasMessageContaining("429");
    }

    @Test
    void should_ThrowPermanent_When_ProviderRefusesPrompt() {
        HttpGenerationProvider provider = provider(req -> Mono.just(json(HttpStatus.UNPROCESSABLE_ENTITY,
                "{\"error\":\"prompt blocked\"}")));

        assertThatThrownBy(() -> provider.generate(request(), TIMEOUT))
                .isInstanceOf(PermanentProviderException.class)
                .hasMessageContaining("prompt blocked");
    }

    @Test
    void should_ThrowTransient_When_CallTimesOut() {
        HttpGenerationProvider provider = provider(req -> Mono.never());

        assertThatThrownBy(() -> provider.generate(request(), Duration.ofMillis(50)))
                .isInstanceOf(TransientProviderException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void should_ThrowTransient_When_ResponseHasNoImage() {
        HttpGenerationProvider provider = provider(req -> Mono.just(json(HttpStatus.OK, "{\"cost_usd\":0.01}")));

        assertThatThrownBy(() -> provider.generate(request(), TIMEOUT))
                .isInstanceOf(TransientProviderException.class);
    }
}
