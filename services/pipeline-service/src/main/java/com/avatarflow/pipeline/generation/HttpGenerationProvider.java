package com.avatarflow.pipeline.generation;

import com.avatarflow.pipeline.exception.PermanentProviderException;
import com.avatarflow.pipeline.exception.TransientProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Calls the inference service that renders avatar images.
 */
@Slf4j
public class HttpGenerationProvider implements GenerationProvider {

    private final WebClient client;

    public HttpGenerationProvider(WebClient.Builder webClientBuilder, String providerUrl) {
        this.client = webClientBuilder.baseUrl(providerUrl).build();
    }

    @Override
    public GenerationResult generate(GenerationRequest request, Duration timeout) {
        Map<String, Object> body = new HashMap<>();
        body.put("prompt", request.getPrompt());
        body.put("model_ref", request.getAvatarModelRef());
        body.put("tier", request.getTier() != null ? request.getTier().name() : null);
        body.put("params", request.getTemplateParams());

        long started = System.currentTimeMillis();
        ProviderGenerateResponse response;
        try {
            response = client.post()
                    .uri("/api/v1/generate")
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(ProviderGenerateResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw classify(e);
        } catch (WebClientRequestException e) {
            throw new TransientProviderException("Generation provider unreachable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new TransientProviderException("Generation timed out after " + timeout, e);
            }
            throw e;
        }

        if (response == null || response.getImageUrl() == null) {
            throw new TransientProviderException("Generation provider returned no image");
        }

        long latency = response.getLatencyMs() != null
                ? response.getLatencyMs()
                : System.currentTimeMillis() - started;
        boolean coldStart = Boolean.TRUE.equals(response.getColdStart());
        if (coldStart) {
            log.debug("Cold start on generation for artifact {} ({} ms)", request.getArtifactId(), latency);
        }

        return GenerationResult.builder()
                .binaryLocator(response.getImageUrl())
                .costUsd(response.getCostUsd() != null ? response.getCostUsd() : BigDecimal.ZERO)
                .latencyMs(latency)
                .coldStart(coldStart)
                .build();
    }

    private RuntimeException classify(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()
                || status == HttpStatus.REQUEST_TIMEOUT.value()
                || e.getStatusCode().is5xxServerError()) {
            return new TransientProviderException("Generation provider returned " + status, e);
        }
        return new PermanentProviderException("Generation provider refused request (" + status + "): "
                + e.getResponseBodyAsString(), e);
    }
}
