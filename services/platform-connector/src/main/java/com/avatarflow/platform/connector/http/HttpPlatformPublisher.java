package com.avatarflow.platform.connector.http;

import com.avatarflow.platform.connector.PlatformPublisher;
import com.avatarflow.platform.connector.dto.ConnectorPublishResponse;
import com.avatarflow.platform.connector.dto.PublishRequest;
import com.avatarflow.platform.connector.dto.PublishResult;
import com.avatarflow.platform.connector.model.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Publishes through a platform connector service over HTTP.
 * <p>
 * The connector owns credentials and the platform SDK; this adapter only forwards the
 * request with an {@code Idempotency-Key} header and classifies the outcome.
 */
@Slf4j
public class HttpPlatformPublisher implements PlatformPublisher {

    public static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final Platform platform;
    private final WebClient client;

    public HttpPlatformPublisher(Platform platform, WebClient.Builder webClientBuilder, String connectorBaseUrl) {
        this.platform = platform;
        this.client = webClientBuilder.baseUrl(connectorBaseUrl).build();
    }

    @Override
    public Platform getPlatform() {
        return platform;
    }

    @Override
    public PublishResult publish(PublishRequest request, Duration timeout) {
        log.info("Publishing artifact {} to {} (attempt {})",
                request.getArtifactId(), platform.getDisplayName(), request.getAttempt());

        Map<String, Object> body = new HashMap<>();
        body.put("account_id", request.getPlatformAccountId().toString());
        body.put("media_url", request.getMediaLocator());
        body.put("caption", platform.fitCaption(request.getCaption() != null ? request.getCaption() : ""));
        body.put("tier", request.getTier());
        body.put("metadata", request.getMetadata());

        try {
            ConnectorPublishResponse response = client.post()
                    .uri("/api/v1/{platform}/publish", platform.name().toLowerCase())
                    .header(IDEMPOTENCY_HEADER, request.getIdempotencyKey())
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(ConnectorPublishResponse.class)
                    .timeout(timeout)
                    .block();

            return toResult(response);

        } catch (WebClientResponseException e) {
            return classifyHttpError(e);
        } catch (WebClientRequestException e) {
            log.warn("Connector for {} unreachable: {}", platform.getDisplayName(), e.getMessage());
            return PublishResult.retryableFailure(platform, "NETWORK_ERROR", e.getMessage());
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                log.warn("Publish to {} timed out after {}", platform.getDisplayName(), timeout);
                return PublishResult.retryableFailure(platform, "TIMEOUT",
                        platform.getDisplayName() + " publish request timed out");
            }
            log.error("Unexpected error publishing to {}: {}", platform.getDisplayName(), e.getMessage(), e);
            return PublishResult.retryableFailure(platform, "INTERNAL_ERROR", e.getMessage());
        }
    }

    private PublishResult toResult(ConnectorPublishResponse response) {
        if (response == null) {
            return PublishResult.retryableFailure(platform, "EMPTY_RESPONSE", "Connector returned no body");
        }
        if (Boolean.FALSE.equals(response.getSuccess())) {
            boolean retryable = Boolean.TRUE.equals(response.getRetryable());
            return retryable
                    ? PublishResult.retryableFailure(platform, response.getErrorCode(), response.getErrorMessage())
                    : PublishResult.permanentFailure(platform, response.getErrorCode(), response.getErrorMessage());
        }
        if (response.getPlatformPostId() == null) {
            return PublishResult.retryableFailure(platform, "EMPTY_RESPONSE", "Connector returned no post id");
        }
        return PublishResult.success(platform, response.getPlatformPostId());
    }

    private PublishResult classifyHttpError(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String message = e.getResponseBodyAsString().isBlank() ? e.getMessage() : e.getResponseBodyAsString();

        if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            log.warn("{} rate limited the publish request", platform.getDisplayName());
            return PublishResult.retryableFailure(platform, "RATE_LIMITED", message);
        }
        if (status == HttpStatus.REQUEST_TIMEOUT.value() || e.getStatusCode().is5xxServerError()) {
            return PublishResult.retryableFailure(platform, "SERVICE_UNAVAILABLE_" + status, message);
        }
        if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
            return PublishResult.permanentFailure(platform, "INVALID_CREDENTIALS", message);
        }
        return PublishResult.permanentFailure(platform, "REJECTED_" + status, message);
    }
}
