package com.avatarflow.pipeline.safety;

import com.avatarflow.pipeline.exception.TransientProviderException;
import com.avatarflow.pipeline.model.ContentTier;
import com.avatarflow.pipeline.model.SafetyVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Safety gate backed by an omni-moderation endpoint. The prompt and, when the media is
 * reachable over HTTP, the image itself are classified together.
 * <p>
 * Any category over its rejection threshold rejects the artifact. Scores inside the band of
 * the artifact's tier clear it; anything in between is borderline and waits for review.
 */
@Slf4j
public class ModerationSafetyGate implements SafetyGate {

    static final Map<String, Double> REJECTION_THRESHOLDS;
    static final Map<ContentTier, Map<String, Double>> TIER_BANDS = new EnumMap<>(ContentTier.class);

    static {
        Map<String, Double> rejection = new LinkedHashMap<>();
        rejection.put("sexual", 0.90);
        rejection.put("violence", 0.70);
        rejection.put("hate", 0.50);
        rejection.put("self-harm", 0.50);
        rejection.put("harassment", 0.60);
        REJECTION_THRESHOLDS = Collections.unmodifiableMap(rejection);

        TIER_BANDS.put(ContentTier.BASIC, band(0.20, 0.10, 0.05));
        TIER_BANDS.put(ContentTier.PREMIUM, band(0.60, 0.30, 0.10));
        TIER_BANDS.put(ContentTier.CUSTOM, band(0.90, 0.50, 0.20));
    }

    private static final double DEFAULT_REJECTION_THRESHOLD = 0.5;

    private final WebClient client;
    private final String apiKey;
    private final String model;
    private final Duration timeout;

    public ModerationSafetyGate(WebClient.Builder webClientBuilder, String moderationUrl, String apiKey,
                                String model, Duration timeout) {
        this.client = webClientBuilder.baseUrl(moderationUrl).build();
        this.apiKey = apiKey;
        this.model = model;
        this.timeout = timeout;
    }

    @Override
    public SafetyClassification classify(String binaryLocator, String promptUsed, ContentTier tier) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No moderation API key configured, holding {} for review", binaryLocator);
            return SafetyClassification.builder()
                    .verdict(SafetyVerdict.BORDERLINE)
                    .score(0)
                    .flags(List.of("unreviewed"))
                    .build();
        }

        List<Map<String, Object>> input = new ArrayList<>();
        if (promptUsed != null && !promptUsed.isBlank()) {
            input.add(Map.of("type", "text", "text", promptUsed));
        }
        if (binaryLocator != null && binaryLocator.startsWith("http")) {
            input.add(Map.of("type", "image_url", "image_url", Map.of("url", binaryLocator)));
        }
        if (input.isEmpty()) {
            log.warn("Nothing to classify for {}, holding for review", binaryLocator);
            return SafetyClassification.builder()
                    .verdict(SafetyVerdict.BORDERLINE)
                    .flags(List.of("no_input"))
                    .build();
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("input", input);

        ModerationResponse response;
        try {
            response = client.post()
                    .uri("/v1/moderations")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(ModerationResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw new TransientProviderException("Moderation request failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResults() == null || response.getResults().isEmpty()) {
            throw new TransientProviderException("Moderation endpoint returned no results");
        }
        Map<String, Double> scores = response.getResults().get(0).getCategoryScores();
        return classifyScores(scores != null ? scores : Map.of(), tier);
    }

    static SafetyClassification classifyScores(Map<String, Double> scores, ContentTier tier) {
        List<String> flagged = new ArrayList<>();
        double max = 0;
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            double score = entry.getValue() != null ? entry.getValue() : 0;
            max = Math.max(max, score);
            if (score > REJECTION_THRESHOLDS.getOrDefault(entry.getKey(), DEFAULT_REJECTION_THRESHOLD)) {
                flagged.add(entry.getKey());
            }
        }

        SafetyVerdict verdict;
        if (!flagged.isEmpty()) {
            verdict = SafetyVerdict.REJECTED;
        } else if (withinBand(scores, TIER_BANDS.get(tier != null ? tier : ContentTier.BASIC))) {
            verdict = SafetyVerdict.SAFE;
        } else {
            verdict = SafetyVerdict.BORDERLINE;
        }

        return SafetyClassification.builder()
                .verdict(verdict)
                .score(max)
                .flags(flagged)
                .categoryScores(new HashMap<>(scores))
                .build();
    }

    private static boolean withinBand(Map<String, Double> scores, Map<String, Double> band) {
        for (Map.Entry<String, Double> limit : band.entrySet()) {
            Double score = scores.get(limit.getKey());
            if (score != null && score > limit.getValue()) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Double> band(double sexual, double violence, double hate) {
        Map<String, Double> band = new LinkedHashMap<>();
        band.put("sexual", sexual);
        band.put("violence", violence);
        band.put("hate", hate);
        return Collections.unmodifiableMap(band);
    }
}
