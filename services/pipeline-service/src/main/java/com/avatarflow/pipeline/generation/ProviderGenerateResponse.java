package com.avatarflow.pipeline.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProviderGenerateResponse {

    @JsonProperty("image_url")
    private String imageUrl;

    @JsonProperty("cost_usd")
    private BigDecimal costUsd;

    @JsonProperty("latency_ms")
    private Long latencyMs;

    @JsonProperty("cold_start")
    private Boolean coldStart;
}
