package com.avatarflow.pipeline.generation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResult {
    private String binaryLocator;
    private BigDecimal costUsd;
    private long latencyMs;
    private boolean coldStart;
}
