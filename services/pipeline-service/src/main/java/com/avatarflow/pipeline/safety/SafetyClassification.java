package com.avatarflow.pipeline.safety;

import com.avatarflow.pipeline.model.SafetyVerdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SafetyClassification {
    private SafetyVerdict verdict;

    /**
     * Highest category score, 0 to 1.
     */
    private double score;

    // Categories over their rejection threshold, or a reason the content went unreviewed
    @Builder.Default
    private List<String> flags = List.of();

    @Builder.Default
    private Map<String, Double> categoryScores = Map.of();
}
