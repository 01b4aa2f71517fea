package com.avatarflow.pipeline.scheduling;

import com.avatarflow.pipeline.entity.ScheduledPost;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of scheduling several artifacts on one account. Artifacts that could not be
 * scheduled are listed with the error code they would have produced on their own.
 */
@Data
@NoArgsConstructor
public class BulkScheduleResult {

    private List<ScheduledPost> scheduled = new ArrayList<>();
    private List<Failure> failures = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Failure {
        private UUID artifactId;
        private String code;
        private String message;
    }
}
