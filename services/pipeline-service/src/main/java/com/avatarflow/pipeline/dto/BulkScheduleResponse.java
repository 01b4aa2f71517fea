package com.avatarflow.pipeline.dto;

import com.avatarflow.pipeline.scheduling.BulkScheduleResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkScheduleResponse {
    private List<ScheduledPostResponse> scheduled;
    private List<BulkScheduleResult.Failure> failures;

    public static BulkScheduleResponse from(BulkScheduleResult result) {
        return BulkScheduleResponse.builder()
                .scheduled(result.getScheduled().stream()
                        .map(ScheduledPostResponse::from)
                        .collect(Collectors.toList()))
                .failures(result.getFailures())
                .build();
    }
}
