package com.greencover.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.greencover.model.BatchRunStatus;
import com.greencover.model.BatchTrigger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Report of one batch recomputation run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRunSummary {

    private String runId;
    private BatchTrigger trigger;
    private BatchRunStatus status;
    private Instant startedAt;
    private Instant finishedAt;

    @Builder.Default
    private List<CityOutcome> outcomes = new ArrayList<>();

    public long getSuccessCount() {
        return count(CityOutcome.Status.SUCCESS);
    }

    public long getFailureCount() {
        return count(CityOutcome.Status.FAILURE);
    }

    public long getSkippedCount() {
        return count(CityOutcome.Status.SKIPPED);
    }

    @JsonIgnore
    public Duration getDuration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    private long count(CityOutcome.Status status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }

    public static BatchRunSummary rejected(String runId, BatchTrigger trigger, Instant now) {
        return BatchRunSummary.builder()
                .runId(runId)
                .trigger(trigger)
                .status(BatchRunStatus.REJECTED)
                .startedAt(now)
                .finishedAt(now)
                .build();
    }
}
