package com.greencover.model.result;

import com.greencover.model.SchedulerState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * Snapshot of the batch scheduler
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatus {

    private boolean enabled;
    private SchedulerState state;
    private ZonedDateTime nextWeeklyRun;
    private ZonedDateTime nextCleanupRun;
    private BatchRunSummary lastRun;
    private int batchSize;
    private int maxConcurrentAnalyses;
}
