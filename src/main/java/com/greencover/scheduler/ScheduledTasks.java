package com.greencover.scheduler;

import com.greencover.config.GreenCoverProperties;
import com.greencover.model.result.BatchRunSummary;
import com.greencover.service.CacheOrComputeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cron entry points: weekly coverage recomputation and the daily expired-entry sweep.
 * Failures are logged, never propagated to the scheduler thread.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduledTasks {

    private final BatchRecomputationScheduler batchScheduler;
    private final CacheOrComputeService cacheOrComputeService;
    private final GreenCoverProperties properties;

    @Scheduled(cron = "${greencover.scheduler.weekly-cron:0 0 2 * * SUN}", zone = "${greencover.scheduler.zone:UTC}")
    public void weeklyRecomputation() {
        if (!properties.getScheduler().isEnabled()) {
            log.debug("Scheduler disabled, skipping weekly recomputation");
            return;
        }
        try {
            BatchRunSummary summary = batchScheduler.runScheduled();
            log.info("Weekly recomputation {} finished with status {}", summary.getRunId(), summary.getStatus());
        } catch (Exception e) {
            log.error("Weekly recomputation failed", e);
        }
    }

    @Scheduled(cron = "${greencover.scheduler.cleanup-cron:0 0 3 * * *}", zone = "${greencover.scheduler.zone:UTC}")
    public void cleanupExpiredCache() {
        if (!properties.getScheduler().isEnabled()) {
            return;
        }
        try {
            int removed = cacheOrComputeService.sweepExpired();
            log.info("Daily cache cleanup removed {} expired entries", removed);
        } catch (Exception e) {
            log.error("Daily cache cleanup failed", e);
        }
    }
}
