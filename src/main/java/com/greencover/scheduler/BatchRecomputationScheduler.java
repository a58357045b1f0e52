package com.greencover.scheduler;

import com.greencover.config.GreenCoverProperties;
import com.greencover.exception.CityNotFoundException;
import com.greencover.exception.ErrorKind;
import com.greencover.exception.GreenCoverageException;
import com.greencover.model.BatchRunStatus;
import com.greencover.model.BatchTrigger;
import com.greencover.model.CalculationRequest;
import com.greencover.model.CalculationType;
import com.greencover.model.CityRecord;
import com.greencover.model.CoverageParameters;
import com.greencover.model.result.BatchRunSummary;
import com.greencover.model.result.CityOutcome;
import com.greencover.model.result.CoverageResult;
import com.greencover.model.result.SchedulerStatus;
import com.greencover.repository.data.CityRegistry;
import com.greencover.service.CacheOrComputeService;
import com.greencover.service.CoverageCalculator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.policy.CompositeRetryPolicy;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.Year;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Recomputes satellite coverage for every city with imagery, in fixed-size
 * partitions on a bounded worker pool. A city's failure is recorded and never
 * stops the run; the run stops taking new cities once its time budget is spent.
 */
@Service
public class BatchRecomputationScheduler {

    private static final Logger logger = LoggerFactory.getLogger(BatchRecomputationScheduler.class);

    static final String CITY_COUNTER = "greencover.batch.cities";
    static final String RUN_TIMER = "greencover.batch.duration";

    private static final Set<CalculationType> CITY_TYPES = Set.of(CalculationType.SATELLITE, CalculationType.STATS);

    private final CityRegistry cityRegistry;
    private final CacheOrComputeService cacheOrComputeService;
    private final CoverageCalculator coverageCalculator;
    private final SchedulerStateMachine stateMachine;
    private final AsyncTaskExecutor analysisExecutor;
    private final GreenCoverProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private volatile BatchRunSummary lastRun;

    public BatchRecomputationScheduler(CityRegistry cityRegistry, CacheOrComputeService cacheOrComputeService,
                                       CoverageCalculator coverageCalculator, SchedulerStateMachine stateMachine,
                                       @Qualifier("analysisExecutor") AsyncTaskExecutor analysisExecutor,
                                       GreenCoverProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.cityRegistry = cityRegistry;
        this.cacheOrComputeService = cacheOrComputeService;
        this.coverageCalculator = coverageCalculator;
        this.stateMachine = stateMachine;
        this.analysisExecutor = analysisExecutor;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run over all cities with imagery, as the weekly schedule does
     */
    public BatchRunSummary runScheduled() {
        return run(BatchTrigger.SCHEDULED, null);
    }

    /**
     * Manual run over all cities, or over one city when {@code cityName} is given.
     * Rejected while another run is active.
     *
     * @throws CityNotFoundException when the named city is not registered
     */
    public BatchRunSummary triggerBatchRun(String cityName) {
        return run(BatchTrigger.MANUAL, cityName);
    }

    private BatchRunSummary run(BatchTrigger trigger, String cityName) {
        List<CityRecord> cities = selectCities(cityName);
        String runId = UUID.randomUUID().toString().substring(0, 8);

        if (!stateMachine.tryBegin()) {
            logger.warn("Batch run {} ({}) rejected: another run is in progress", runId, trigger);
            return BatchRunSummary.rejected(runId, trigger, clock.instant());
        }

        BatchRunStatus status = null;
        try {
            BatchRunSummary summary = execute(runId, trigger, cityName, cities);
            status = summary.getStatus();
            lastRun = summary;
            return summary;
        } finally {
            if (status != null) {
                stateMachine.finish(status);
            } else {
                stateMachine.release();
            }
        }
    }

    private List<CityRecord> selectCities(String cityName) {
        if (cityName != null && !cityName.isBlank()) {
            CityRecord city = cityRegistry.findByName(cityName).orElseThrow(() -> new CityNotFoundException(
                    cityName, cityRegistry.findAll().stream().map(CityRecord::getName).collect(Collectors.toList())));
            return List.of(city);
        }
        List<CityRecord> all = cityRegistry.findAll();
        List<CityRecord> available = all.stream().filter(CityRecord::hasImagery).collect(Collectors.toList());
        if (available.size() < all.size()) {
            logger.info("{} of {} cities have no satellite imagery or boundary data and are not scheduled",
                    all.size() - available.size(), all.size());
        }
        return available;
    }

    private BatchRunSummary execute(String runId, BatchTrigger trigger, String scope, List<CityRecord> cities) {
        GreenCoverProperties.Scheduler config = properties.getScheduler();
        int batchSize = config.getBatchSize();
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        long deadline = startNanos + config.getMaxProcessingTime().toNanos();
        CoverageParameters parameters = CoverageParameters.defaults(properties.getAnalysis(), Year.now(clock).getValue());

        logger.info("Batch run {} started ({}, scope {}): {} cities, batch size {}, {} workers, budget {}",
                runId, trigger, scope == null ? "all cities" : scope, cities.size(), batchSize,
                config.getMaxConcurrentAnalyses(), config.getMaxProcessingTime());

        List<CityOutcome> outcomes = new ArrayList<>();
        boolean aborted = false;
        int partitions = (cities.size() + batchSize - 1) / batchSize;
        for (int p = 0; p < partitions; p++) {
            List<CityRecord> partition = cities.subList(p * batchSize, Math.min(cities.size(), (p + 1) * batchSize));
            if (pastDeadline(deadline)) {
                aborted = true;
                partition.forEach(city -> outcomes.add(skipped(city)));
                continue;
            }
            logger.info("Batch run {}: processing partition {}/{} ({} cities)", runId, p + 1, partitions,
                    partition.size());

            Map<CityRecord, Future<CityOutcome>> futures = new LinkedHashMap<>();
            for (CityRecord city : partition) {
                futures.put(city, analysisExecutor.submit(() -> processCity(city, parameters, deadline)));
            }
            for (Map.Entry<CityRecord, Future<CityOutcome>> entry : futures.entrySet()) {
                CityOutcome outcome = await(entry.getKey(), entry.getValue());
                if (outcome.getStatus() == CityOutcome.Status.SKIPPED) {
                    aborted = true;
                }
                outcomes.add(outcome);
                record(outcome);
            }

            if (p < partitions - 1 && !pastDeadline(deadline)) {
                pause(config.getBatchPause());
            }
        }

        if (outcomes.stream().anyMatch(o -> o.getStatus() == CityOutcome.Status.SUCCESS)) {
            invalidateAggregates();
        }

        BatchRunSummary summary = BatchRunSummary.builder()
                .runId(runId)
                .trigger(trigger)
                .status(aborted ? BatchRunStatus.ABORTED_ON_TIMEOUT : BatchRunStatus.COMPLETED)
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .outcomes(outcomes)
                .build();
        Timer.builder(RUN_TIMER)
                .description("Duration of batch recomputation runs")
                .tag("status", summary.getStatus().name())
                .register(meterRegistry)
                .record(Duration.ofNanos(System.nanoTime() - startNanos));
        logger.info("Batch run {} {}: {} succeeded, {} failed, {} skipped in {}s", runId, summary.getStatus(),
                summary.getSuccessCount(), summary.getFailureCount(), summary.getSkippedCount(),
                Duration.ofNanos(System.nanoTime() - startNanos).toSeconds());
        return summary;
    }

    private CityOutcome await(CityRecord city, Future<CityOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return CityOutcome.skipped(city.getId(), city.getName(), "Batch run interrupted");
        } catch (ExecutionException e) {
            logger.error("Unexpected failure processing {}", city.getName(), e.getCause());
            return CityOutcome.failure(city.getId(), city.getName(), ErrorKind.UNEXPECTED,
                    String.valueOf(e.getCause()), 1, 0);
        }
    }

    /**
     * Recompute one city, retrying transient failures. Never throws.
     */
    CityOutcome processCity(CityRecord city, CoverageParameters parameters, long deadline) {
        GreenCoverProperties.Scheduler config = properties.getScheduler();
        if (pastDeadline(deadline)) {
            return skipped(city);
        }
        long started = System.nanoTime();
        RetryTemplate retryTemplate = cityRetryTemplate(config, deadline);
        try {
            return retryTemplate.execute(
                    context -> attempt(city, parameters, config, context.getRetryCount() + 1, started),
                    context -> exhausted(city, context, deadline, started));
        } catch (BackOffInterruptedException e) {
            return CityOutcome.failure(city.getId(), city.getName(), ErrorKind.UNEXPECTED,
                    "Retry interrupted: " + e.getMessage(), 1, elapsedMs(started));
        }
    }

    private CityOutcome attempt(CityRecord city, CoverageParameters parameters, GreenCoverProperties.Scheduler config,
                                int attempt, long started) {
        try {
            CalculationRequest request = coverageCalculator.satelliteRequest(city, parameters);
            CoverageResult result = cacheOrComputeService.recompute(request, CoverageResult.class,
                    coverageCalculator.satelliteComputation(city, parameters, config.getCityTimeout()));
            invalidateStale(city, cacheOrComputeService.deriveKey(request));
            logger.info("City {} recomputed: {}% green coverage", city.getName(),
                    String.format("%.2f", result.getCoveragePercentage()));
            return CityOutcome.success(city.getId(), city.getName(), result.getCoveragePercentage(), attempt,
                    elapsedMs(started));
        } catch (GreenCoverageException e) {
            logger.warn("City {} failed on attempt {} ({}): {}", city.getName(), attempt, e.getKind(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure processing city {} on attempt {}", city.getName(), attempt, e);
            throw e;
        }
    }

    private CityOutcome exhausted(CityRecord city, RetryContext context, long deadline, long started) {
        Throwable last = context.getLastThrowable();
        if (last == null) {
            return skipped(city);
        }
        int attempts = context.getRetryCount();
        ErrorKind kind = kindOf(last);
        if (kind.isRetryable() && attempts < maxAttempts(properties.getScheduler()) && pastDeadline(deadline)) {
            return CityOutcome.failure(city.getId(), city.getName(), ErrorKind.COMPUTE_TIMEOUT,
                    "Run time budget exhausted before retry", attempts, elapsedMs(started));
        }
        String reason = last instanceof GreenCoverageException ? last.getMessage() : String.valueOf(last);
        return CityOutcome.failure(city.getId(), city.getName(), kind, reason, attempts, elapsedMs(started));
    }

    /**
     * Retries only retryable error kinds, up to {@code max-retries} attempts,
     * with {@code retry-delay} between them, and never past the run deadline.
     */
    RetryTemplate cityRetryTemplate(GreenCoverProperties.Scheduler config, long deadline) {
        RetryPolicy transientFailures = new SimpleRetryPolicy(maxAttempts(config));
        RetryPolicy permanentFailures = new NeverRetryPolicy();
        ExceptionClassifierRetryPolicy byKind = new ExceptionClassifierRetryPolicy();
        byKind.setExceptionClassifier(throwable -> kindOf(throwable).isRetryable()
                ? transientFailures : permanentFailures);

        CompositeRetryPolicy policy = new CompositeRetryPolicy();
        policy.setPolicies(new RetryPolicy[]{byKind, new RunDeadlineRetryPolicy(deadline)});

        FixedBackOffPolicy backOff = new FixedBackOffPolicy();
        Duration delay = config.getRetryDelay();
        backOff.setBackOffPeriod(delay == null || delay.isNegative() ? 0 : delay.toMillis());

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(policy);
        template.setBackOffPolicy(backOff);
        return template;
    }

    private static int maxAttempts(GreenCoverProperties.Scheduler config) {
        return Math.max(1, config.getMaxRetries());
    }

    private static ErrorKind kindOf(Throwable throwable) {
        return throwable instanceof GreenCoverageException
                ? ((GreenCoverageException) throwable).getKind()
                : ErrorKind.UNEXPECTED;
    }

    private void invalidateStale(CityRecord city, String freshKey) {
        try {
            cacheOrComputeService.invalidateStale(city.getName(), CITY_TYPES, freshKey);
        } catch (GreenCoverageException e) {
            logger.warn("Fresh coverage for {} stored but stale entries were not removed: {}",
                    city.getName(), e.getMessage());
        }
    }

    /**
     * Aggregates span several cities, so any refreshed city makes them stale
     */
    private void invalidateAggregates() {
        try {
            cacheOrComputeService.invalidateTypes(Set.of(CalculationType.STATS));
        } catch (GreenCoverageException e) {
            logger.warn("Could not invalidate aggregate statistics: {}", e.getMessage());
        }
    }

    private CityOutcome skipped(CityRecord city) {
        return CityOutcome.skipped(city.getId(), city.getName(), "Run time budget exhausted");
    }

    private void record(CityOutcome outcome) {
        Counter.builder(CITY_COUNTER)
                .description("Cities processed by batch runs")
                .tag("outcome", outcome.getStatus().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
        if (outcome.getStatus() != CityOutcome.Status.SUCCESS) {
            logger.info("City {} {}: {}", outcome.getCityName(), outcome.getStatus(), outcome.getReason());
        }
    }

    static boolean pastDeadline(long deadline) {
        return System.nanoTime() - deadline >= 0;
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    private static void pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            logger.warn("Pause between partitions interrupted");
            Thread.currentThread().interrupt();
        }
    }

    public SchedulerStatus schedulerStatus() {
        GreenCoverProperties.Scheduler config = properties.getScheduler();
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneId.of(config.getZone())));
        return SchedulerStatus.builder()
                .enabled(config.isEnabled())
                .state(stateMachine.getState())
                .nextWeeklyRun(config.isEnabled() ? CronExpression.parse(config.getWeeklyCron()).next(now) : null)
                .nextCleanupRun(config.isEnabled() ? CronExpression.parse(config.getCleanupCron()).next(now) : null)
                .lastRun(lastRun)
                .batchSize(config.getBatchSize())
                .maxConcurrentAnalyses(config.getMaxConcurrentAnalyses())
                .build();
    }

    public BatchRunSummary getLastRun() {
        return lastRun;
    }
}
