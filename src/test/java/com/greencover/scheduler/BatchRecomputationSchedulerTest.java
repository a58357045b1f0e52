package com.greencover.scheduler;

import com.greencover.config.GreenCoverProperties;
import com.greencover.exception.CacheUnavailableException;
import com.greencover.exception.CityNotFoundException;
import com.greencover.exception.ErrorKind;
import com.greencover.exception.NoValidPixelsException;
import com.greencover.model.BatchRunStatus;
import com.greencover.model.BatchTrigger;
import com.greencover.model.CalculationRequest;
import com.greencover.model.CalculationType;
import com.greencover.model.CityRecord;
import com.greencover.model.CoverageParameters;
import com.greencover.model.SchedulerState;
import com.greencover.model.result.BatchRunSummary;
import com.greencover.model.result.CityOutcome;
import com.greencover.model.result.CoverageResult;
import com.greencover.model.result.SchedulerStatus;
import com.greencover.repository.data.CityRegistry;
import com.greencover.service.CacheOrComputeService;
import com.greencover.service.CoverageCalculator;
import com.greencover.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BatchRecomputationSchedulerTest {

    @Mock
    private CityRegistry cityRegistry;

    @Mock
    private CacheOrComputeService cacheOrComputeService;

    @Mock
    private CoverageCalculator coverageCalculator;

    private GreenCoverProperties properties;
    private SchedulerStateMachine stateMachine;
    private ThreadPoolTaskExecutor executor;
    private SimpleMeterRegistry meterRegistry;
    private BatchRecomputationScheduler scheduler;
    private List<CityRecord> cities;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        properties.getScheduler().setBatchSize(3);
        properties.getScheduler().setMaxConcurrentAnalyses(3);

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(3);
        executor.setMaxPoolSize(3);
        executor.setThreadNamePrefix("analysis-test-");
        executor.initialize();

        stateMachine = new SchedulerStateMachine();
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(Instant.parse("2024-06-02T02:00:00Z"), ZoneOffset.UTC);
        scheduler = new BatchRecomputationScheduler(cityRegistry, cacheOrComputeService, coverageCalculator,
                stateMachine, executor, properties, clock, meterRegistry);

        cities = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            cities.add(city(i));
        }
        when(cityRegistry.findAll()).thenReturn(cities);
        when(cityRegistry.findByName(anyString())).thenCallRealMethod();

        when(coverageCalculator.satelliteRequest(any(CityRecord.class), any(CoverageParameters.class)))
                .thenAnswer(invocation -> {
                    CityRecord city = invocation.getArgument(0);
                    return CalculationRequest.builder()
                            .calculationType(CalculationType.SATELLITE)
                            .keyParam("city", city.getName())
                            .cityId(city.getId())
                            .cityName(city.getName())
                            .build();
                });
        when(cacheOrComputeService.recompute(any(CalculationRequest.class), eq(CoverageResult.class), any()))
                .thenAnswer(invocation -> invocation.<Supplier<CoverageResult>>getArgument(2).get());
        when(cacheOrComputeService.deriveKey(any(CalculationRequest.class)))
                .thenAnswer(invocation -> "key-" + invocation.<CalculationRequest>getArgument(0).getCityName());
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static CityRecord city(int i) {
        return CityRecord.builder()
                .id((long) i)
                .name("City " + i)
                .boundaryPath(Path.of("boundaries", "city_" + i + ".geojson"))
                .rasterPath(Path.of("satellite", "city_" + i + ".tif"))
                .build();
    }

    private static CoverageResult coverage(String city, double percentage) {
        return CoverageResult.builder().cityName(city).coveragePercentage(percentage).build();
    }

    private void computeAll(Supplier<CoverageResult> perCall, String failingCity, RuntimeException failure) {
        when(coverageCalculator.satelliteComputation(any(CityRecord.class), any(CoverageParameters.class), any()))
                .thenAnswer(invocation -> {
                    CityRecord city = invocation.getArgument(0);
                    Supplier<CoverageResult> supplier = () -> {
                        if (city.getName().equals(failingCity)) {
                            throw failure;
                        }
                        CoverageResult result = perCall.get();
                        result.setCityName(city.getName());
                        return result;
                    };
                    return supplier;
                });
    }

    @Test
    void testOneFailingCityDoesNotStopRun() {
        // Given
        computeAll(() -> coverage(null, 40.0), "City 4", new NoValidPixelsException("no overlap"));

        // When
        BatchRunSummary summary = scheduler.runScheduled();

        // Then
        assertEquals(BatchRunStatus.COMPLETED, summary.getStatus());
        assertEquals(BatchTrigger.SCHEDULED, summary.getTrigger());
        assertEquals(10, summary.getOutcomes().size());
        assertEquals(9, summary.getSuccessCount());
        assertEquals(1, summary.getFailureCount());
        CityOutcome failed = summary.getOutcomes().get(3);
        assertEquals("City 4", failed.getCityName());
        assertEquals(CityOutcome.Status.FAILURE, failed.getStatus());
        assertEquals(ErrorKind.NO_VALID_PIXELS, failed.getErrorKind());
        assertEquals(1, failed.getAttempts());
        assertEquals(SchedulerState.IDLE, stateMachine.getState());
        assertSame(summary, scheduler.getLastRun());
        assertEquals(9.0, meterRegistry.get(BatchRecomputationScheduler.CITY_COUNTER)
                .tag("outcome", "success").counter().count());
        verify(cacheOrComputeService, times(9)).invalidateStale(anyString(), eq(Set.of(CalculationType.SATELLITE,
                CalculationType.STATS)), anyString());
        verify(cacheOrComputeService).invalidateTypes(Set.of(CalculationType.STATS));
    }

    @Test
    void testCitiesWithoutImageryAreNotScheduled() {
        // Given
        cities.add(CityRecord.builder().id(11L).name("No Data").build());
        computeAll(() -> coverage(null, 40.0), null, null);

        // When
        BatchRunSummary summary = scheduler.runScheduled();

        // Then
        assertEquals(10, summary.getOutcomes().size());
        assertTrue(summary.getOutcomes().stream().noneMatch(o -> o.getCityName().equals("No Data")));
    }

    @Test
    void testConcurrentTriggerIsRejected() throws Exception {
        // Given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        computeAll(() -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return coverage(null, 40.0);
        }, null, null);
        CompletableFuture<BatchRunSummary> first = CompletableFuture.supplyAsync(() -> scheduler.triggerBatchRun(null));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        // When
        BatchRunSummary second = scheduler.triggerBatchRun(null);
        SchedulerState during = stateMachine.getState();
        release.countDown();
        BatchRunSummary completed = first.get(10, TimeUnit.SECONDS);

        // Then
        assertEquals(BatchRunStatus.REJECTED, second.getStatus());
        assertTrue(second.getOutcomes().isEmpty());
        assertEquals(SchedulerState.RUNNING, during);
        assertEquals(BatchRunStatus.COMPLETED, completed.getStatus());
        assertEquals(10, completed.getSuccessCount());
        assertEquals(SchedulerState.IDLE, stateMachine.getState());
    }

    @Test
    void testExhaustedBudgetSkipsRemainingCities() {
        // Given
        properties.getScheduler().setMaxProcessingTime(Duration.ZERO);
        computeAll(() -> coverage(null, 40.0), null, null);

        // When
        BatchRunSummary summary = scheduler.runScheduled();

        // Then
        assertEquals(BatchRunStatus.ABORTED_ON_TIMEOUT, summary.getStatus());
        assertEquals(10, summary.getSkippedCount());
        assertEquals(0, summary.getSuccessCount());
        assertEquals(SchedulerState.IDLE, stateMachine.getState());
        verify(cacheOrComputeService, never()).invalidateTypes(any());
    }

    @Test
    void testTransientFailureIsRetried() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        computeAll(() -> {
            if (calls.getAndIncrement() == 0) {
                throw new CacheUnavailableException("database restarting");
            }
            return coverage(null, 55.0);
        }, null, null);

        // When
        BatchRunSummary summary = scheduler.triggerBatchRun("city 1");

        // Then
        assertEquals(1, summary.getOutcomes().size());
        CityOutcome outcome = summary.getOutcomes().get(0);
        assertEquals(CityOutcome.Status.SUCCESS, outcome.getStatus());
        assertEquals(2, outcome.getAttempts());
        assertEquals(55.0, outcome.getCoveragePercentage());
    }

    @Test
    void testRetriesStopAtLimit() {
        // Given
        properties.getScheduler().setMaxRetries(2);
        computeAll(() -> coverage(null, 40.0), "City 2", new CacheUnavailableException("down"));

        // When
        BatchRunSummary summary = scheduler.triggerBatchRun("City 2");

        // Then
        CityOutcome outcome = summary.getOutcomes().get(0);
        assertEquals(CityOutcome.Status.FAILURE, outcome.getStatus());
        assertEquals(ErrorKind.CACHE_UNAVAILABLE, outcome.getErrorKind());
        assertEquals(2, outcome.getAttempts());
        verify(cacheOrComputeService, never()).invalidateTypes(any());
    }

    @Test
    void testUnexpectedFailureIsRetriedUpToLimit() {
        // Given
        properties.getScheduler().setMaxRetries(3);
        computeAll(() -> coverage(null, 40.0), "City 5", new IllegalStateException("reader crashed"));

        // When
        BatchRunSummary summary = scheduler.triggerBatchRun("City 5");

        // Then
        CityOutcome outcome = summary.getOutcomes().get(0);
        assertEquals(CityOutcome.Status.FAILURE, outcome.getStatus());
        assertEquals(ErrorKind.UNEXPECTED, outcome.getErrorKind());
        assertEquals(3, outcome.getAttempts());
        assertTrue(outcome.getReason().contains("reader crashed"));
    }

    @Test
    void testRetryStopsAtRunDeadline() {
        // Given
        properties.getScheduler().setMaxRetries(5);
        properties.getScheduler().setRetryDelay(Duration.ofMillis(500));
        properties.getScheduler().setMaxProcessingTime(Duration.ofMillis(200));
        computeAll(() -> coverage(null, 40.0), "City 3", new CacheUnavailableException("down"));

        // When
        BatchRunSummary summary = scheduler.triggerBatchRun("City 3");

        // Then
        CityOutcome outcome = summary.getOutcomes().get(0);
        assertEquals(CityOutcome.Status.FAILURE, outcome.getStatus());
        assertEquals(ErrorKind.COMPUTE_TIMEOUT, outcome.getErrorKind());
        assertEquals(1, outcome.getAttempts());
    }

    @Test
    void testUnknownCityFailsBeforeRunStarts() {
        // When
        assertThrows(CityNotFoundException.class, () -> scheduler.triggerBatchRun("Atlantis"));

        // Then
        assertEquals(SchedulerState.IDLE, stateMachine.getState());
        assertNull(scheduler.getLastRun());
    }

    @Test
    void testSchedulerStatusReportsNextRuns() {
        // When
        SchedulerStatus status = scheduler.schedulerStatus();

        // Then
        assertTrue(status.isEnabled());
        assertEquals(SchedulerState.IDLE, status.getState());
        assertNotNull(status.getNextWeeklyRun());
        assertNotNull(status.getNextCleanupRun());
        assertEquals(3, status.getBatchSize());
        assertTrue(status.getNextWeeklyRun().isAfter(status.getNextCleanupRun()));
    }
}
