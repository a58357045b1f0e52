package com.greencover.service.impl;

import com.greencover.config.GreenCoverProperties;
import com.greencover.exception.CityNotFoundException;
import com.greencover.exception.GreenCoverageException;
import com.greencover.exception.InvalidInputException;
import com.greencover.geo.CoordinateReconciler;
import com.greencover.geo.ReconciliationResult;
import com.greencover.model.BoundaryCollection;
import com.greencover.model.BoundaryGeometry;
import com.greencover.model.CalculationRequest;
import com.greencover.model.CalculationType;
import com.greencover.model.CityRecord;
import com.greencover.model.CoverageParameters;
import com.greencover.model.result.BatchRunSummary;
import com.greencover.model.result.BoundarySourceInfo;
import com.greencover.model.result.CacheStats;
import com.greencover.model.result.CoverageComparison;
import com.greencover.model.result.CoverageResult;
import com.greencover.model.result.CoverageStatistics;
import com.greencover.model.result.SchedulerStatus;
import com.greencover.raster.RasterSource;
import com.greencover.repository.data.CityRegistry;
import com.greencover.repository.data.SourceFormat;
import com.greencover.repository.data.SourceReaderFactory;
import com.greencover.scheduler.BatchRecomputationScheduler;
import com.greencover.service.CacheOrComputeService;
import com.greencover.service.CoverageCalculator;
import com.greencover.service.GreenCoverageService;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Service
public class GreenCoverageServiceImpl implements GreenCoverageService {

    private static final Logger logger = LoggerFactory.getLogger(GreenCoverageServiceImpl.class);

    private static final int SAMPLE_NAMES = 10;

    private final CacheOrComputeService cacheOrComputeService;
    private final CoverageCalculator coverageCalculator;
    private final CityRegistry cityRegistry;
    private final SourceReaderFactory readerFactory;
    private final CoordinateReconciler reconciler;
    private final BatchRecomputationScheduler batchScheduler;
    private final GreenCoverProperties properties;
    private final Clock clock;

    public GreenCoverageServiceImpl(CacheOrComputeService cacheOrComputeService,
                                    CoverageCalculator coverageCalculator, CityRegistry cityRegistry,
                                    SourceReaderFactory readerFactory, CoordinateReconciler reconciler,
                                    BatchRecomputationScheduler batchScheduler, GreenCoverProperties properties,
                                    Clock clock) {
        this.cacheOrComputeService = cacheOrComputeService;
        this.coverageCalculator = coverageCalculator;
        this.cityRegistry = cityRegistry;
        this.readerFactory = readerFactory;
        this.reconciler = reconciler;
        this.batchScheduler = batchScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public CoverageResult computeCoverage(Path boundaryFile, Path rasterFile, String cityName,
                                          CoverageParameters parameters) {
        return coverageCalculator.analyze(boundaryFile, rasterFile, cityName, parameters, null);
    }

    @Override
    public CoverageResult coverage(Path boundaryFile, Path rasterFile, String cityName,
                                   CoverageParameters parameters) {
        parameters.validate();
        Long cityId = cityRegistry.findByName(cityName).map(CityRecord::getId).orElse(null);
        CalculationRequest request = coverageCalculator.satelliteRequest(cityId, cityName, boundaryFile, rasterFile,
                parameters);
        return cacheOrComputeService.getOrCompute(request, CoverageResult.class,
                () -> coverageCalculator.analyze(boundaryFile, rasterFile, cityName, parameters, null));
    }

    @Override
    public CoverageResult cityCoverage(String cityName, Integer year) {
        CityRecord city = registeredCity(cityName);
        CoverageParameters parameters = defaultParameters(year);
        CalculationRequest request = coverageCalculator.satelliteRequest(city, parameters);
        return cacheOrComputeService.getOrCompute(request, CoverageResult.class,
                coverageCalculator.satelliteComputation(city, parameters,
                        properties.getScheduler().getCityTimeout()));
    }

    @Override
    public CoverageStatistics coverageStatistics(List<String> cityNames, Integer year) {
        if (cityNames == null || cityNames.isEmpty()) {
            throw new IllegalArgumentException("At least one city is required");
        }
        int effectiveYear = effectiveYear(year);
        List<String> cities = cityNames.stream()
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .sorted()
                .collect(Collectors.toList());

        Map<String, Object> params = aggregateParams("coverage-statistics", effectiveYear);
        params.put("cities", cities);
        CalculationRequest request = CalculationRequest.builder()
                .calculationType(CalculationType.STATS)
                .keyParams(params)
                .build();
        return cacheOrComputeService.getOrCompute(request, CoverageStatistics.class,
                () -> aggregate(cities, effectiveYear));
    }

    private CoverageStatistics aggregate(List<String> cities, int year) {
        List<CoverageResult> results = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (String city : cities) {
            try {
                results.add(cityCoverage(city, year));
            } catch (GreenCoverageException e) {
                logger.warn("Excluding {} from statistics: {}", city, e.getMessage());
                failed.add(city);
            }
        }
        if (results.isEmpty()) {
            throw new InvalidInputException("No coverage could be computed for any of " + cities);
        }

        Comparator<CoverageResult> byCoverage = Comparator.comparingDouble(CoverageResult::getCoveragePercentage);
        CoverageResult greenest = results.stream().max(byCoverage).orElseThrow();
        CoverageResult leastGreen = results.stream().min(byCoverage).orElseThrow();
        return CoverageStatistics.builder()
                .year(year)
                .cityCount(results.size())
                .meanCoveragePercentage(results.stream()
                        .mapToDouble(CoverageResult::getCoveragePercentage).average().orElse(0.0))
                .minCoveragePercentage(leastGreen.getCoveragePercentage())
                .maxCoveragePercentage(greenest.getCoveragePercentage())
                .greenestCity(greenest.getCityName())
                .leastGreenCity(leastGreen.getCityName())
                .totalAreaKm2(results.stream().mapToDouble(CoverageResult::getTotalAreaKm2).sum())
                .totalVegetatedAreaKm2(results.stream().mapToDouble(CoverageResult::getVegetatedAreaKm2).sum())
                .cities(results)
                .failedCities(failed)
                .build();
    }

    @Override
    public CoverageComparison compareCoverage(String firstCity, String secondCity, Integer year) {
        int effectiveYear = effectiveYear(year);
        Map<String, Object> params = aggregateParams("coverage-comparison", effectiveYear);
        params.put("first", firstCity.trim().toLowerCase(Locale.ROOT));
        params.put("second", secondCity.trim().toLowerCase(Locale.ROOT));
        CalculationRequest request = CalculationRequest.builder()
                .calculationType(CalculationType.STATS)
                .keyParams(params)
                .build();
        return cacheOrComputeService.getOrCompute(request, CoverageComparison.class, () -> {
            CoverageResult first = cityCoverage(firstCity, effectiveYear);
            CoverageResult second = cityCoverage(secondCity, effectiveYear);
            double difference = first.getCoveragePercentage() - second.getCoveragePercentage();
            String greener = difference > 0 ? first.getCityName() : difference < 0 ? second.getCityName() : null;
            return CoverageComparison.builder()
                    .year(effectiveYear)
                    .first(first)
                    .second(second)
                    .coverageDifference(difference)
                    .vegetatedAreaDifferenceKm2(first.getVegetatedAreaKm2() - second.getVegetatedAreaKm2())
                    .meanNdviDifference(first.getMeanNdvi() - second.getMeanNdvi())
                    .greenerCity(greener)
                    .build();
        });
    }

    private Map<String, Object> aggregateParams(String operation, int year) {
        GreenCoverProperties.Analysis analysis = properties.getAnalysis();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("operation", operation);
        params.put("year", year);
        params.put("ndvi_threshold", analysis.getNdviThreshold());
        params.put("red_band", analysis.getRedBandIndex());
        params.put("nir_band", analysis.getNirBandIndex());
        return params;
    }

    @Override
    public BoundarySourceInfo describeBoundaries(Path boundaryFile) {
        String nameProperty = properties.getAnalysis().getNameProperty();
        BoundaryCollection boundaries = readerFactory.boundaryReader(boundaryFile).read(boundaryFile, nameProperty);

        Envelope extent = new Envelope();
        TreeSet<String> propertyNames = new TreeSet<>();
        TreeSet<String> geometryTypes = new TreeSet<>();
        for (BoundaryGeometry feature : boundaries.getFeatures()) {
            extent.expandToInclude(feature.getGeometry().getEnvelopeInternal());
            geometryTypes.add(feature.getGeometry().getGeometryType());
            if (feature.getProperties() != null) {
                propertyNames.addAll(feature.getProperties().keySet());
            }
        }
        List<String> names = boundaries.names();
        return BoundarySourceInfo.builder()
                .source(boundaries.getSource())
                .format(SourceFormat.fromPath(boundaryFile).name())
                .featureCount(boundaries.getFeatures().size())
                .crs(boundaries.getCrs())
                .nameProperty(nameProperty)
                .minX(extent.getMinX())
                .minY(extent.getMinY())
                .maxX(extent.getMaxX())
                .maxY(extent.getMaxY())
                .propertyNames(new ArrayList<>(propertyNames))
                .geometryTypes(new ArrayList<>(geometryTypes))
                .sampleNames(new ArrayList<>(names.subList(0, Math.min(SAMPLE_NAMES, names.size()))))
                .build();
    }

    @Override
    public ReconciliationResult validateCoordinateSystems(Path boundaryFile, Path rasterFile) {
        BoundaryCollection boundaries = readerFactory.boundaryReader(boundaryFile)
                .read(boundaryFile, properties.getAnalysis().getNameProperty());
        try (RasterSource raster = readerFactory.rasterReader(rasterFile).open(rasterFile)) {
            return reconciler.reconcile(boundaries.getCrs(), raster.getCrs());
        } catch (IOException e) {
            throw new InvalidInputException("Failed to read raster " + rasterFile.getFileName(), e);
        }
    }

    @Override
    public int invalidate(String cityName, CalculationType type) {
        return cacheOrComputeService.invalidate(cityName, type);
    }

    @Override
    public int invalidateAllCoverage() {
        return cacheOrComputeService.invalidateAllCoverage();
    }

    @Override
    public CacheStats cacheStats() {
        return cacheOrComputeService.cacheStats();
    }

    @Override
    public List<String> cachedCities() {
        return cacheOrComputeService.cachedCities();
    }

    @Override
    public BatchRunSummary triggerBatchRun(String cityName) {
        return batchScheduler.triggerBatchRun(cityName);
    }

    @Override
    public SchedulerStatus schedulerStatus() {
        return batchScheduler.schedulerStatus();
    }

    private CityRecord registeredCity(String cityName) {
        return cityRegistry.findByName(cityName).orElseThrow(() -> new CityNotFoundException(cityName,
                cityRegistry.findAll().stream().map(CityRecord::getName).collect(Collectors.toList())));
    }

    private CoverageParameters defaultParameters(Integer year) {
        return CoverageParameters.defaults(properties.getAnalysis(), effectiveYear(year));
    }

    private int effectiveYear(Integer year) {
        return year != null ? year : Year.now(clock).getValue();
    }
}
