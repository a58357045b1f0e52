package com.greencover.analysis;

import com.greencover.aspect.Timed;
import com.greencover.config.GreenCoverProperties;
import com.greencover.exception.ComputeTimeoutException;
import com.greencover.exception.InvalidInputException;
import com.greencover.exception.NoValidPixelsException;
import com.greencover.exception.SpatialMismatchException;
import com.greencover.geo.CoordinateReconciler;
import com.greencover.geo.CrsDefinition;
import com.greencover.geo.CrsRegistry;
import com.greencover.geo.PixelAreaCalculator;
import com.greencover.geo.ReconciliationResult;
import com.greencover.model.BoundaryCollection;
import com.greencover.model.BoundaryGeometry;
import com.greencover.model.CoverageParameters;
import com.greencover.model.result.CoverageResult;
import com.greencover.raster.PixelBlock;
import com.greencover.raster.RasterSource;
import com.greencover.raster.RasterTileIterator;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the share of vegetated pixels inside a city boundary.
 * <p>
 * NDVI = (NIR - Red) / (NIR + Red). A pixel is vegetated when its NDVI reaches the
 * threshold. Pixels outside the boundary, with a zero denominator, or carrying the
 * raster's no-data value in either band are excluded from every statistic.
 */
@Component
public class NdviCoverageAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(NdviCoverageAnalyzer.class);

    static final String DATA_SOURCE = "Satellite Imagery Analysis";

    private final CoordinateReconciler reconciler;
    private final GreenCoverProperties properties;

    public NdviCoverageAnalyzer(CoordinateReconciler reconciler, GreenCoverProperties properties) {
        this.reconciler = reconciler;
        this.properties = properties;
    }

    @Timed(value = "analysis.computeCoverage", logLevel = Timed.LogLevel.INFO)
    public CoverageResult computeCoverage(BoundaryCollection boundaries, RasterSource raster, String cityName,
                                          double ndviThreshold, int redBandIndex, int nirBandIndex, int year) {
        CoverageParameters parameters = CoverageParameters.builder()
                .ndviThreshold(ndviThreshold)
                .redBandIndex(redBandIndex)
                .nirBandIndex(nirBandIndex)
                .year(year)
                .nameProperty(boundaries.getNameProperty())
                .build();
        return computeCoverage(boundaries, raster, cityName, parameters, null);
    }

    @Timed(value = "analysis.computeCoverage", logLevel = Timed.LogLevel.INFO)
    public CoverageResult computeCoverage(BoundaryCollection boundaries, RasterSource raster, String cityName,
                                          CoverageParameters parameters) {
        return computeCoverage(boundaries, raster, cityName, parameters, null);
    }

    /**
     * @param timeout upper bound on the pixel loop, null for none; checked between tiles
     * @throws ComputeTimeoutException when the bound is exceeded or the thread is interrupted
     */
    @Timed(value = "analysis.computeCoverage", logLevel = Timed.LogLevel.INFO)
    public CoverageResult computeCoverage(BoundaryCollection boundaries, RasterSource raster, String cityName,
                                          CoverageParameters parameters, Duration timeout) {
        long started = System.nanoTime();
        parameters.validate();
        checkBand("Red", parameters.getRedBandIndex(), raster);
        checkBand("NIR", parameters.getNirBandIndex(), raster);

        BoundaryGeometry feature = CityFeatureMatcher.match(boundaries, cityName);
        String boundaryCrs = feature.getCrs() != null ? feature.getCrs() : boundaries.getCrs();
        ReconciliationResult reconciliation = reconciler.reconcile(boundaryCrs, raster.getCrs());
        if (!reconciliation.isUsable()) {
            throw new SpatialMismatchException("Boundary of " + feature.getName() + " (" + boundaryCrs
                    + ") cannot be aligned with raster " + raster.getDescription() + " (" + raster.getCrs() + ")",
                    reconciliation.getHint());
        }

        Geometry boundary = feature.getGeometry();
        if (!boundary.isValid()) {
            logger.debug("Repairing invalid boundary geometry of {}", feature.getName());
            boundary = boundary.buffer(0);
        }
        Geometry pixelBoundary = reconciler.toPixelSpace(boundary, reconciliation, raster.getGeoTransform());

        CrsDefinition crs = CrsRegistry.lookup(reconciliation.getEffectiveCrs()).orElse(null);
        PixelAreaCalculator areas = new PixelAreaCalculator(crs, raster.getGeoTransform());

        NdviStatistics stats = accumulate(raster, pixelBoundary, parameters, areas, started, timeout, cityName);
        if (stats.getCount() == 0) {
            throw new NoValidPixelsException("No valid pixels for " + feature.getName() + " in raster "
                    + raster.getDescription() + "; boundary and imagery may not overlap");
        }

        double coverage = stats.coveragePercentage();
        validateCoverage(cityName, coverage);

        List<String> warnings = new ArrayList<>(reconciliation.getWarnings());
        CoverageResult result = CoverageResult.builder()
                .cityName(feature.getName())
                .coveragePercentage(coverage)
                .totalPixels(stats.getCount())
                .vegetatedPixels(stats.getVegetatedCount())
                .totalAreaM2(stats.getTotalArea())
                .vegetatedAreaM2(stats.getVegetatedArea())
                .totalAreaKm2(stats.getTotalArea() / 1_000_000.0)
                .vegetatedAreaKm2(stats.getVegetatedArea() / 1_000_000.0)
                .meanNdvi(stats.getMean())
                .stdNdvi(stats.getStandardDeviation())
                .minNdvi(stats.getMin())
                .maxNdvi(stats.getMax())
                .ndviThreshold(parameters.getNdviThreshold())
                .coordinateSystem(reconciliation.getEffectiveCrs())
                .year(parameters.getYear())
                .measurementMethod("NDVI-based analysis (threshold: " + parameters.getNdviThreshold() + ")")
                .dataSource(DATA_SOURCE)
                .warnings(warnings)
                .build();

        logger.info("Green coverage for {}: {}% ({} of {} valid pixels)",
                feature.getName(), String.format("%.2f", coverage), stats.getVegetatedCount(), stats.getCount());
        return result;
    }

    private NdviStatistics accumulate(RasterSource raster, Geometry pixelBoundary, CoverageParameters parameters,
                                      PixelAreaCalculator areas, long started, Duration timeout, String cityName) {
        double threshold = parameters.getNdviThreshold();
        Double noData = raster.getNoDataValue();
        boolean singlePrecision = raster.isSinglePrecision();
        int tileSize = Math.max(1, properties.getAnalysis().getTileSize());

        NdviStatistics stats = new NdviStatistics();
        RasterTileIterator tiles = new RasterTileIterator(raster, pixelBoundary,
                parameters.getRedBandIndex(), parameters.getNirBandIndex(), tileSize);
        int tileCount = 0;
        while (true) {
            checkDeadline(started, timeout, cityName);
            if (!tiles.hasNext()) {
                break;
            }
            PixelBlock block = tiles.next();
            tileCount++;
            double[] red = block.getRed();
            double[] nir = block.getNir();
            for (int i = 0; i < block.size(); i++) {
                if (!block.isInside(i)) {
                    continue;
                }
                double r = red[i];
                double n = nir[i];
                if (noData != null && (isNoData(r, noData, singlePrecision) || isNoData(n, noData, singlePrecision))) {
                    continue;
                }
                double denominator = n + r;
                if (denominator == 0.0 || Double.isNaN(denominator)) {
                    continue;
                }
                double ndvi = (n - r) / denominator;
                if (Double.isNaN(ndvi)) {
                    continue;
                }
                ndvi = Math.max(-1.0, Math.min(1.0, ndvi));
                stats.accept(ndvi, ndvi >= threshold, areas.pixelArea(block.rowOf(i)));
            }
        }
        logger.debug("Processed {} tiles for {}", tileCount, cityName);
        return stats;
    }

    static boolean isNoData(double sample, double noData, boolean singlePrecision) {
        return singlePrecision ? (float) sample == (float) noData : sample == noData;
    }

    private static void checkDeadline(long started, Duration timeout, String cityName) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ComputeTimeoutException("Coverage analysis of " + cityName + " was interrupted");
        }
        if (timeout != null && System.nanoTime() - started >= timeout.toNanos()) {
            throw new ComputeTimeoutException("Coverage analysis of " + cityName + " exceeded " + timeout);
        }
    }

    private static void checkBand(String label, int index, RasterSource raster) {
        if (index >= raster.getBandCount()) {
            throw new IllegalArgumentException(label + " band index " + index + " out of range; raster "
                    + raster.getDescription() + " has " + raster.getBandCount() + " bands");
        }
    }

    private void validateCoverage(String cityName, double coverage) {
        GreenCoverProperties.Analysis analysis = properties.getAnalysis();
        if (!analysis.isValidateResults()) {
            return;
        }
        if (coverage < analysis.getMinCoveragePercentage() || coverage > analysis.getMaxCoveragePercentage()) {
            throw new InvalidInputException("Coverage " + coverage + "% for " + cityName + " is outside ["
                    + analysis.getMinCoveragePercentage() + ", " + analysis.getMaxCoveragePercentage() + "]");
        }
    }
}
