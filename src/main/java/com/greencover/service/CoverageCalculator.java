package com.greencover.service;

import com.greencover.analysis.NdviCoverageAnalyzer;
import com.greencover.exception.InvalidInputException;
import com.greencover.model.BoundaryCollection;
import com.greencover.model.CalculationRequest;
import com.greencover.model.CalculationType;
import com.greencover.model.CityRecord;
import com.greencover.model.CoverageParameters;
import com.greencover.model.result.CoverageResult;
import com.greencover.raster.RasterSource;
import com.greencover.repository.data.BoundaryReader;
import com.greencover.repository.data.RasterReader;
import com.greencover.repository.data.SourceReaderFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Builds satellite coverage calculations from files: the cache descriptor, keyed
 * on file contents and analysis parameters, and the analysis itself
 */
@Slf4j
@Component
public class CoverageCalculator {

    private final SourceReaderFactory readerFactory;
    private final NdviCoverageAnalyzer analyzer;
    private final FileFingerprint fingerprint;

    public CoverageCalculator(SourceReaderFactory readerFactory, NdviCoverageAnalyzer analyzer,
                              FileFingerprint fingerprint) {
        this.readerFactory = readerFactory;
        this.analyzer = analyzer;
        this.fingerprint = fingerprint;
    }

    public CalculationRequest satelliteRequest(CityRecord city, CoverageParameters parameters) {
        requireImagery(city);
        return satelliteRequest(city.getId(), city.getName(), city.getBoundaryPath(), city.getRasterPath(),
                parameters);
    }

    /**
     * @param cityId null for boundaries not bound to a registered city
     */
    public CalculationRequest satelliteRequest(Long cityId, String cityName, Path boundaryFile, Path rasterFile,
                                               CoverageParameters parameters) {
        // detect unsupported formats before hashing large files
        readerFactory.boundaryReader(boundaryFile);
        readerFactory.rasterReader(rasterFile);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("city", cityName.trim().toLowerCase(Locale.ROOT));
        params.put("boundary_sha256", fingerprint.sha256(boundaryFile));
        params.put("raster_sha256", fingerprint.sha256(rasterFile));
        params.put("ndvi_threshold", parameters.getNdviThreshold());
        params.put("red_band", parameters.getRedBandIndex());
        params.put("nir_band", parameters.getNirBandIndex());
        params.put("name_property", parameters.getNameProperty());
        params.put("year", parameters.getYear());
        return CalculationRequest.builder()
                .calculationType(CalculationType.SATELLITE)
                .cityId(cityId)
                .cityName(cityName.trim())
                .keyParams(params)
                .build();
    }

    public Supplier<CoverageResult> satelliteComputation(CityRecord city, CoverageParameters parameters,
                                                         Duration timeout) {
        requireImagery(city);
        return () -> analyze(city.getBoundaryPath(), city.getRasterPath(), city.getName(), parameters, timeout);
    }

    /**
     * Read both files and run the NDVI analysis
     *
     * @param timeout bound on the pixel loop, null for none
     */
    public CoverageResult analyze(Path boundaryFile, Path rasterFile, String cityName, CoverageParameters parameters,
                                  Duration timeout) {
        BoundaryReader boundaryReader = readerFactory.boundaryReader(boundaryFile);
        RasterReader rasterReader = readerFactory.rasterReader(rasterFile);
        parameters.validate();

        BoundaryCollection boundaries = boundaryReader.read(boundaryFile, parameters.getNameProperty());
        try (RasterSource raster = rasterReader.open(rasterFile)) {
            CoverageResult result = analyzer.computeCoverage(boundaries, raster, cityName, parameters, timeout);
            result.setDataSource(result.getDataSource() + " (" + rasterFile.getFileName() + ")");
            return result;
        } catch (IOException e) {
            throw new InvalidInputException("Failed to read raster " + rasterFile.getFileName() + ": "
                    + e.getMessage(), e);
        }
    }

    private static void requireImagery(CityRecord city) {
        if (!city.hasImagery()) {
            throw new InvalidInputException("No " + (city.getRasterPath() == null ? "satellite imagery" : "boundary")
                    + " file available for " + city.getName());
        }
    }
}
