package com.greencover.service;

import com.greencover.geo.ReconciliationResult;
import com.greencover.model.CalculationType;
import com.greencover.model.CoverageParameters;
import com.greencover.model.result.BatchRunSummary;
import com.greencover.model.result.BoundarySourceInfo;
import com.greencover.model.result.CacheStats;
import com.greencover.model.result.CoverageComparison;
import com.greencover.model.result.CoverageResult;
import com.greencover.model.result.CoverageStatistics;
import com.greencover.model.result.SchedulerStatus;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point of the green coverage engine
 */
public interface GreenCoverageService {

    /**
     * Analyze a boundary file and a raster file directly, bypassing the cache
     */
    CoverageResult computeCoverage(Path boundaryFile, Path rasterFile, String cityName,
                                   CoverageParameters parameters);

    /**
     * Cached analysis of a boundary file and a raster file, keyed on their contents
     */
    CoverageResult coverage(Path boundaryFile, Path rasterFile, String cityName, CoverageParameters parameters);

    /**
     * Cached analysis of a registered city with the default parameters
     *
     * @param year imagery year, null for the current year
     */
    CoverageResult cityCoverage(String cityName, Integer year);

    /**
     * Aggregate coverage of several registered cities
     */
    CoverageStatistics coverageStatistics(List<String> cityNames, Integer year);

    /**
     * Compare two registered cities
     */
    CoverageComparison compareCoverage(String firstCity, String secondCity, Integer year);

    BoundarySourceInfo describeBoundaries(Path boundaryFile);

    /**
     * Check whether a boundary file and a raster file can be analyzed together
     */
    ReconciliationResult validateCoordinateSystems(Path boundaryFile, Path rasterFile);

    /**
     * Drop cached entries of a city
     *
     * @param type null for all types
     * @return number of entries removed
     */
    int invalidate(String cityName, CalculationType type);

    /**
     * Drop every cached coverage and statistics entry, so the next request for
     * any city recomputes from the current data files
     */
    int invalidateAllCoverage();

    CacheStats cacheStats();

    List<String> cachedCities();

    /**
     * Start a recomputation run now, over all cities or one city
     */
    BatchRunSummary triggerBatchRun(String cityName);

    SchedulerStatus schedulerStatus();
}
