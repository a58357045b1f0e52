package com.greencover.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized settings for analysis, caching, scheduling and data discovery.
 * Defaults match application.yml.
 */
@Data
@ConfigurationProperties(prefix = "greencover")
public class GreenCoverProperties {

    private Analysis analysis = new Analysis();
    private Cache cache = new Cache();
    private Scheduler scheduler = new Scheduler();
    private DataDirs data = new DataDirs();

    @Data
    public static class Analysis {
        private double ndviThreshold = 0.3;
        private int redBandIndex = 0;
        private int nirBandIndex = 1;
        private String nameProperty = "NAME";
        private int tileSize = 512;
        /** CRS assumed for rasters without georeferencing keys, e.g. EPSG:32633 */
        private String defaultRasterCrs;
        private boolean validateResults = true;
        private double minCoveragePercentage = 0.0;
        private double maxCoveragePercentage = 100.0;
    }

    @Data
    public static class Cache {
        /** memory or jdbc */
        private String store = "jdbc";
        private Duration satelliteTtl = Duration.ofHours(72);
        private Duration statsTtl = Duration.ofHours(12);
        private Duration defaultTtl = Duration.ofHours(24);
        private Map<String, Duration> customTtls = new HashMap<>();
        private int sweepEveryWrites = 100;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private String weeklyCron = "0 0 2 * * SUN";
        private String cleanupCron = "0 0 3 * * *";
        private String zone = "UTC";
        private int batchSize = 10;
        private int maxConcurrentAnalyses = 3;
        private Duration maxProcessingTime = Duration.ofHours(1);
        private Duration cityTimeout = Duration.ofMinutes(10);
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofMinutes(5);
        private Duration batchPause = Duration.ofSeconds(5);
    }

    @Data
    public static class DataDirs {
        private String satelliteDir = "/data/satellite";
        private String boundaryDir = "/data/shapefiles";
        private List<City> cities = new ArrayList<>();
    }

    @Data
    public static class City {
        private Long id;
        private String name;
    }
}
