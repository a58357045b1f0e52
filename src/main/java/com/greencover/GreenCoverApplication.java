package com.greencover;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Green coverage engine - NDVI coverage analysis, result caching and
 * scheduled recomputation across cities
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class GreenCoverApplication {

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        SpringApplication.run(GreenCoverApplication.class, args);
    }
}
