package com.greencover.repository.data.impl;

import com.greencover.config.GreenCoverProperties;
import com.greencover.model.CityRecord;
import com.greencover.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemCityRegistryTest {

    @TempDir
    Path tempDir;

    private Path satellite;
    private Path boundaries;
    private GreenCoverProperties properties;
    private FileSystemCityRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        satellite = Files.createDirectories(tempDir.resolve("satellite"));
        boundaries = Files.createDirectories(tempDir.resolve("boundaries"));
        properties = TestFixtures.properties();
        properties.getData().setSatelliteDir(satellite.toString());
        properties.getData().setBoundaryDir(boundaries.toString());
        properties.getData().getCities().add(city(1L, "New York"));
        properties.getData().getCities().add(city(2L, "Los Angeles"));
        registry = new FileSystemCityRegistry(properties);
    }

    private static GreenCoverProperties.City city(Long id, String name) {
        GreenCoverProperties.City city = new GreenCoverProperties.City();
        city.setId(id);
        city.setName(name);
        return city;
    }

    @Test
    void testResolvesFilesNamedAfterCity() throws IOException {
        // Given
        Files.createFile(satellite.resolve("new_york_2024.tif"));
        Files.createFile(satellite.resolve("los-angeles.tiff"));
        Files.createFile(boundaries.resolve("new_york.shp"));
        Files.createFile(boundaries.resolve("new_york.geojson"));
        Files.createFile(boundaries.resolve("los angeles.json"));

        // When
        List<CityRecord> cities = registry.findAll();

        // Then
        assertEquals(2, cities.size());
        CityRecord newYork = cities.get(0);
        assertEquals(1L, newYork.getId());
        assertEquals("new_york_2024.tif", newYork.getRasterPath().getFileName().toString());
        assertEquals("new_york.geojson", newYork.getBoundaryPath().getFileName().toString());
        CityRecord losAngeles = cities.get(1);
        assertEquals("los-angeles.tiff", losAngeles.getRasterPath().getFileName().toString());
        assertEquals("los angeles.json", losAngeles.getBoundaryPath().getFileName().toString());
        assertEquals(2, registry.findAvailable().size());
    }

    @Test
    void testFallsBackToRegionalFile() throws IOException {
        // Given
        Files.createFile(satellite.resolve("california_mosaic.tif"));
        Files.createFile(boundaries.resolve("us_places.geojson"));

        // When
        CityRecord losAngeles = registry.findByName("los angeles").orElseThrow();

        // Then
        assertEquals("california_mosaic.tif", losAngeles.getRasterPath().getFileName().toString());
        assertEquals("us_places.geojson", losAngeles.getBoundaryPath().getFileName().toString());
    }

    @Test
    void testCityWithoutFilesHasNoImagery() {
        // When
        List<CityRecord> cities = registry.findAll();

        // Then
        assertEquals(2, cities.size());
        assertFalse(cities.get(0).hasImagery());
        assertTrue(registry.findAvailable().isEmpty());
        assertTrue(registry.findByName("Atlantis").isEmpty());
    }

    @Test
    void testMissingDirectoriesAreTolerated() {
        // Given
        properties.getData().setSatelliteDir(tempDir.resolve("nowhere").toString());

        // When
        List<CityRecord> cities = registry.findAll();

        // Then
        assertEquals(2, cities.size());
        assertNull(cities.get(0).getRasterPath());
    }
}
