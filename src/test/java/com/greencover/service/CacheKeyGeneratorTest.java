package com.greencover.service;

import com.greencover.config.GreenCoverConfiguration;
import com.greencover.model.CalculationType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyGeneratorTest {

    private final CacheKeyGenerator generator = new CacheKeyGenerator(GreenCoverConfiguration.createObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    void testKeyIgnoresParameterOrder() {
        // Given
        Map<String, Object> forward = new LinkedHashMap<>();
        forward.put("city", "berlin");
        forward.put("ndvi_threshold", 0.3);
        forward.put("year", 2024);
        Map<String, Object> backward = new LinkedHashMap<>();
        backward.put("year", 2024);
        backward.put("ndvi_threshold", 0.3);
        backward.put("city", "berlin");

        // When
        String first = generator.generate(CalculationType.SATELLITE, forward);
        String second = generator.generate(CalculationType.SATELLITE, backward);

        // Then
        assertEquals(first, second);
        assertEquals(64, first.length());
        assertTrue(first.matches("[0-9a-f]{64}"));
    }

    @Test
    void testNumericRepresentationDoesNotChangeKey() {
        assertEquals(
                generator.generate(CalculationType.SATELLITE, Map.of("ndvi_threshold", 0.30)),
                generator.generate(CalculationType.SATELLITE, Map.of("ndvi_threshold", 0.3)));
        assertEquals(
                generator.generate(CalculationType.SATELLITE, Map.of("year", 2024)),
                generator.generate(CalculationType.SATELLITE, Map.of("year", 2024L)));
        assertEquals(
                generator.generate(CalculationType.SATELLITE, Map.of("year", 2024.0)),
                generator.generate(CalculationType.SATELLITE, Map.of("year", 2024)));
        assertEquals(Map.of("n", "0"), CacheKeyGenerator.normalize(-0.0));
    }

    @Test
    void testAnyDifferenceChangesKey() {
        // Given
        Map<String, Object> base = Map.of("city", "berlin", "ndvi_threshold", 0.3);

        // When
        String key = generator.generate(CalculationType.SATELLITE, base);

        // Then
        assertNotEquals(key, generator.generate(CalculationType.SATELLITE,
                Map.of("city", "berlin", "ndvi_threshold", 0.31)));
        assertNotEquals(key, generator.generate(CalculationType.SATELLITE,
                Map.of("city", "paris", "ndvi_threshold", 0.3)));
        assertNotEquals(key, generator.generate(CalculationType.STATS, base));
        assertNotEquals(key, generator.generate(CalculationType.custom("ranking"), base));
        assertNotEquals(generator.generate(CalculationType.SATELLITE, Map.of("year", 2024)),
                generator.generate(CalculationType.SATELLITE, Map.of("year", "2024")));
        assertNotEquals(generator.generate(CalculationType.SATELLITE, Map.of("flag", true)),
                generator.generate(CalculationType.SATELLITE, Map.of("flag", "true")));
    }

    @Test
    void testParameterNamedLikeTypeDoesNotShadowType() {
        // When
        String plain = generator.generate(CalculationType.custom("report"), Map.of());
        String shadowing = generator.generate(CalculationType.custom("report"),
                Map.of("calculation_type", "other"));
        String spoofed = generator.generate(CalculationType.custom("other"), Map.of());

        // Then
        assertNotEquals(plain, shadowing);
        assertNotEquals(spoofed, shadowing);
    }

    @Test
    void testNestedStructuresAreCanonical() {
        // Given
        Map<String, Object> nestedForward = new LinkedHashMap<>();
        nestedForward.put("b", 1);
        nestedForward.put("a", 2);

        // When
        String first = generator.generate(CalculationType.STORED, Map.of("cities", List.of("x", "y"),
                "options", nestedForward));
        String second = generator.generate(CalculationType.STORED, Map.of("options", Map.of("a", 2, "b", 1),
                "cities", List.of("x", "y")));

        // Then
        assertEquals(first, second);
        assertNotEquals(first, generator.generate(CalculationType.STORED, Map.of("cities", List.of("y", "x"),
                "options", nestedForward)));
    }

    @Test
    void testFileFingerprintFollowsContent() throws IOException {
        // Given
        FileFingerprint fingerprint = new FileFingerprint();
        Path first = tempDir.resolve("a.tif");
        Path copy = tempDir.resolve("b.tif");
        Files.writeString(first, "raster bytes");
        Files.writeString(copy, "raster bytes");

        // When
        String before = fingerprint.sha256(first);
        String sameContent = fingerprint.sha256(copy);
        Files.writeString(first, "raster bytes, edited");
        String after = fingerprint.sha256(first);

        // Then
        assertEquals(before, sameContent);
        assertNotEquals(before, after);
        assertEquals(64, fingerprint.sha256(tempDir.resolve("missing.tif")).length());
    }
}
