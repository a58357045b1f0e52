package com.greencover.raster;

import com.greencover.exception.InvalidInputException;
import com.greencover.geo.GeoTransform;
import com.greencover.support.GeoFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import javax.imageio.plugins.tiff.TIFFTagSet;
import java.awt.Rectangle;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeoTiffRasterSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void testReadsWorldFileAndBands() throws IOException {
        // Given
        Path tiff = GeoFiles.writeImagery(tempDir.resolve("berlin.tif"), 4, 3, 2);

        // When
        try (GeoTiffRasterSource raster = GeoTiffRasterSource.open(tiff, "EPSG:32633")) {
            double[][] bands = raster.readBands(new Rectangle(0, 0, 4, 3), 0, 1);
            double[][] region = raster.readBands(new Rectangle(1, 1, 2, 2), 1);

            // Then
            assertEquals(4, raster.getWidth());
            assertEquals(3, raster.getHeight());
            assertEquals(3, raster.getBandCount());
            assertEquals("EPSG:32633", raster.getCrs());
            assertNull(raster.getNoDataValue());
            assertEquals("berlin.tif", raster.getDescription());

            GeoTransform transform = raster.getGeoTransform();
            assertEquals(0.0, transform.getOriginX(), 1e-9);
            assertEquals(3.0, transform.getOriginY(), 1e-9);
            assertEquals(1.0, transform.getPixelWidth(), 1e-9);
            assertEquals(-1.0, transform.getPixelHeight(), 1e-9);

            assertEquals(12, bands[0].length);
            assertEquals(50.0, bands[0][0]);
            assertEquals(150.0, bands[1][1]);
            assertEquals(100.0, bands[0][2]);
            assertEquals(4, region[0].length);
            assertEquals(100.0, region[0][0]);
        }
    }

    @Test
    void testRasterWithoutGeoreferencingIsRejected() throws IOException {
        // Given
        Path tiff = GeoFiles.writeImagery(tempDir.resolve("plain.tif"), 2, 2, 0);
        Files.delete(tempDir.resolve("plain.tfw"));

        // When / Then
        assertThrows(InvalidInputException.class, () -> GeoTiffRasterSource.open(tiff, null));
    }

    @Test
    void testMissingFileIsRejected() {
        assertThrows(InvalidInputException.class,
                () -> GeoTiffRasterSource.open(tempDir.resolve("missing.tif"), null));
    }

    @Test
    void testMalformedWorldFileIsRejected() throws IOException {
        // Given
        Path image = tempDir.resolve("broken.tif");
        Files.write(tempDir.resolve("broken.tfw"), List.of("1.0", "0.0", "zero", "-1.0", "0.5", "9.5"));

        // When / Then
        assertThrows(InvalidInputException.class, () -> GeoTiffRasterSource.readWorldFile(image));
    }

    @Test
    void testWorldFileGivesCornerOrigin() throws IOException {
        // Given - world files reference the centre of the upper-left pixel
        Path image = tempDir.resolve("scene.tif");
        Files.write(tempDir.resolve("scene.TFW"), List.of("30", "0", "0", "-30", "500015", "5800015"));

        // When
        GeoTransform transform = GeoTiffRasterSource.readWorldFile(image);

        // Then
        assertNotNull(transform);
        assertEquals(500000.0, transform.getOriginX(), 1e-9);
        assertEquals(5800030.0, transform.getOriginY(), 1e-9);
        assertEquals(-30.0, transform.getPixelHeight(), 1e-9);
    }

    @Test
    void testCrsFromGeoKeys() {
        // Given - header, then (key, location, count, value) entries
        int[] projected = {1, 1, 0, 2, 1024, 0, 1, 1, 3072, 0, 1, 32633};
        int[] geographic = {1, 1, 0, 2, 1024, 0, 1, 2, 2048, 0, 1, 4326};
        int[] userDefined = {1, 1, 0, 1, 3072, 0, 1, 32767};

        // Then
        assertEquals("EPSG:32633", GeoTiffRasterSource.crsFromGeoKeys(projected));
        assertEquals("EPSG:4326", GeoTiffRasterSource.crsFromGeoKeys(geographic));
        assertNull(GeoTiffRasterSource.crsFromGeoKeys(userDefined));
        assertNull(GeoTiffRasterSource.crsFromGeoKeys(new int[0]));
    }

    private static final int[] PIXEL_IS_AREA = {1, 1, 0, 1, 1025, 0, 1, 1};
    private static final int[] PIXEL_IS_POINT = {1, 1, 0, 1, 1025, 0, 1, 2};

    private static TIFFDirectory directory(int tag, double... values) {
        TIFFDirectory directory = new TIFFDirectory(new TIFFTagSet[]{BaselineTIFFTagSet.getInstance()}, null);
        addDoubles(directory, tag, values);
        return directory;
    }

    private static void addDoubles(TIFFDirectory directory, int tag, double... values) {
        TIFFTag tiffTag = new TIFFTag("tag" + tag, tag, 1 << TIFFTag.TIFF_DOUBLE);
        directory.addTIFFField(new TIFFField(tiffTag, TIFFTag.TIFF_DOUBLE, values.length, values));
    }

    @Test
    void testTiepointAndPixelScaleGiveGeoTransform() {
        // Given - raster point (10, 20) tied to (500300, 5799400), 30 m pixels
        TIFFDirectory tags = directory(GeoTiffRasterSource.TAG_MODEL_PIXEL_SCALE, 30, 30, 0);
        addDoubles(tags, GeoTiffRasterSource.TAG_MODEL_TIEPOINT, 10, 20, 0, 500300, 5799400, 0);

        // When
        GeoTransform transform = GeoTiffRasterSource.geoTransformFromTags(tags, PIXEL_IS_AREA);

        // Then
        assertEquals(GeoTransform.northUp(500000, 5800000, 30, 30), transform);
    }

    @Test
    void testPixelIsPointShiftsOriginByHalfPixel() {
        // Given
        TIFFDirectory tags = directory(GeoTiffRasterSource.TAG_MODEL_PIXEL_SCALE, 30, 30, 0);
        addDoubles(tags, GeoTiffRasterSource.TAG_MODEL_TIEPOINT, 0, 0, 0, 500000, 5800000, 0);

        // When
        GeoTransform transform = GeoTiffRasterSource.geoTransformFromTags(tags, PIXEL_IS_POINT);

        // Then
        assertEquals(GeoTransform.northUp(499985, 5800015, 30, 30), transform);
    }

    @Test
    void testModelTransformationTakesPrecedence() {
        // Given
        TIFFDirectory tags = directory(GeoTiffRasterSource.TAG_MODEL_TRANSFORMATION,
                10, 0, 0, 400000,
                0, -10, 0, 5000000,
                0, 0, 0, 0,
                0, 0, 0, 1);
        addDoubles(tags, GeoTiffRasterSource.TAG_MODEL_PIXEL_SCALE, 30, 30, 0);
        addDoubles(tags, GeoTiffRasterSource.TAG_MODEL_TIEPOINT, 0, 0, 0, 500000, 5800000, 0);

        // When
        GeoTransform transform = GeoTiffRasterSource.geoTransformFromTags(tags, new int[0]);

        // Then
        assertEquals(GeoTransform.northUp(400000, 5000000, 10, 10), transform);
        assertNull(GeoTiffRasterSource.geoTransformFromTags(
                directory(GeoTiffRasterSource.TAG_MODEL_PIXEL_SCALE, 30, 30, 0), new int[0]));
    }
}
