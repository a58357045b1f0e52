package com.greencover.repository.data;

import com.greencover.config.GreenCoverConfiguration;
import com.greencover.exception.ErrorKind;
import com.greencover.exception.UnsupportedFormatException;
import com.greencover.repository.data.impl.GeoJsonBoundaryReader;
import com.greencover.repository.data.impl.GeoTiffRasterReader;
import com.greencover.support.TestFixtures;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.GeometryFactory;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceReaderFactoryTest {

    private final SourceReaderFactory factory = new SourceReaderFactory(
            List.of(new GeoJsonBoundaryReader(GreenCoverConfiguration.createObjectMapper(), new GeometryFactory())),
            List.of(new GeoTiffRasterReader(TestFixtures.properties())));

    @Test
    void testDetectsFormatsByExtension() {
        assertEquals(SourceFormat.GEOJSON, SourceFormat.fromPath(Path.of("a/b/cities.GeoJSON")));
        assertEquals(SourceFormat.GEOTIFF, SourceFormat.fromPath(Path.of("scene.TIFF")));
        assertEquals(SourceFormat.SHAPEFILE, SourceFormat.fromPath(Path.of("regions.shp")));
        assertEquals(SourceFormat.JPEG2000, SourceFormat.fromPath(Path.of("scene.jp2")));
    }

    @Test
    void testSupportedFormatsGetReaders() {
        assertInstanceOf(GeoJsonBoundaryReader.class, factory.boundaryReader(Path.of("cities.json")));
        assertInstanceOf(GeoTiffRasterReader.class, factory.rasterReader(Path.of("scene.tif")));
        assertTrue(factory.isSupported(Path.of("scene.tiff")));
        assertFalse(factory.isSupported(Path.of("regions.shp")));
        assertFalse(factory.isSupported(Path.of("notes.txt")));
    }

    @Test
    void testUnknownExtensionIsUnsupported() {
        UnsupportedFormatException e = assertThrows(UnsupportedFormatException.class,
                () -> factory.boundaryReader(Path.of("cities.kml")));
        assertEquals(ErrorKind.UNSUPPORTED_FORMAT, e.getKind());
    }

    @Test
    void testRecognizedButUnreadableFormatIsUnsupported() {
        assertThrows(UnsupportedFormatException.class, () -> factory.boundaryReader(Path.of("regions.shp")));
        assertThrows(UnsupportedFormatException.class, () -> factory.rasterReader(Path.of("scene.img")));
    }

    @Test
    void testWrongCategoryIsUnsupported() {
        assertThrows(UnsupportedFormatException.class, () -> factory.rasterReader(Path.of("cities.geojson")));
        assertThrows(UnsupportedFormatException.class, () -> factory.boundaryReader(Path.of("scene.tif")));
    }
}
