package com.greencover.support;

import com.greencover.config.GreenCoverProperties;
import com.greencover.geo.GeoTransform;
import com.greencover.model.BoundaryCollection;
import com.greencover.model.BoundaryGeometry;
import com.greencover.raster.ArrayRasterSource;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.Arrays;
import java.util.Map;

/**
 * Shared builders for boundaries and rasters used across tests
 */
public final class TestFixtures {

    public static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    public static final String UTM_33N = "EPSG:32633";

    private TestFixtures() {
    }

    public static Geometry rectangle(double minX, double minY, double maxX, double maxY) {
        return GEOMETRY_FACTORY.toGeometry(new Envelope(minX, maxX, minY, maxY));
    }

    public static BoundaryGeometry feature(String name, Geometry geometry, String crs) {
        return BoundaryGeometry.builder()
                .name(name)
                .geometry(geometry)
                .crs(crs)
                .properties(Map.of("NAME", name))
                .build();
    }

    public static BoundaryCollection boundaries(String crs, BoundaryGeometry... features) {
        return BoundaryCollection.builder()
                .source("test.geojson")
                .crs(crs)
                .nameProperty("NAME")
                .features(Arrays.asList(features))
                .build();
    }

    /**
     * Two-band raster (red, nir) whose pixels have exactly the given NDVI values,
     * with 1 m square pixels and its upper-left corner at (0, height)
     */
    public static ArrayRasterSource ndviRaster(int width, int height, double[] ndvi, String crs) {
        double[] red = new double[ndvi.length];
        double[] nir = new double[ndvi.length];
        for (int i = 0; i < ndvi.length; i++) {
            red[i] = 1.0 - ndvi[i];
            nir[i] = 1.0 + ndvi[i];
        }
        return new ArrayRasterSource(width, height, new double[][]{red, nir},
                GeoTransform.northUp(0, height, 1, 1), crs, null);
    }

    /**
     * NDVI grid where the first {@code vegetated} pixels are 0.6 and the rest 0.1
     */
    public static double[] ndviValues(int size, int vegetated) {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = i < vegetated ? 0.6 : 0.1;
        }
        return values;
    }

    public static GreenCoverProperties properties() {
        GreenCoverProperties properties = new GreenCoverProperties();
        properties.getScheduler().setBatchPause(java.time.Duration.ZERO);
        properties.getScheduler().setRetryDelay(java.time.Duration.ZERO);
        return properties;
    }
}
