package com.greencover.raster;

import com.greencover.geo.GeoTransform;

import java.awt.Rectangle;
import java.io.Closeable;
import java.io.IOException;

/**
 * Multi-band raster read by region so large images never need to be held in memory whole
 */
public interface RasterSource extends Closeable {

    int getWidth();

    int getHeight();

    int getBandCount();

    /**
     * Coordinate reference identifier, null when the raster carries none
     */
    String getCrs();

    GeoTransform getGeoTransform();

    /**
     * No-data sample value, null when undefined
     */
    Double getNoDataValue();

    /**
     * True when samples are stored as 32-bit floats, so a no-data value must be
     * compared at float precision
     */
    default boolean isSinglePrecision() {
        return false;
    }

    /**
     * Human-readable origin, such as the file name
     */
    String getDescription();

    /**
     * Read samples of the given bands in {@code region}, row-major.
     * Result index {@code [i][row * region.width + col]} holds band {@code bands[i]}.
     */
    double[][] readBands(Rectangle region, int... bands) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
