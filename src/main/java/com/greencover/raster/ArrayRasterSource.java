package com.greencover.raster;

import com.greencover.geo.GeoTransform;

import java.awt.Rectangle;

/**
 * Raster held in memory as one row-major sample array per band
 */
public class ArrayRasterSource implements RasterSource {

    private final int width;
    private final int height;
    private final double[][] bands;
    private final GeoTransform geoTransform;
    private final String crs;
    private final Double noDataValue;
    private final String description;

    public ArrayRasterSource(int width, int height, double[][] bands, GeoTransform geoTransform,
                             String crs, Double noDataValue) {
        this(width, height, bands, geoTransform, crs, noDataValue, "in-memory raster");
    }

    public ArrayRasterSource(int width, int height, double[][] bands, GeoTransform geoTransform,
                             String crs, Double noDataValue, String description) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive");
        }
        for (double[] band : bands) {
            if (band.length != width * height) {
                throw new IllegalArgumentException("Band length " + band.length + " does not match "
                        + width + "x" + height);
            }
        }
        this.width = width;
        this.height = height;
        this.bands = bands;
        this.geoTransform = geoTransform;
        this.crs = crs;
        this.noDataValue = noDataValue;
        this.description = description;
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public int getBandCount() {
        return bands.length;
    }

    @Override
    public String getCrs() {
        return crs;
    }

    @Override
    public GeoTransform getGeoTransform() {
        return geoTransform;
    }

    @Override
    public Double getNoDataValue() {
        return noDataValue;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public double[][] readBands(Rectangle region, int... bandIndexes) {
        double[][] result = new double[bandIndexes.length][region.width * region.height];
        for (int i = 0; i < bandIndexes.length; i++) {
            double[] source = bands[bandIndexes[i]];
            for (int row = 0; row < region.height; row++) {
                System.arraycopy(source, (region.y + row) * width + region.x,
                        result[i], row * region.width, region.width);
            }
        }
        return result;
    }
}
