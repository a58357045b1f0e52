package com.greencover.geo;

/**
 * Ground area of raster pixels in square metres. Projected systems use the
 * geotransform determinant; geographic systems use a per-row spherical
 * approximation at the row's centre latitude.
 */
public class PixelAreaCalculator {

    /** Mean Earth radius (IUGG) */
    static final double EARTH_RADIUS_M = 6371008.8;

    private final GeoTransform transform;
    private final boolean geographic;
    private final double projectedArea;

    /**
     * @param crs CRS of the raster grid, null when unknown (units assumed to be metres)
     */
    public PixelAreaCalculator(CrsDefinition crs, GeoTransform transform) {
        this.transform = transform;
        this.geographic = crs != null && crs.isGeographic();
        double unit = crs == null || Double.isNaN(crs.getUnitToMetre()) ? 1.0 : crs.getUnitToMetre();
        this.projectedArea = Math.abs(transform.determinant()) * unit * unit;
    }

    /**
     * Area of one pixel in the given row, in square metres
     */
    public double pixelArea(int row) {
        if (!geographic) {
            return projectedArea;
        }
        double latitude = transform.mapY(0.5, row + 0.5);
        double metresPerDegree = Math.PI / 180.0 * EARTH_RADIUS_M;
        double width = Math.abs(transform.getPixelWidth()) * metresPerDegree * Math.cos(Math.toRadians(latitude));
        double height = Math.abs(transform.getPixelHeight()) * metresPerDegree;
        return Math.abs(width * height);
    }
}
