package com.greencover.geo;

/**
 * Outcome of comparing a boundary CRS with a raster CRS
 */
public enum CrsCompatibility {
    /** Identical identifiers */
    COMPATIBLE,
    /** Analysis can proceed through a coordinate transform, with a warning */
    REPROJECTION_RECOMMENDED,
    /** No transform is available; the inputs must be reprojected beforehand */
    INCOMPATIBLE
}
