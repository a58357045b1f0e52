package com.greencover.geo;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Comparison of a boundary CRS with a raster CRS
 */
@Value
@Builder
public class ReconciliationResult {

    CrsCompatibility compatibility;

    /** Normalized identifiers, null where the source carried none */
    String boundaryCrs;
    String rasterCrs;

    /**
     * CRS the clipped pixels are measured in. The raster's when known, otherwise the boundary's.
     */
    String effectiveCrs;

    /**
     * Boundary coordinates must be reprojected before clipping
     */
    boolean transformRequired;

    String hint;

    @Singular
    List<String> warnings;

    @JsonIgnore
    public boolean isUsable() {
        return compatibility != CrsCompatibility.INCOMPATIBLE;
    }
}
