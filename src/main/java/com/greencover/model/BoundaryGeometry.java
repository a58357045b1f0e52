package com.greencover.model;

import lombok.Builder;
import lombok.Value;
import org.locationtech.jts.geom.Geometry;

import java.util.Map;

/**
 * One named boundary polygon or multipolygon with its coordinate reference
 */
@Value
@Builder
public class BoundaryGeometry {

    String name;

    Geometry geometry;

    /**
     * Identifier such as EPSG:4326, null when the source carries none
     */
    String crs;

    Map<String, Object> properties;
}
