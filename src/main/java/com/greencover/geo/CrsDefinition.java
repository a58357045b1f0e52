package com.greencover.geo;

import lombok.Builder;
import lombok.Value;

/**
 * Coordinate reference system known to the engine. Geographic systems use
 * longitude/latitude axis order (x = longitude) as GeoJSON and GeoTIFF do.
 */
@Value
@Builder
public class CrsDefinition {

    public enum Kind {
        GEOGRAPHIC,
        PROJECTED
    }

    public enum Projection {
        NONE,
        WEB_MERCATOR,
        TRANSVERSE_MERCATOR,
        /** Registered for identification only; no transform is implemented */
        UNSUPPORTED
    }

    String id;
    int code;
    String name;
    Kind kind;
    Projection projection;

    /**
     * Datum family; systems of different families are never transformed into one another
     */
    String datum;

    String unit;
    double unitToMetre;

    double semiMajorAxis;
    double inverseFlattening;

    double centralMeridian;
    double latitudeOfOrigin;
    double scaleFactor;
    double falseEasting;
    double falseNorthing;

    public boolean isGeographic() {
        return kind == Kind.GEOGRAPHIC;
    }

    public boolean isTransformable() {
        return projection != Projection.UNSUPPORTED;
    }
}
