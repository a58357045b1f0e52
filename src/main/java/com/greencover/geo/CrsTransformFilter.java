package com.greencover.geo;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;

/**
 * Reprojects every coordinate of a geometry from one registered CRS to another
 * through longitude/latitude. Apply to a copy; the filter edits in place.
 */
class CrsTransformFilter implements CoordinateSequenceFilter {

    private final CrsDefinition source;
    private final CrsDefinition target;

    CrsTransformFilter(CrsDefinition source, CrsDefinition target) {
        this.source = source;
        this.target = target;
    }

    @Override
    public void filter(CoordinateSequence seq, int i) {
        Coordinate c = new Coordinate(seq.getX(i), seq.getY(i));
        ProjectionMath.toGeographic(source, c);
        ProjectionMath.fromGeographic(target, c);
        seq.setOrdinate(i, CoordinateSequence.X, c.x);
        seq.setOrdinate(i, CoordinateSequence.Y, c.y);
    }

    @Override
    public boolean isDone() {
        return false;
    }

    @Override
    public boolean isGeometryChanged() {
        return true;
    }
}
