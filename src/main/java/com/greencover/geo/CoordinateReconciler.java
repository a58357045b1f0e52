package com.greencover.geo;

import com.greencover.exception.SpatialMismatchException;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Checks that a boundary and a raster share a coordinate reference system and
 * brings boundary geometry into the raster's pixel space for clipping.
 * Inputs are never mutated; every transform works on a copy.
 */
@Component
public class CoordinateReconciler {

    private static final Logger logger = LoggerFactory.getLogger(CoordinateReconciler.class);

    /**
     * Compare the boundary CRS with the raster CRS.
     * <ul>
     *   <li>identical identifiers: {@link CrsCompatibility#COMPATIBLE}</li>
     *   <li>one side missing: assumed equal to the other, {@link CrsCompatibility#REPROJECTION_RECOMMENDED}</li>
     *   <li>registered systems with a transform between them: {@link CrsCompatibility#REPROJECTION_RECOMMENDED}</li>
     *   <li>anything else: {@link CrsCompatibility#INCOMPATIBLE}</li>
     * </ul>
     */
    public ReconciliationResult reconcile(String boundaryCrs, String rasterCrs) {
        String boundaryId = CrsRegistry.normalize(boundaryCrs);
        String rasterId = CrsRegistry.normalize(rasterCrs);
        ReconciliationResult.ReconciliationResultBuilder result = ReconciliationResult.builder()
                .boundaryCrs(boundaryId)
                .rasterCrs(rasterId);

        if (boundaryId == null || rasterId == null) {
            String known = boundaryId != null ? boundaryId : rasterId;
            String missingSide = boundaryId == null ? "boundary" : "raster";
            String warning = known == null
                    ? "Neither boundary nor raster declares a coordinate system; assuming they match"
                    : "The " + missingSide + " declares no coordinate system; assuming " + known;
            logger.warn(warning);
            return result.compatibility(CrsCompatibility.REPROJECTION_RECOMMENDED)
                    .effectiveCrs(known)
                    .transformRequired(false)
                    .hint("Declare the " + missingSide + " coordinate system explicitly")
                    .warning(warning)
                    .build();
        }

        if (boundaryId.equals(rasterId)) {
            return result.compatibility(CrsCompatibility.COMPATIBLE)
                    .effectiveCrs(rasterId)
                    .transformRequired(false)
                    .build();
        }

        Optional<CrsDefinition> boundaryDef = CrsRegistry.lookup(boundaryId);
        Optional<CrsDefinition> rasterDef = CrsRegistry.lookup(rasterId);
        String reprojectHint = "Reproject the boundary to " + rasterId + " before analysis";

        if (boundaryDef.isEmpty() || rasterDef.isEmpty()) {
            String unknown = boundaryDef.isEmpty() ? boundaryId : rasterId;
            return result.compatibility(CrsCompatibility.INCOMPATIBLE)
                    .effectiveCrs(rasterId)
                    .hint("Unknown coordinate system " + unknown + ". " + reprojectHint)
                    .build();
        }

        CrsDefinition from = boundaryDef.get();
        CrsDefinition to = rasterDef.get();
        if (!from.isTransformable() || !to.isTransformable()
                || !Objects.equals(from.getDatum(), to.getDatum())) {
            return result.compatibility(CrsCompatibility.INCOMPATIBLE)
                    .effectiveCrs(rasterId)
                    .hint("No transform from " + from.getName() + " to " + to.getName() + ". " + reprojectHint)
                    .build();
        }

        String warning;
        if (from.isGeographic() && to.isGeographic()) {
            warning = "Boundary and raster use different geographic systems (" + from.getName()
                    + ", " + to.getName() + "); datum offsets of up to a few metres are ignored";
        } else if (!from.isGeographic() && !to.isGeographic() && !Objects.equals(from.getUnit(), to.getUnit())) {
            warning = "Boundary and raster use projected systems with different units ("
                    + from.getUnit() + ", " + to.getUnit() + ")";
        } else {
            warning = "Boundary in " + from.getName() + " was reprojected to " + to.getName();
        }
        logger.warn("{}; {}", warning, reprojectHint);
        return result.compatibility(CrsCompatibility.REPROJECTION_RECOMMENDED)
                .effectiveCrs(rasterId)
                .transformRequired(true)
                .hint(reprojectHint)
                .warning(warning)
                .build();
    }

    /**
     * Express a boundary geometry in the raster's map coordinates
     *
     * @throws SpatialMismatchException when the systems are incompatible
     */
    public Geometry toRasterCrs(Geometry geometry, ReconciliationResult reconciliation) {
        if (!reconciliation.isUsable()) {
            throw new SpatialMismatchException(
                    "Boundary CRS " + reconciliation.getBoundaryCrs() + " is incompatible with raster CRS "
                            + reconciliation.getRasterCrs(),
                    reconciliation.getHint());
        }
        Geometry copy = geometry.copy();
        if (reconciliation.isTransformRequired()) {
            CrsDefinition from = CrsRegistry.lookup(reconciliation.getBoundaryCrs()).orElseThrow();
            CrsDefinition to = CrsRegistry.lookup(reconciliation.getRasterCrs()).orElseThrow();
            copy.apply(new CrsTransformFilter(from, to));
            copy.geometryChanged();
        }
        return copy;
    }

    /**
     * Express a boundary geometry in the raster's pixel space, where pixel (col, row)
     * covers [col, col + 1) x [row, row + 1)
     */
    public Geometry toPixelSpace(Geometry geometry, ReconciliationResult reconciliation, GeoTransform transform) {
        Geometry mapGeometry = toRasterCrs(geometry, reconciliation);
        return transform.toPixelTransformation().transform(mapGeometry);
    }
}
