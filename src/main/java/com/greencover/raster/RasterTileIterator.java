package com.greencover.raster;

import com.greencover.exception.InvalidInputException;
import org.locationtech.jts.algorithm.locate.IndexedPointInAreaLocator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Location;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

import java.awt.Rectangle;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy, single-pass sequence of the raster tiles that overlap a boundary given
 * in pixel space. Tiles outside the boundary are never read; a pixel belongs to
 * the boundary when its centre does.
 */
public class RasterTileIterator implements Iterator<PixelBlock> {

    private final RasterSource raster;
    private final int redBand;
    private final int nirBand;
    private final int tileSize;
    private final GeometryFactory geometryFactory;
    private final PreparedGeometry prepared;
    private final IndexedPointInAreaLocator locator;

    private final int minCol;
    private final int minRow;
    private final int maxCol;
    private final int maxRow;

    private int nextX;
    private int nextY;
    private PixelBlock pending;
    private boolean exhausted;

    public RasterTileIterator(RasterSource raster, Geometry pixelSpaceBoundary, int redBand, int nirBand,
                              int tileSize) {
        if (tileSize <= 0) {
            throw new IllegalArgumentException("Tile size must be positive");
        }
        this.raster = raster;
        this.redBand = redBand;
        this.nirBand = nirBand;
        this.tileSize = tileSize;
        this.geometryFactory = pixelSpaceBoundary.getFactory();
        this.prepared = PreparedGeometryFactory.prepare(pixelSpaceBoundary);
        this.locator = new IndexedPointInAreaLocator(pixelSpaceBoundary);

        Envelope env = pixelSpaceBoundary.getEnvelopeInternal();
        this.minCol = Math.max(0, (int) Math.floor(env.getMinX()));
        this.minRow = Math.max(0, (int) Math.floor(env.getMinY()));
        this.maxCol = Math.min(raster.getWidth(), (int) Math.ceil(env.getMaxX()));
        this.maxRow = Math.min(raster.getHeight(), (int) Math.ceil(env.getMaxY()));
        this.nextX = minCol;
        this.nextY = minRow;
        this.exhausted = env.isNull() || minCol >= maxCol || minRow >= maxRow;
    }

    @Override
    public boolean hasNext() {
        while (pending == null && !exhausted) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public PixelBlock next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        PixelBlock block = pending;
        pending = null;
        return block;
    }

    private PixelBlock advance() {
        int x = nextX;
        int y = nextY;
        int width = Math.min(tileSize, maxCol - x);
        int height = Math.min(tileSize, maxRow - y);

        nextX += tileSize;
        if (nextX >= maxCol) {
            nextX = minCol;
            nextY += tileSize;
            if (nextY >= maxRow) {
                exhausted = true;
            }
        }

        Geometry tile = geometryFactory.toGeometry(new Envelope(x, x + width, y, y + height));
        if (prepared.disjoint(tile)) {
            return null;
        }

        boolean[] mask = null;
        if (!prepared.containsProperly(tile)) {
            mask = new boolean[width * height];
            boolean any = false;
            Coordinate centre = new Coordinate();
            for (int row = 0; row < height; row++) {
                centre.y = y + row + 0.5;
                for (int col = 0; col < width; col++) {
                    centre.x = x + col + 0.5;
                    boolean inside = locator.locate(centre) != Location.EXTERIOR;
                    mask[row * width + col] = inside;
                    any |= inside;
                }
            }
            if (!any) {
                return null;
            }
        }

        try {
            double[][] samples = raster.readBands(new Rectangle(x, y, width, height), redBand, nirBand);
            return new PixelBlock(x, y, width, height, samples[0], samples[1], mask);
        } catch (IOException e) {
            throw new InvalidInputException("Failed to read raster tile at (" + x + ", " + y + ") from "
                    + raster.getDescription(), e);
        }
    }
}
