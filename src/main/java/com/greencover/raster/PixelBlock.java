package com.greencover.raster;

import lombok.Getter;

/**
 * One tile of clipped raster samples. Only pixels flagged inside the boundary
 * take part in statistics.
 */
@Getter
public class PixelBlock {

    private final int x;
    private final int y;
    private final int width;
    private final int height;
    private final double[] red;
    private final double[] nir;

    /** Null when the whole tile lies inside the boundary */
    private final boolean[] insideMask;

    public PixelBlock(int x, int y, int width, int height, double[] red, double[] nir, boolean[] insideMask) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.red = red;
        this.nir = nir;
        this.insideMask = insideMask;
    }

    public int size() {
        return width * height;
    }

    public boolean isInside(int index) {
        return insideMask == null || insideMask[index];
    }

    /**
     * Raster row of the pixel at {@code index} within this block
     */
    public int rowOf(int index) {
        return y + index / width;
    }
}
