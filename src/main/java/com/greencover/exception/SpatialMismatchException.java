package com.greencover.exception;

/**
 * Thrown when boundary and raster coordinate systems cannot be reconciled
 */
public class SpatialMismatchException extends GreenCoverageException {

    private static final long serialVersionUID = 1L;

    private final String hint;

    public SpatialMismatchException(String message, String hint) {
        super(ErrorKind.SPATIAL_MISMATCH, hint == null ? message : message + ". " + hint);
        this.hint = hint;
    }

    /**
     * Corrective action for the caller, e.g. which CRS to reproject into
     */
    public String getHint() {
        return hint;
    }
}
