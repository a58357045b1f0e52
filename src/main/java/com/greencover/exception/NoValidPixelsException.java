package com.greencover.exception;

/**
 * Thrown when no valid pixel remains after clipping the raster to a boundary
 */
public class NoValidPixelsException extends GreenCoverageException {

    private static final long serialVersionUID = 1L;

    public NoValidPixelsException(String message) {
        super(ErrorKind.NO_VALID_PIXELS, message);
    }

    public NoValidPixelsException(String message, Throwable cause) {
        super(ErrorKind.NO_VALID_PIXELS, message, cause);
    }
}
