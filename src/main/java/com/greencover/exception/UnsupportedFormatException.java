package com.greencover.exception;

/**
 * Thrown when an input file type is not recognized
 */
public class UnsupportedFormatException extends GreenCoverageException {

    private static final long serialVersionUID = 1L;

    public UnsupportedFormatException(String message) {
        super(ErrorKind.UNSUPPORTED_FORMAT, message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_FORMAT, message, cause);
    }
}
