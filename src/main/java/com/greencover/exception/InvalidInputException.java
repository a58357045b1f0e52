package com.greencover.exception;

/**
 * Thrown when an input file is unreadable or malformed, or a result fails validation
 */
public class InvalidInputException extends GreenCoverageException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(ErrorKind.INVALID_INPUT, message, cause);
    }
}
