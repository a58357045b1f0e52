package com.greencover.exception;

/**
 * Thrown when a single analysis exceeds its time bound
 */
public class ComputeTimeoutException extends GreenCoverageException {

    private static final long serialVersionUID = 1L;

    public ComputeTimeoutException(String message) {
        super(ErrorKind.COMPUTE_TIMEOUT, message);
    }

    public ComputeTimeoutException(String message, Throwable cause) {
        super(ErrorKind.COMPUTE_TIMEOUT, message, cause);
    }
}
