package com.greencover.exception;

/**
 * Base exception for coverage computation and caching failures
 */
public class GreenCoverageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public GreenCoverageException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GreenCoverageException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
