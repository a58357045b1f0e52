package com.greencover.exception;

/**
 * Thrown when the cache persistence substrate cannot be reached
 */
public class CacheUnavailableException extends GreenCoverageException {

    private static final long serialVersionUID = 1L;

    public CacheUnavailableException(String message) {
        super(ErrorKind.CACHE_UNAVAILABLE, message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(ErrorKind.CACHE_UNAVAILABLE, message, cause);
    }
}
