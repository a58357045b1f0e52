package com.greencover.exception;

/**
 * Failure categories reported by direct calls and recorded per city in batch runs
 */
public enum ErrorKind {
    CITY_NOT_FOUND(false),
    AMBIGUOUS_CITY(false),
    SPATIAL_MISMATCH(false),
    NO_VALID_PIXELS(false),
    UNSUPPORTED_FORMAT(false),
    COMPUTE_TIMEOUT(false),
    INVALID_INPUT(false),
    CACHE_UNAVAILABLE(true),
    UNEXPECTED(true);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether a batch run may attempt the same city again after this failure
     */
    public boolean isRetryable() {
        return retryable;
    }
}
