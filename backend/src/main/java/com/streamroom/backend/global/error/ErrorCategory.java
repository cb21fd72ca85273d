package com.streamroom.backend.global.error;

/**
 * Coarse error classes shared by the server and the client.
 * Validation, not-found and conflict outcomes are deterministic and never retried automatically.
 */
public enum ErrorCategory {
    VALIDATION(false),
    NOT_FOUND(false),
    CONFLICT(false),
    DEPENDENCY_UNAVAILABLE(true),
    DEPENDENCY_FAILURE(true),
    TIMEOUT(true),
    INTERNAL(false);

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
