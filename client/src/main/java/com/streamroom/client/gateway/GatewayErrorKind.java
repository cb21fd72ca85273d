package com.streamroom.client.gateway;

import java.util.Locale;

/**
 * Client-side view of the backend error categories, plus the transport failures only the
 * client can observe.
 */
public enum GatewayErrorKind {
    VALIDATION(false),
    NOT_FOUND(false),
    CONFLICT(false),
    DEPENDENCY_UNAVAILABLE(true),
    DEPENDENCY_FAILURE(true),
    TIMEOUT(true),
    NETWORK(true),
    INTERNAL(true);

    private final boolean retryable;

    GatewayErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Resolves the {@code category} of a problem response, falling back to the HTTP status
     * when the category is absent or unknown.
     */
    public static GatewayErrorKind fromProblem(String category, int httpStatus) {
        if (category != null && !category.isBlank()) {
            String normalized = category.trim().toUpperCase(Locale.ROOT);
            for (GatewayErrorKind kind : values()) {
                if (kind.name().equals(normalized)) {
                    return kind;
                }
            }
        }
        return fromStatus(httpStatus);
    }

    public static GatewayErrorKind fromStatus(int httpStatus) {
        return switch (httpStatus) {
            case 404 -> NOT_FOUND;
            case 409, 410 -> CONFLICT;
            case 502 -> DEPENDENCY_FAILURE;
            case 503 -> DEPENDENCY_UNAVAILABLE;
            case 408, 504 -> TIMEOUT;
            default -> httpStatus >= 500 ? INTERNAL : VALIDATION;
        };
    }
}
