package com.streamroom.client.gateway;

import java.time.Duration;

/**
 * Failure of a session gateway call. {@code status} is 0 when no HTTP response was received.
 */
public class GatewayException extends RuntimeException {

    private final GatewayErrorKind kind;
    private final String code;
    private final int status;
    private final Duration retryAfter;

    public GatewayException(GatewayErrorKind kind, String code, int status, String message,
                            Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
        this.status = status;
        this.retryAfter = retryAfter;
    }

    public static GatewayException transport(GatewayErrorKind kind, String message, Throwable cause) {
        return new GatewayException(kind, kind.name(), 0, message, null, cause);
    }

    public GatewayErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public int getStatus() {
        return status;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
