package com.streamroom.client.recording;

import java.time.Duration;

/**
 * Tunables for {@link ClientSessionController}. Backoff doubles per attempt starting at
 * {@code initialRetryDelay}.
 */
public record ClientSettings(
        int maxRetries,
        Duration initialRetryDelay,
        Duration errorDisplayDuration,
        Duration tickInterval
) {

    public static final int DEFAULT_MAX_RETRIES = 3;

    public ClientSettings {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        initialRetryDelay = initialRetryDelay != null ? initialRetryDelay : Duration.ofSeconds(1);
        errorDisplayDuration = errorDisplayDuration != null ? errorDisplayDuration : Duration.ofSeconds(10);
        tickInterval = tickInterval != null ? tickInterval : Duration.ofSeconds(1);
    }

    public static ClientSettings defaults() {
        return new ClientSettings(DEFAULT_MAX_RETRIES, null, null, null);
    }

    Duration retryDelay(int attemptIndex) {
        return initialRetryDelay.multipliedBy(1L << attemptIndex);
    }
}
