package com.streamroom.backend.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

/**
 * Connection settings for the LiveKit server used for both access tokens and egress.
 */
@ConfigurationProperties(prefix = "livekit")
public record LiveKitProperties(
        String apiKey,
        String apiSecret,
        String serverUrl,
        Duration tokenTtl,
        Duration connectTimeout,
        Duration readTimeout
) {

    public LiveKitProperties {
        tokenTtl = tokenTtl != null ? tokenTtl : Duration.ofHours(6);
        connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(5);
        readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(10);
    }

    public boolean hasSigningKeys() {
        return StringUtils.hasText(apiKey) && StringUtils.hasText(apiSecret);
    }

    public boolean isConfigured() {
        return hasSigningKeys() && StringUtils.hasText(serverUrl);
    }
}
