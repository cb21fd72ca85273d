package com.streamroom.backend.modules.recording.infrastructure;

import java.time.Instant;

import com.streamroom.backend.modules.recording.domain.EgressDestination;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

/**
 * S3 target for finished recordings.
 */
@ConfigurationProperties(prefix = "recording.storage")
public record RecordingStorageProperties(
        String accessKey,
        String secret,
        String region,
        String bucket,
        String pathPrefix
) {

    private static final String DEFAULT_REGION = "us-east-1";
    private static final String DEFAULT_PATH_PREFIX = "live-recordings";

    public RecordingStorageProperties {
        region = StringUtils.hasText(region) ? region : DEFAULT_REGION;
        pathPrefix = StringUtils.hasText(pathPrefix) ? trimSlashes(pathPrefix) : DEFAULT_PATH_PREFIX;
    }

    public boolean isConfigured() {
        return StringUtils.hasText(accessKey) && StringUtils.hasText(secret) && StringUtils.hasText(bucket);
    }

    /**
     * {@code live-recordings/{roomId}/{epochMillis}.mp4}; the timestamp keeps repeated
     * recordings of one room apart.
     */
    public String filePathFor(String roomId, Instant requestedAt) {
        return pathPrefix + "/" + roomId + "/" + requestedAt.toEpochMilli() + ".mp4";
    }

    public EgressDestination destinationFor(String filePath) {
        return new EgressDestination(bucket, region, accessKey, secret, filePath);
    }

    public String publicUrl(String artifact) {
        String key = artifact.startsWith("/") ? artifact.substring(1) : artifact;
        return "https://" + bucket + ".s3." + region + ".amazonaws.com/" + key;
    }

    private static String trimSlashes(String value) {
        String trimmed = value.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
