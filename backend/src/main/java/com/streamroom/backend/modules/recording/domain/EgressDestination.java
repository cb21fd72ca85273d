package com.streamroom.backend.modules.recording.domain;

import java.util.Objects;

/**
 * Where the provider should upload the encoded file. {@code filePath} is the object key
 * inside the bucket.
 */
public record EgressDestination(String bucket, String region, String accessKey, String secret, String filePath) {

    public EgressDestination {
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(filePath, "filePath");
    }

    @Override
    public String toString() {
        return "EgressDestination[bucket=" + bucket + ", region=" + region + ", filePath=" + filePath + "]";
    }
}
