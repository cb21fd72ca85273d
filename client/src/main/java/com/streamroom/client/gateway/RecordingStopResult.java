package com.streamroom.client.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordingStopResult(
        String egressId,
        String roomName,
        String status,
        String s3Url,
        String error,
        String message
) {

    public boolean isCompleted() {
        return "completed".equals(status);
    }
}
