package com.streamroom.client.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordingStartResult(
        String egressId,
        String roomName,
        String filePath,
        String status,
        String message
) {
}
