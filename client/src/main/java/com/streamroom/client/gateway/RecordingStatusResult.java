package com.streamroom.client.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordingStatusResult(
        String roomId,
        String hostName,
        @JsonProperty("isActive") boolean isActive,
        @JsonProperty("isRecording") boolean isRecording,
        String status,
        String egressId,
        String recordingUrl,
        String error
) {
}
