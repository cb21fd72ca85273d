package com.streamroom.backend.modules.session.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.streamroom.backend.modules.recording.domain.RecordingStatusView;
import com.streamroom.backend.modules.room.domain.RecordingStatus;

public record RecordingStatusResponse(
        String roomId,
        String hostName,
        @JsonProperty("isActive") boolean isActive,
        @JsonProperty("isRecording") boolean isRecording,
        RecordingStatus status,
        String egressId,
        String recordingUrl,
        String error
) {

    public static RecordingStatusResponse from(RecordingStatusView view) {
        return new RecordingStatusResponse(
                view.roomId(),
                view.ownerIdentity(),
                view.roomActive(),
                view.recordingActive(),
                view.status(),
                view.jobId(),
                view.destination(),
                view.failureReason()
        );
    }
}
