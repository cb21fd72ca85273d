package com.streamroom.backend.modules.session.presentation.dto;

import com.streamroom.backend.modules.recording.domain.RecordingStop;
import com.streamroom.backend.modules.room.domain.RecordingStatus;

/**
 * A failed recording is still a 200 response; {@code status} and {@code error} carry the outcome.
 */
public record StopRecordingResponse(
        String egressId,
        String roomName,
        RecordingStatus status,
        String s3Url,
        String error,
        String message
) {

    public static StopRecordingResponse from(RecordingStop stop) {
        return new StopRecordingResponse(
                stop.jobId(),
                stop.roomId(),
                stop.status(),
                stop.destination(),
                stop.failureReason(),
                stop.isCompleted() ? "Recording stopped successfully" : "Recording stopped with failure"
        );
    }
}
