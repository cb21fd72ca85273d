package com.streamroom.backend.modules.recording.domain;

import com.streamroom.backend.modules.room.domain.RecordingStatus;

/**
 * Outcome of a stop attempt; always terminal.
 */
public record RecordingStop(
        String jobId,
        String roomId,
        RecordingStatus status,
        String destination,
        String failureReason
) {

    public boolean isCompleted() {
        return status == RecordingStatus.COMPLETED;
    }
}
