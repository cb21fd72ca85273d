package com.streamroom.backend.modules.recording.domain;

import com.streamroom.backend.modules.room.domain.RecordingState;
import com.streamroom.backend.modules.room.domain.RecordingStatus;
import com.streamroom.backend.modules.room.domain.Room;

/**
 * Read-only projection of a room's recording sub-state.
 */
public record RecordingStatusView(
        String roomId,
        String ownerIdentity,
        boolean roomActive,
        boolean recordingActive,
        RecordingStatus status,
        String jobId,
        String destination,
        String failureReason
) {

    public static RecordingStatusView of(Room room) {
        String failureReason = null;
        if (room.recording() instanceof RecordingState.Terminal terminal) {
            failureReason = terminal.failureReason();
        }
        return new RecordingStatusView(
                room.id(),
                room.ownerIdentity(),
                room.active(),
                room.isRecordingActive(),
                room.recording().status().orElse(null),
                room.recordingJobId().orElse(null),
                room.recordingDestination(),
                failureReason
        );
    }
}
