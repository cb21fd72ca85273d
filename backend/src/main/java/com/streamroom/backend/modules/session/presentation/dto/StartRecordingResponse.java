package com.streamroom.backend.modules.session.presentation.dto;

import com.streamroom.backend.modules.recording.domain.RecordingStart;
import com.streamroom.backend.modules.room.domain.RecordingStatus;

public record StartRecordingResponse(
        String egressId,
        String roomName,
        String filePath,
        RecordingStatus status,
        String message
) {

    public static StartRecordingResponse from(RecordingStart start) {
        return new StartRecordingResponse(
                start.jobId(),
                start.roomId(),
                start.filePath(),
                start.status(),
                "Recording started successfully"
        );
    }
}
