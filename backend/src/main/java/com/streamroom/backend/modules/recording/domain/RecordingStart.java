package com.streamroom.backend.modules.recording.domain;

import com.streamroom.backend.modules.room.domain.RecordingStatus;

public record RecordingStart(String jobId, String roomId, String filePath, RecordingStatus status) {
}
