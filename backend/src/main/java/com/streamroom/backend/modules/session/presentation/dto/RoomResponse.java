package com.streamroom.backend.modules.session.presentation.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.streamroom.backend.modules.room.domain.Room;

public record RoomResponse(
        String roomId,
        String hostName,
        Instant createdAt,
        @JsonProperty("isActive") boolean isActive,
        Instant endedAt,
        @JsonProperty("isRecording") boolean isRecording,
        String egressId,
        String recordingUrl
) {

    public static RoomResponse from(Room room) {
        return new RoomResponse(
                room.id(),
                room.ownerIdentity(),
                room.createdAt(),
                room.active(),
                room.endedAt(),
                room.isRecordingActive(),
                room.recordingJobId().orElse(null),
                room.recordingDestination()
        );
    }
}
