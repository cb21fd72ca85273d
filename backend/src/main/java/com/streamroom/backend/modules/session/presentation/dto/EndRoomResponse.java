package com.streamroom.backend.modules.session.presentation.dto;

import java.time.Instant;

import com.streamroom.backend.modules.room.domain.Room;

public record EndRoomResponse(String message, String roomId, Instant endedAt) {

    public static EndRoomResponse from(Room room) {
        return new EndRoomResponse("Stream ended successfully", room.id(), room.endedAt());
    }
}
