package com.streamroom.backend.modules.session.presentation.dto;

import java.time.Instant;

import com.streamroom.backend.modules.session.application.SessionGateway.RoomCreation;

public record CreateRoomResponse(
        String roomId,
        String hostToken,
        String shareUrl,
        String serverUrl,
        String hostName,
        Instant createdAt
) {

    public static CreateRoomResponse from(RoomCreation creation) {
        return new CreateRoomResponse(
                creation.room().id(),
                creation.joinCredential(),
                creation.shareableReference(),
                creation.serverUrl(),
                creation.room().ownerIdentity(),
                creation.room().createdAt()
        );
    }
}
