package com.streamroom.backend.modules.session.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.streamroom.backend.modules.session.application.SessionGateway.JoinCredential;

public record TokenResponse(
        String token,
        String serverUrl,
        String roomName,
        String participantName,
        @JsonProperty("isHost") boolean isHost
) {

    public static TokenResponse from(JoinCredential credential) {
        return new TokenResponse(
                credential.token(),
                credential.serverUrl(),
                credential.roomId(),
                credential.identity(),
                credential.asOwner()
        );
    }
}
