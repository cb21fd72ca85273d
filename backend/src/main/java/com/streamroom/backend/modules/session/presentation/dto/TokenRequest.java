package com.streamroom.backend.modules.session.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

/**
 * {@code isHost} is optional and defaults to a viewer join. Only JSON booleans are accepted.
 */
public record TokenRequest(
        @NotBlank(message = "roomName is required") String roomName,
        @NotBlank(message = "participantName is required") String participantName,
        @JsonProperty("isHost") Boolean isHost
) {

    public boolean asOwner() {
        return Boolean.TRUE.equals(isHost);
    }
}
