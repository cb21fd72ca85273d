package com.streamroom.backend.modules.session.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record CreateRoomRequest(@NotBlank(message = "hostName is required") String hostName) {
}
