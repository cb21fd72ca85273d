package com.streamroom.backend.modules.session.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record StartRecordingRequest(@NotBlank(message = "roomName is required") String roomName) {
}
