package com.streamroom.backend.modules.session.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record StopRecordingRequest(@NotBlank(message = "egressId is required") String egressId) {
}
