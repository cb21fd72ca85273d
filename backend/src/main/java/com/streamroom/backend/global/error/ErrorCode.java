package com.streamroom.backend.global.error;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION, "Request validation failed"),
    MALFORMED_REQUEST(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION, "Request body could not be parsed"),
    INVALID_ROOM_ID(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION,
            "Invalid roomId: must be 1-100 characters, alphanumeric, underscore, or dash only"),
    INVALID_IDENTITY(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION,
            "Invalid participant name: must be 1-50 characters, alphanumeric, spaces, underscore, or dash only"),
    INVALID_JOB_ID(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION,
            "Invalid egressId: must be a non-empty string of at most 100 characters"),

    ROOM_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND, "Room not found"),
    RECORDING_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND,
            "No recording found with the provided egressId"),

    ROOM_ENDED(HttpStatus.GONE, ErrorCategory.CONFLICT, "Room inactive: this stream has ended"),
    RECORDING_ALREADY_ACTIVE(HttpStatus.CONFLICT, ErrorCategory.CONFLICT,
            "Recording already active: this stream is already being recorded"),
    RECORDING_NOT_ACTIVE(HttpStatus.CONFLICT, ErrorCategory.CONFLICT,
            "Recording not active: this recording is not currently active"),

    RECORDING_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, ErrorCategory.DEPENDENCY_UNAVAILABLE,
            "Recording service not available: LiveKit or S3 credentials not configured"),
    CREDENTIALS_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, ErrorCategory.DEPENDENCY_UNAVAILABLE,
            "Server configuration error: LiveKit credentials not configured"),

    EGRESS_START_FAILED(HttpStatus.BAD_GATEWAY, ErrorCategory.DEPENDENCY_FAILURE, "Failed to start recording"),
    EGRESS_LIST_FAILED(HttpStatus.BAD_GATEWAY, ErrorCategory.DEPENDENCY_FAILURE, "Failed to list recording jobs"),

    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCategory.INTERNAL, "Internal server error");

    private final HttpStatus status;
    private final ErrorCategory category;
    private final String defaultDetail;

    ErrorCode(HttpStatus status, ErrorCategory category, String defaultDetail) {
        this.status = status;
        this.category = category;
        this.defaultDetail = defaultDetail;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getDefaultDetail() {
        return defaultDetail;
    }
}
