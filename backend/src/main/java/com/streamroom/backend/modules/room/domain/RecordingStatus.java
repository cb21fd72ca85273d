package com.streamroom.backend.modules.room.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecordingStatus {
    STARTING,
    ACTIVE,
    STOPPING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
