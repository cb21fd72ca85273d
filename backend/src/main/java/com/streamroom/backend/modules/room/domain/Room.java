package com.streamroom.backend.modules.room.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable room snapshot. The registry swaps whole values, so a reference handed out
 * to a caller can never change underneath it.
 */
public record Room(
        String id,
        String ownerIdentity,
        Instant createdAt,
        boolean active,
        Instant endedAt,
        RecordingState recording,
        String recordingDestination
) {

    public Room {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ownerIdentity, "ownerIdentity");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(recording, "recording");
        if (active && endedAt != null) {
            throw new IllegalArgumentException("An active room cannot have an end time");
        }
    }

    public static Room open(String id, String ownerIdentity, Instant createdAt) {
        return new Room(id, ownerIdentity, createdAt, true, null, RecordingState.IDLE, null);
    }

    /**
     * Ending is one-way; ending an ended room returns it unchanged.
     */
    public Room end(Instant at) {
        if (!active) {
            return this;
        }
        return new Room(id, ownerIdentity, createdAt, false, at, recording, recordingDestination);
    }

    public Room withRecording(RecordingState next) {
        String destination = recordingDestination;
        if (next instanceof RecordingState.Terminal terminal && terminal.outcome() == RecordingStatus.COMPLETED) {
            destination = terminal.destination();
        }
        return new Room(id, ownerIdentity, createdAt, active, endedAt, next, destination);
    }

    public boolean isRecordingActive() {
        return recording.isRecordingActive();
    }

    public Optional<String> recordingJobId() {
        return recording.currentJobId();
    }

    public Optional<String> lastRecordingDestination() {
        return Optional.ofNullable(recordingDestination);
    }
}
