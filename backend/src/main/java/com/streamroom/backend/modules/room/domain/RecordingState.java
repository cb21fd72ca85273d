package com.streamroom.backend.modules.room.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Recording sub-state of a room.
 * <p>
 * {@code Idle -> Starting -> Active -> Stopping -> Terminal}; a terminal state keeps the finished
 * job as history and accepts a new start just like {@code Idle}. Only {@code Active} and
 * {@code Stopping} count as "recording active", and both always carry a job id.
 */
public sealed interface RecordingState {

    Idle IDLE = new Idle();

    /**
     * Wire status, empty for a room that never recorded.
     */
    Optional<RecordingStatus> status();

    Optional<String> currentJobId();

    default boolean isRecordingActive() {
        return false;
    }

    default boolean acceptsStart() {
        return false;
    }

    record Idle() implements RecordingState {

        @Override
        public Optional<RecordingStatus> status() {
            return Optional.empty();
        }

        @Override
        public Optional<String> currentJobId() {
            return Optional.empty();
        }

        @Override
        public boolean acceptsStart() {
            return true;
        }
    }

    /**
     * Provider call in flight; no job id yet.
     */
    record Starting(String filePath, Instant requestedAt) implements RecordingState {

        public Starting {
            Objects.requireNonNull(filePath, "filePath");
            Objects.requireNonNull(requestedAt, "requestedAt");
        }

        @Override
        public Optional<RecordingStatus> status() {
            return Optional.of(RecordingStatus.STARTING);
        }

        @Override
        public Optional<String> currentJobId() {
            return Optional.empty();
        }
    }

    record Active(String jobId, String filePath, Instant startedAt) implements RecordingState {

        public Active {
            Objects.requireNonNull(jobId, "jobId");
            Objects.requireNonNull(startedAt, "startedAt");
        }

        @Override
        public Optional<RecordingStatus> status() {
            return Optional.of(RecordingStatus.ACTIVE);
        }

        @Override
        public Optional<String> currentJobId() {
            return Optional.of(jobId);
        }

        @Override
        public boolean isRecordingActive() {
            return true;
        }
    }

    record Stopping(String jobId, String filePath, Instant stopRequestedAt) implements RecordingState {

        public Stopping {
            Objects.requireNonNull(jobId, "jobId");
            Objects.requireNonNull(stopRequestedAt, "stopRequestedAt");
        }

        @Override
        public Optional<RecordingStatus> status() {
            return Optional.of(RecordingStatus.STOPPING);
        }

        @Override
        public Optional<String> currentJobId() {
            return Optional.of(jobId);
        }

        @Override
        public boolean isRecordingActive() {
            return true;
        }
    }

    record Terminal(
            String jobId,
            RecordingStatus outcome,
            String destination,
            String failureReason,
            Instant finishedAt
    ) implements RecordingState {

        public Terminal {
            Objects.requireNonNull(jobId, "jobId");
            Objects.requireNonNull(finishedAt, "finishedAt");
            if (outcome == null || !outcome.isTerminal()) {
                throw new IllegalArgumentException("Terminal outcome must be COMPLETED or FAILED: " + outcome);
            }
            if (outcome == RecordingStatus.COMPLETED && destination == null) {
                throw new IllegalArgumentException("Completed recording requires a destination");
            }
        }

        public static Terminal completed(String jobId, String destination, Instant finishedAt) {
            return new Terminal(jobId, RecordingStatus.COMPLETED, destination, null, finishedAt);
        }

        public static Terminal failed(String jobId, String failureReason, Instant finishedAt) {
            return new Terminal(jobId, RecordingStatus.FAILED, null, failureReason, finishedAt);
        }

        @Override
        public Optional<RecordingStatus> status() {
            return Optional.of(outcome);
        }

        @Override
        public Optional<String> currentJobId() {
            return Optional.of(jobId);
        }

        @Override
        public boolean acceptsStart() {
            return true;
        }
    }
}
