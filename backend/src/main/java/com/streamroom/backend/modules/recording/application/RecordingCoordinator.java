package com.streamroom.backend.modules.recording.application;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import com.streamroom.backend.global.error.ErrorCode;
import com.streamroom.backend.global.error.ProblemException;
import com.streamroom.backend.global.error.RetryableProblemException;
import com.streamroom.backend.modules.recording.domain.EgressFilter;
import com.streamroom.backend.modules.recording.domain.EgressJobInfo;
import com.streamroom.backend.modules.recording.domain.EgressJobStatus;
import com.streamroom.backend.modules.recording.domain.EgressResult;
import com.streamroom.backend.modules.recording.domain.RecordingStart;
import com.streamroom.backend.modules.recording.domain.RecordingStatusView;
import com.streamroom.backend.modules.recording.domain.RecordingStop;
import com.streamroom.backend.modules.recording.infrastructure.RecordingStorageProperties;
import com.streamroom.backend.modules.room.domain.RecordingState;
import com.streamroom.backend.modules.room.domain.RecordingStatus;
import com.streamroom.backend.modules.room.domain.Room;
import com.streamroom.backend.modules.room.infrastructure.RoomRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Owns the link between a room and its single in-flight egress job.
 * <p>
 * Each transition is a two-step affair: the precondition check and the move into
 * {@code Starting}/{@code Stopping} happen atomically in the registry, the provider is called
 * without holding anything, and the outcome is written back afterwards. A racing second
 * start or stop therefore sees a non-idle / non-active room and fails immediately.
 */
@Service
public class RecordingCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RecordingCoordinator.class);
    private static final int START_RETRY_AFTER_SECONDS = 2;

    private final RoomRegistry roomRegistry;
    private final EgressProvider egressProvider;
    private final RecordingStorageProperties storage;
    private final Clock clock;

    public RecordingCoordinator(
            RoomRegistry roomRegistry,
            EgressProvider egressProvider,
            RecordingStorageProperties storage,
            Clock clock
    ) {
        this.roomRegistry = roomRegistry;
        this.egressProvider = egressProvider;
        this.storage = storage;
        this.clock = clock;
    }

    public boolean isRecordingAvailable() {
        return storage.isConfigured() && egressProvider.isAvailable();
    }

    public RecordingStart startRecording(String roomId) {
        requireRecordingAvailable();

        Instant requestedAt = clock.instant();
        String filePath = storage.filePathFor(roomId, requestedAt);
        RecordingState.Starting starting = new RecordingState.Starting(filePath, requestedAt);
        AtomicReference<RecordingState> previous = new AtomicReference<>();

        roomRegistry.update(roomId, room -> {
            if (!room.active()) {
                throw new ProblemException(ErrorCode.ROOM_ENDED,
                        "Room inactive: Cannot start recording for an inactive stream");
            }
            if (!room.recording().acceptsStart()) {
                throw new ProblemException(ErrorCode.RECORDING_ALREADY_ACTIVE);
            }
            previous.set(room.recording());
            return room.withRecording(starting);
        }).orElseThrow(() -> new ProblemException(ErrorCode.ROOM_NOT_FOUND,
                "Room not found: The stream you are trying to record does not exist"));

        String jobId;
        try {
            jobId = egressProvider.start(roomId, storage.destinationFor(filePath));
            if (!StringUtils.hasText(jobId)) {
                throw new IllegalStateException("Egress provider returned no job id");
            }
        } catch (RuntimeException ex) {
            roomRegistry.update(roomId, room -> room.recording().equals(starting)
                    ? room.withRecording(previous.get())
                    : room);
            log.warn("[Recording][start] roomId={} filePath={} failed: {}", roomId, filePath, ex.getMessage(), ex);
            throw new RetryableProblemException(
                    ErrorCode.EGRESS_START_FAILED,
                    "Failed to start recording: " + describe(ex),
                    START_RETRY_AFTER_SECONDS,
                    ex
            );
        }

        // 시작 중에 방이 종료되어도 잡은 기록해 둔다. 그래야 나중에 멈출 수 있다.
        RecordingState.Active active = new RecordingState.Active(jobId, filePath, clock.instant());
        roomRegistry.update(roomId, room -> room.withRecording(active));
        log.info("[Recording][start] roomId={} jobId={} filePath={}", roomId, jobId, filePath);
        return new RecordingStart(jobId, roomId, filePath, RecordingStatus.STARTING);
    }

    public RecordingStop stopRecording(String jobId) {
        requireRecordingAvailable();

        Room owner = roomRegistry.findByJobId(jobId)
                .orElseThrow(() -> new ProblemException(ErrorCode.RECORDING_NOT_FOUND,
                        "Recording not found: No active recording found with the provided egressId"));
        String roomId = owner.id();
        Instant stopRequestedAt = clock.instant();

        roomRegistry.update(roomId, room -> {
            if (!(room.recording() instanceof RecordingState.Active active) || !active.jobId().equals(jobId)) {
                if (room.recordingJobId().filter(jobId::equals).isEmpty()) {
                    throw new ProblemException(ErrorCode.RECORDING_NOT_FOUND,
                            "Recording not found: No active recording found with the provided egressId");
                }
                throw new ProblemException(ErrorCode.RECORDING_NOT_ACTIVE);
            }
            return room.withRecording(new RecordingState.Stopping(jobId, active.filePath(), stopRequestedAt));
        }).orElseThrow(() -> new ProblemException(ErrorCode.RECORDING_NOT_FOUND));

        RecordingState.Terminal outcome = stopWithProvider(roomId, jobId);

        roomRegistry.update(roomId, room -> room.recording() instanceof RecordingState.Stopping stopping
                && stopping.jobId().equals(jobId)
                ? room.withRecording(outcome)
                : room);

        if (outcome.outcome() == RecordingStatus.COMPLETED) {
            log.info("[Recording][stop] roomId={} jobId={} destination={}", roomId, jobId, outcome.destination());
        } else {
            log.warn("[Recording][stop] roomId={} jobId={} failed reason={}", roomId, jobId, outcome.failureReason());
        }
        return new RecordingStop(jobId, roomId, outcome.outcome(), outcome.destination(), outcome.failureReason());
    }

    public RecordingStatusView status(String roomId) {
        return roomRegistry.find(roomId)
                .map(RecordingStatusView::of)
                .orElseThrow(() -> new ProblemException(ErrorCode.ROOM_NOT_FOUND,
                        "Room not found: The stream you are looking for does not exist"));
    }

    /**
     * Diagnostic pass-through to the provider's job listing; does not touch room state.
     */
    public List<EgressJobInfo> listJobs(EgressFilter filter) {
        requireRecordingAvailable();
        try {
            return egressProvider.list(filter);
        } catch (RuntimeException ex) {
            log.warn("[Recording][list] filter={} failed: {}", filter, ex.getMessage(), ex);
            throw new RetryableProblemException(
                    ErrorCode.EGRESS_LIST_FAILED,
                    "Failed to get recording status: " + describe(ex),
                    START_RETRY_AFTER_SECONDS,
                    ex
            );
        }
    }

    /**
     * Never throws: every provider outcome other than a completed upload becomes a failed terminal
     * state, so the room's recording lock is always released.
     */
    private RecordingState.Terminal stopWithProvider(String roomId, String jobId) {
        Instant finishedAt;
        try {
            EgressResult result = egressProvider.stop(jobId);
            finishedAt = clock.instant();
            if (result.status() == EgressJobStatus.COMPLETE && !result.artifacts().isEmpty()) {
                String artifact = result.artifacts().get(0);
                if (StringUtils.hasText(artifact)) {
                    return RecordingState.Terminal.completed(jobId, storage.publicUrl(artifact), finishedAt);
                }
            }
            String reason = "Recording failed with status: " + result.status().providerName();
            if (StringUtils.hasText(result.error())) {
                reason = reason + " (" + result.error() + ")";
            } else if (result.status() == EgressJobStatus.COMPLETE) {
                reason = reason + " (no recording file was produced)";
            }
            return RecordingState.Terminal.failed(jobId, reason, finishedAt);
        } catch (RuntimeException ex) {
            log.warn("[Recording][stop] roomId={} jobId={} provider error: {}", roomId, jobId, ex.getMessage(), ex);
            return RecordingState.Terminal.failed(jobId, describe(ex), clock.instant());
        }
    }

    private void requireRecordingAvailable() {
        if (!isRecordingAvailable()) {
            throw new ProblemException(ErrorCode.RECORDING_UNAVAILABLE);
        }
    }

    private static String describe(Throwable ex) {
        return StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : "Unknown error";
    }
}
