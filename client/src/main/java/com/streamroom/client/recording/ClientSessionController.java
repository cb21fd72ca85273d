package com.streamroom.client.recording;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import com.streamroom.client.gateway.GatewayErrorKind;
import com.streamroom.client.gateway.GatewayException;
import com.streamroom.client.gateway.RecordingStartResult;
import com.streamroom.client.gateway.RecordingStatusResult;
import com.streamroom.client.gateway.RecordingStopResult;
import com.streamroom.client.gateway.SessionGatewayClient;
import com.streamroom.client.network.NetworkMonitor;
import com.streamroom.client.scheduling.ClientScheduler;
import com.streamroom.client.scheduling.ClientScheduler.Cancellable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives start/stop recording for one room from a host's client.
 * <p>
 * At most one gateway call is in flight; start, stop, toggle and retry return {@code false}
 * when they were ignored. Gateway calls run on the calling thread (scheduled retries on the
 * scheduler's worker) without holding the controller lock. The server stays authoritative:
 * this class only mirrors what the gateway last reported, and a conflicting reply triggers a
 * status reload.
 */
public class ClientSessionController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClientSessionController.class);

    static final String RETRIES_EXHAUSTED_MESSAGE = "Maximum retry attempts reached. Please try again later.";
    static final String STOPPED_WITH_ERRORS_MESSAGE = "Recording stopped with errors";

    private enum Operation { START, STOP }

    private final String roomId;
    private final SessionGatewayClient gateway;
    private final ClientScheduler scheduler;
    private final NetworkMonitor networkMonitor;
    private final ClientSettings settings;
    private final List<Consumer<ControllerSnapshot>> listeners = new CopyOnWriteArrayList<>();
    private final Cancellable networkSubscription;

    private ControllerState state = ControllerState.IDLE;
    private boolean recording;
    private String jobId;
    private String recordingUrl;
    private long elapsedSeconds;

    private String error;
    private GatewayErrorKind errorKind;
    private long errorGeneration;

    private Operation lastOperation;
    private GatewayErrorKind lastFailureKind;
    private Duration lastRetryAfter;
    private int retryCount;
    private boolean retriesExhausted;
    private boolean closed;

    private Cancellable ticker = Cancellable.NONE;
    private Cancellable errorTimer = Cancellable.NONE;
    private Cancellable pendingRetry = Cancellable.NONE;

    public ClientSessionController(
            String roomId,
            SessionGatewayClient gateway,
            ClientScheduler scheduler,
            NetworkMonitor networkMonitor,
            ClientSettings settings
    ) {
        this.roomId = roomId;
        this.gateway = gateway;
        this.scheduler = scheduler;
        this.networkMonitor = networkMonitor;
        this.settings = settings;
        // 재연결 구간이 열리고 닫힐 때 에러 표시 여부가 바뀐다
        this.networkSubscription = networkMonitor.addListener(status -> notifyListeners());
    }

    /**
     * Loads the authoritative recording status and adopts it.
     *
     * @return {@code false} when ignored or when the status could not be loaded
     */
    public boolean refresh() {
        ControllerState previous;
        synchronized (this) {
            if (closed || isBusy()) {
                return false;
            }
            previous = state;
            state = ControllerState.REQUESTING;
        }
        notifyListeners();

        RecordingStatusResult status;
        try {
            status = gateway.recordingStatus(roomId);
        } catch (RuntimeException ex) {
            synchronized (this) {
                if (state == ControllerState.REQUESTING) {
                    state = previous;
                }
            }
            log.warn("Failed to check recording status for roomId={}: {}", roomId, ex.getMessage());
            notifyListeners();
            return false;
        }

        synchronized (this) {
            if (closed) {
                return false;
            }
            adopt(status);
            lastFailureKind = null;
        }
        notifyListeners();
        return true;
    }

    public boolean start() {
        synchronized (this) {
            if (closed || isBusy() || recording) {
                return false;
            }
            beginRequest(Operation.START);
        }
        notifyListeners();
        performStart();
        return true;
    }

    public boolean stop() {
        String target;
        synchronized (this) {
            if (closed || isBusy() || !recording || jobId == null) {
                return false;
            }
            target = jobId;
            beginRequest(Operation.STOP);
        }
        notifyListeners();
        performStop(target);
        return true;
    }

    public boolean toggle() {
        boolean currentlyRecording;
        synchronized (this) {
            currentlyRecording = recording;
        }
        return currentlyRecording ? stop() : start();
    }

    /**
     * Re-runs the failed operation after a backoff of 1s, 2s, 4s..., never sooner than the
     * server's {@code Retry-After}. Once the budget is spent the call makes no request and
     * surfaces {@link #RETRIES_EXHAUSTED_MESSAGE} instead.
     *
     * @return {@code true} when a retry was scheduled
     */
    public boolean retry() {
        boolean scheduled;
        synchronized (this) {
            if (closed || state != ControllerState.FAILED
                    || lastFailureKind == null || !lastFailureKind.isRetryable()) {
                return false;
            }
            if (retryCount >= settings.maxRetries()) {
                retriesExhausted = true;
                showError(RETRIES_EXHAUSTED_MESSAGE, lastFailureKind);
                log.warn("Recording retries exhausted for roomId={} after {} attempts", roomId, retryCount);
                scheduled = false;
            } else {
                Duration delay = settings.retryDelay(retryCount);
                if (lastRetryAfter != null && lastRetryAfter.compareTo(delay) > 0) {
                    delay = lastRetryAfter;
                }
                retryCount++;
                state = ControllerState.RETRYING;
                Operation operation = lastOperation;
                showError("Retrying in " + delay.toSeconds() + "s... (" + retryCount + "/" + settings.maxRetries() + ")",
                        lastFailureKind);
                pendingRetry = scheduler.schedule(() -> scheduler.execute(() -> runRetry(operation)), delay);
                scheduled = true;
            }
        }
        notifyListeners();
        return scheduled;
    }

    public synchronized ControllerState state() {
        return state;
    }

    public String formattedElapsed() {
        return snapshot().formattedElapsed();
    }

    public synchronized ControllerSnapshot snapshot() {
        boolean canRetry = state == ControllerState.FAILED
                && lastFailureKind != null
                && lastFailureKind.isRetryable()
                && retryCount < settings.maxRetries()
                && !retriesExhausted;
        boolean hideError = networkMonitor.isReconnecting();
        return new ControllerSnapshot(
                roomId,
                state,
                recording,
                jobId,
                recordingUrl,
                elapsedSeconds,
                hideError ? null : error,
                hideError ? null : errorKind,
                retryCount,
                retriesExhausted,
                canRetry
        );
    }

    public Cancellable addListener(Consumer<ControllerSnapshot> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            ticker.cancel();
            errorTimer.cancel();
            pendingRetry.cancel();
        }
        networkSubscription.cancel();
        listeners.clear();
    }

    static String formatElapsed(long seconds) {
        return String.format("%02d:%02d", seconds / 60, seconds % 60);
    }

    private void runRetry(Operation operation) {
        String target;
        synchronized (this) {
            if (closed || state != ControllerState.RETRYING) {
                return;
            }
            pendingRetry = Cancellable.NONE;
            if (operation == Operation.STOP && (!recording || jobId == null)) {
                state = recording ? ControllerState.ACTIVE : ControllerState.IDLE;
                return;
            }
            target = jobId;
            state = ControllerState.REQUESTING;
            clearError();
        }
        notifyListeners();
        if (operation == Operation.START) {
            performStart();
        } else {
            performStop(target);
        }
    }

    private void performStart() {
        RecordingStartResult result;
        try {
            result = gateway.startRecording(roomId);
        } catch (RuntimeException ex) {
            onFailure(Operation.START, ex);
            return;
        }
        synchronized (this) {
            if (closed) {
                return;
            }
            recording = true;
            jobId = result.egressId();
            elapsedSeconds = 0;
            state = ControllerState.ACTIVE;
            resetRetryBudget();
            clearError();
            startTicker();
        }
        log.info("Recording started roomId={} egressId={}", roomId, result.egressId());
        notifyListeners();
    }

    private void performStop(String target) {
        RecordingStopResult result;
        try {
            result = gateway.stopRecording(target);
        } catch (RuntimeException ex) {
            onFailure(Operation.STOP, ex);
            return;
        }
        synchronized (this) {
            if (closed) {
                return;
            }
            recording = false;
            jobId = null;
            ticker.cancel();
            recordingUrl = result.s3Url();
            state = ControllerState.IDLE;
            resetRetryBudget();
            if (result.isCompleted()) {
                clearError();
            } else {
                String reason = result.error() != null ? result.error() : STOPPED_WITH_ERRORS_MESSAGE;
                showError(reason, GatewayErrorKind.DEPENDENCY_FAILURE);
            }
        }
        log.info("Recording stopped roomId={} egressId={} status={}", roomId, target, result.status());
        notifyListeners();
    }

    private void onFailure(Operation operation, RuntimeException ex) {
        GatewayErrorKind kind = GatewayErrorKind.INTERNAL;
        Duration retryAfter = null;
        if (ex instanceof GatewayException gatewayException) {
            kind = gatewayException.getKind();
            retryAfter = gatewayException.getRetryAfter();
        }
        String message = ex.getMessage() != null ? ex.getMessage()
                : (operation == Operation.START ? "Failed to start recording" : "Failed to stop recording");
        // 충돌이나 (중지 시) 없는 작업은 서버 상태가 이미 바뀌었다는 뜻이다
        boolean stale = kind == GatewayErrorKind.CONFLICT
                || (operation == Operation.STOP && kind == GatewayErrorKind.NOT_FOUND);
        synchronized (this) {
            if (closed) {
                return;
            }
            state = stale ? ControllerState.REQUESTING : ControllerState.FAILED;
            lastOperation = operation;
            lastFailureKind = kind;
            lastRetryAfter = retryAfter;
            showError(message, kind);
        }
        if (ex instanceof GatewayException) {
            log.warn("Recording {} failed for roomId={} kind={}: {}", operation, roomId, kind, message);
        } else {
            log.error("Recording {} failed unexpectedly for roomId={}", operation, roomId, ex);
        }
        if (stale) {
            reconcile();
        }
        notifyListeners();
    }

    /**
     * Reloads the server's view after a rejected start or stop. The error stays on screen;
     * only recording, job id and state follow the server.
     */
    private void reconcile() {
        RecordingStatusResult status;
        try {
            status = gateway.recordingStatus(roomId);
        } catch (RuntimeException ex) {
            synchronized (this) {
                if (state == ControllerState.REQUESTING) {
                    state = ControllerState.FAILED;
                }
            }
            log.warn("Failed to reload recording status for roomId={}: {}", roomId, ex.getMessage());
            return;
        }
        synchronized (this) {
            if (closed) {
                return;
            }
            adopt(status);
            resetRetryBudget();
        }
        log.info("Recording state reloaded for roomId={} recording={} egressId={}",
                roomId, status.isRecording(), status.egressId());
    }

    // 아래 메서드는 모두 this 락을 잡은 상태에서 호출한다

    private boolean isBusy() {
        return state == ControllerState.REQUESTING || state == ControllerState.RETRYING;
    }

    private void beginRequest(Operation operation) {
        state = ControllerState.REQUESTING;
        lastOperation = operation;
        retriesExhausted = false;
        clearError();
    }

    private void resetRetryBudget() {
        retryCount = 0;
        retriesExhausted = false;
        lastFailureKind = null;
        lastRetryAfter = null;
    }

    private void adopt(RecordingStatusResult status) {
        boolean serverRecording = status.isRecording() && status.egressId() != null;
        if (serverRecording && !recording) {
            elapsedSeconds = 0;
            startTicker();
        } else if (!serverRecording) {
            ticker.cancel();
        }
        recording = serverRecording;
        jobId = serverRecording ? status.egressId() : null;
        if (status.recordingUrl() != null) {
            recordingUrl = status.recordingUrl();
        }
        state = serverRecording ? ControllerState.ACTIVE : ControllerState.IDLE;
    }

    private void startTicker() {
        ticker.cancel();
        ticker = scheduler.scheduleAtFixedRate(this::tick, settings.tickInterval());
    }

    private void tick() {
        synchronized (this) {
            if (closed || !recording || state == ControllerState.REQUESTING) {
                return;
            }
            elapsedSeconds++;
        }
        notifyListeners();
    }

    private void showError(String message, GatewayErrorKind kind) {
        error = message;
        errorKind = kind;
        long generation = ++errorGeneration;
        errorTimer.cancel();
        errorTimer = scheduler.schedule(() -> expireError(generation), settings.errorDisplayDuration());
    }

    private void clearError() {
        error = null;
        errorKind = null;
        errorGeneration++;
        errorTimer.cancel();
        errorTimer = Cancellable.NONE;
    }

    private void expireError(long generation) {
        synchronized (this) {
            if (closed || generation != errorGeneration) {
                return;
            }
            error = null;
            errorKind = null;
        }
        notifyListeners();
    }

    private void notifyListeners() {
        if (listeners.isEmpty()) {
            return;
        }
        ControllerSnapshot snapshot = snapshot();
        for (Consumer<ControllerSnapshot> listener : listeners) {
            listener.accept(snapshot);
        }
    }
}
