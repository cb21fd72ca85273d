package com.streamroom.client.recording;

import com.streamroom.client.gateway.GatewayErrorKind;

/**
 * Immutable view of the controller for rendering. {@code error} is already filtered for
 * display (hidden during a reconnect window, cleared after the display timeout).
 */
public record ControllerSnapshot(
        String roomId,
        ControllerState state,
        boolean recording,
        String jobId,
        String recordingUrl,
        long elapsedSeconds,
        String error,
        GatewayErrorKind errorKind,
        int retryCount,
        boolean retriesExhausted,
        boolean canRetry
) {

    public String formattedElapsed() {
        return ClientSessionController.formatElapsed(elapsedSeconds);
    }

    public boolean isBusy() {
        return state == ControllerState.REQUESTING || state == ControllerState.RETRYING;
    }
}
