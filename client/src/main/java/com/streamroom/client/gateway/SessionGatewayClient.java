package com.streamroom.client.gateway;

/**
 * Recording operations of the backend session gateway.
 * Implementations throw {@link GatewayException} for every failure.
 */
public interface SessionGatewayClient {

    RecordingStartResult startRecording(String roomId);

    RecordingStopResult stopRecording(String jobId);

    RecordingStatusResult recordingStatus(String roomId);
}
