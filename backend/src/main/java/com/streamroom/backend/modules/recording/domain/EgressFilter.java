package com.streamroom.backend.modules.recording.domain;

/**
 * Provider-side job query. Null components are not filtered on.
 */
public record EgressFilter(String roomName, String jobId, boolean activeOnly) {
}
