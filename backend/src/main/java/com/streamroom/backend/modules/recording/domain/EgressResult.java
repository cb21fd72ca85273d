package com.streamroom.backend.modules.recording.domain;

import java.util.List;

/**
 * Provider response to a stop command.
 *
 * @param artifacts uploaded object keys, in provider order
 * @param error     provider-side error text, if any
 */
public record EgressResult(String jobId, EgressJobStatus status, List<String> artifacts, String error) {

    public EgressResult {
        status = status != null ? status : EgressJobStatus.UNKNOWN;
        artifacts = artifacts != null ? List.copyOf(artifacts) : List.of();
    }
}
