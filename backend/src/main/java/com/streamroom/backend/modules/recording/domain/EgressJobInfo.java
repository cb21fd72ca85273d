package com.streamroom.backend.modules.recording.domain;

import java.time.Instant;
import java.util.List;

public record EgressJobInfo(
        String jobId,
        String roomName,
        EgressJobStatus status,
        Instant startedAt,
        Instant endedAt,
        List<String> artifacts,
        String error
) {

    public EgressJobInfo {
        status = status != null ? status : EgressJobStatus.UNKNOWN;
        artifacts = artifacts != null ? List.copyOf(artifacts) : List.of();
    }
}
