package com.streamroom.backend.modules.session.presentation.dto;

import java.time.Instant;
import java.util.List;

import com.streamroom.backend.modules.recording.domain.EgressJobInfo;

public record RecordingJobResponse(
        String egressId,
        String roomName,
        String status,
        Instant startedAt,
        Instant endedAt,
        List<String> files,
        String error
) {

    public static RecordingJobResponse from(EgressJobInfo job) {
        return new RecordingJobResponse(
                job.jobId(),
                job.roomName(),
                job.status().providerName(),
                job.startedAt(),
                job.endedAt(),
                job.artifacts(),
                job.error()
        );
    }
}
