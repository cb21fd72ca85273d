package com.streamroom.backend.modules.recording.application;

import java.util.List;

import com.streamroom.backend.modules.recording.domain.EgressDestination;
import com.streamroom.backend.modules.recording.domain.EgressFilter;
import com.streamroom.backend.modules.recording.domain.EgressJobInfo;
import com.streamroom.backend.modules.recording.domain.EgressResult;

/**
 * External encode-and-upload service. Implementations throw
 * {@link com.streamroom.backend.modules.recording.domain.EgressProviderException} on failure.
 */
public interface EgressProvider {

    /**
     * Starts recording the room.
     *
     * @return the provider's job id
     */
    String start(String roomId, EgressDestination destination);

    EgressResult stop(String jobId);

    List<EgressJobInfo> list(EgressFilter filter);

    /**
     * False when the provider is not configured; recording is then disabled while rooms keep working.
     */
    boolean isAvailable();
}
