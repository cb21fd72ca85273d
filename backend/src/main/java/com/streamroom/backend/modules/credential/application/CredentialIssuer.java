package com.streamroom.backend.modules.credential.application;

import com.streamroom.backend.modules.credential.domain.ParticipantGrants;

/**
 * Mints signed, time-bounded capability tokens for the real-time media server.
 */
public interface CredentialIssuer {

    /**
     * @throws com.streamroom.backend.global.error.ProblemException with
     *         {@code CREDENTIALS_UNAVAILABLE} when signing keys are not configured
     */
    String issue(String roomId, String identity, ParticipantGrants grants);

    boolean isAvailable();

    /**
     * URL clients connect to with the issued token.
     */
    String serverUrl();
}
