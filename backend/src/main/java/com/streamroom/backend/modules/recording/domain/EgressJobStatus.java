package com.streamroom.backend.modules.recording.domain;

import java.util.Locale;

/**
 * Job status as reported by the egress provider (LiveKit {@code EgressStatus}).
 */
public enum EgressJobStatus {
    STARTING("EGRESS_STARTING"),
    ACTIVE("EGRESS_ACTIVE"),
    ENDING("EGRESS_ENDING"),
    COMPLETE("EGRESS_COMPLETE"),
    FAILED("EGRESS_FAILED"),
    ABORTED("EGRESS_ABORTED"),
    LIMIT_REACHED("EGRESS_LIMIT_REACHED"),
    UNKNOWN("EGRESS_UNKNOWN");

    private final String providerName;

    EgressJobStatus(String providerName) {
        this.providerName = providerName;
    }

    public String providerName() {
        return providerName;
    }

    public static EgressJobStatus fromProvider(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (EgressJobStatus status : values()) {
            if (status.providerName.equals(normalized) || status.name().equals(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
