package com.streamroom.backend.modules.recording.domain;

/**
 * The egress provider was reached (or attempted) but did not return a usable answer.
 */
public class EgressProviderException extends RuntimeException {

    public EgressProviderException(String message) {
        super(message);
    }

    public EgressProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
