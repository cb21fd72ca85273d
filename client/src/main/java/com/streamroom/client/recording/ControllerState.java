package com.streamroom.client.recording;

public enum ControllerState {
    /** Not recording, nothing in flight. */
    IDLE,
    /** A start, stop or status call is in flight. */
    REQUESTING,
    ACTIVE,
    /** A retry is scheduled and waiting for its backoff delay. */
    RETRYING,
    /** The last start or stop failed; see the snapshot's error kind. */
    FAILED
}
