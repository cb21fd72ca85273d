package com.streamroom.backend.modules.session.application;

/**
 * How viewer joins treat a room id the registry has never seen.
 * Ended rooms are refused under both policies.
 */
public enum ViewerJoinPolicy {
    /**
     * Unknown rooms are joinable; favours availability (e.g. after a restart wiped the registry).
     */
    PERMISSIVE,
    /**
     * Unknown rooms are rejected with {@code ROOM_NOT_FOUND}.
     */
    STRICT
}
