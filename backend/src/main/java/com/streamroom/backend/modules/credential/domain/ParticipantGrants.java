package com.streamroom.backend.modules.credential.domain;

/**
 * Media permissions requested for one participant in one room.
 * Owners publish; everyone subscribes and may use the data channel.
 */
public record ParticipantGrants(boolean canPublish, boolean canSubscribe, boolean canPublishData) {

    private static final ParticipantGrants OWNER = new ParticipantGrants(true, true, true);
    private static final ParticipantGrants VIEWER = new ParticipantGrants(false, true, true);

    public static ParticipantGrants owner() {
        return OWNER;
    }

    public static ParticipantGrants viewer() {
        return VIEWER;
    }

    public static ParticipantGrants forRole(boolean asOwner) {
        return asOwner ? OWNER : VIEWER;
    }
}
