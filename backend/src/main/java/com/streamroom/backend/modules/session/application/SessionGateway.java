package com.streamroom.backend.modules.session.application;

import static com.streamroom.backend.modules.session.application.SessionInputValidator.requireIdentity;
import static com.streamroom.backend.modules.session.application.SessionInputValidator.requireJobId;
import static com.streamroom.backend.modules.session.application.SessionInputValidator.requireRoomId;

import java.util.List;
import java.util.Optional;

import com.streamroom.backend.global.error.ErrorCode;
import com.streamroom.backend.global.error.ProblemException;
import com.streamroom.backend.modules.credential.application.CredentialIssuer;
import com.streamroom.backend.modules.credential.domain.ParticipantGrants;
import com.streamroom.backend.modules.recording.application.RecordingCoordinator;
import com.streamroom.backend.modules.recording.domain.EgressFilter;
import com.streamroom.backend.modules.recording.domain.EgressJobInfo;
import com.streamroom.backend.modules.recording.domain.RecordingStart;
import com.streamroom.backend.modules.recording.domain.RecordingStatusView;
import com.streamroom.backend.modules.recording.domain.RecordingStop;
import com.streamroom.backend.modules.room.domain.Room;
import com.streamroom.backend.modules.room.infrastructure.RoomRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Public operation surface for rooms, join credentials and recordings.
 * Inputs are validated here before any registry or coordinator call.
 */
@Service
public class SessionGateway {

    private static final Logger log = LoggerFactory.getLogger(SessionGateway.class);

    private final RoomRegistry roomRegistry;
    private final RecordingCoordinator recordingCoordinator;
    private final CredentialIssuer credentialIssuer;
    private final SessionProperties sessionProperties;

    public SessionGateway(
            RoomRegistry roomRegistry,
            RecordingCoordinator recordingCoordinator,
            CredentialIssuer credentialIssuer,
            SessionProperties sessionProperties
    ) {
        this.roomRegistry = roomRegistry;
        this.recordingCoordinator = recordingCoordinator;
        this.credentialIssuer = credentialIssuer;
        this.sessionProperties = sessionProperties;
    }

    public RoomCreation createRoom(String ownerIdentity) {
        requireIdentity(ownerIdentity);
        if (!credentialIssuer.isAvailable()) {
            throw new ProblemException(ErrorCode.CREDENTIALS_UNAVAILABLE);
        }

        Room room = roomRegistry.create(ownerIdentity);
        String token;
        try {
            token = credentialIssuer.issue(room.id(), ownerIdentity, ParticipantGrants.owner());
        } catch (RuntimeException ex) {
            roomRegistry.end(room.id());
            log.warn("Owner credential failed for roomId={}, room ended: {}", room.id(), ex.getMessage());
            throw ex;
        }
        return new RoomCreation(
                room,
                token,
                sessionProperties.shareUrl(room.id()),
                credentialIssuer.serverUrl()
        );
    }

    public JoinCredential issueJoinCredential(String roomId, String identity, boolean asOwner) {
        requireRoomId(roomId);
        requireIdentity(identity);

        Optional<Room> room = roomRegistry.find(roomId);
        if (room.isPresent() && !room.get().active()) {
            throw new ProblemException(ErrorCode.ROOM_ENDED);
        }
        if (room.isEmpty() && !asOwner) {
            if (sessionProperties.viewerJoinPolicy() == ViewerJoinPolicy.STRICT) {
                throw new ProblemException(ErrorCode.ROOM_NOT_FOUND,
                        "Room not found: The stream you are trying to join does not exist");
            }
            log.info("Viewer join for unknown roomId={} allowed by {} policy", roomId, ViewerJoinPolicy.PERMISSIVE);
        }

        String token = credentialIssuer.issue(roomId, identity, ParticipantGrants.forRole(asOwner));
        return new JoinCredential(token, credentialIssuer.serverUrl(), roomId, identity, asOwner);
    }

    public Room getRoom(String roomId) {
        requireRoomId(roomId);
        return roomRegistry.find(roomId)
                .orElseThrow(() -> new ProblemException(ErrorCode.ROOM_NOT_FOUND));
    }

    public Room endRoom(String roomId) {
        requireRoomId(roomId);
        Room ended = roomRegistry.end(roomId)
                .orElseThrow(() -> new ProblemException(ErrorCode.ROOM_NOT_FOUND,
                        "Room not found: The stream you are trying to end does not exist"));
        log.info("Room ended roomId={} recordingActive={}", roomId, ended.isRecordingActive());
        return ended;
    }

    public RecordingStart startRecording(String roomId) {
        return recordingCoordinator.startRecording(requireRoomId(roomId));
    }

    public RecordingStop stopRecording(String jobId) {
        return recordingCoordinator.stopRecording(requireJobId(jobId));
    }

    public RecordingStatusView recordingStatus(String roomId) {
        return recordingCoordinator.status(requireRoomId(roomId));
    }

    /**
     * Provider job listing, optionally narrowed to one room, one job, or jobs still running.
     */
    public List<EgressJobInfo> listRecordingJobs(String roomId, String jobId, boolean activeOnly) {
        EgressFilter filter = new EgressFilter(
                roomId != null ? requireRoomId(roomId) : null,
                jobId != null ? requireJobId(jobId) : null,
                activeOnly
        );
        return recordingCoordinator.listJobs(filter);
    }

    public boolean isRecordingAvailable() {
        return recordingCoordinator.isRecordingAvailable();
    }

    public record RoomCreation(Room room, String joinCredential, String shareableReference, String serverUrl) {
    }

    public record JoinCredential(String token, String serverUrl, String roomId, String identity, boolean asOwner) {
    }
}
