package com.streamroom.backend.modules.session.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import com.streamroom.backend.global.error.ErrorCode;
import com.streamroom.backend.global.error.ProblemException;
import com.streamroom.backend.modules.credential.application.CredentialIssuer;
import com.streamroom.backend.modules.credential.domain.ParticipantGrants;
import com.streamroom.backend.modules.recording.application.RecordingCoordinator;
import com.streamroom.backend.modules.recording.domain.RecordingStart;
import com.streamroom.backend.modules.room.domain.RecordingStatus;
import com.streamroom.backend.modules.room.domain.Room;
import com.streamroom.backend.modules.room.infrastructure.RoomIdGenerator;
import com.streamroom.backend.modules.room.infrastructure.RoomRegistry;
import com.streamroom.backend.modules.session.application.SessionGateway.JoinCredential;
import com.streamroom.backend.modules.session.application.SessionGateway.RoomCreation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionGatewayTest {

    private static final String SERVER_URL = "wss://demo.livekit.cloud";

    @Mock
    private CredentialIssuer credentialIssuer;

    @Mock
    private RecordingCoordinator recordingCoordinator;

    private RoomRegistry roomRegistry;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        roomRegistry = new RoomRegistry(new RoomIdGenerator(clock, new SecureRandom()), clock);
        lenient().when(credentialIssuer.isAvailable()).thenReturn(true);
        lenient().when(credentialIssuer.serverUrl()).thenReturn(SERVER_URL);
    }

    private SessionGateway gateway(ViewerJoinPolicy policy) {
        return new SessionGateway(roomRegistry, recordingCoordinator, credentialIssuer,
                new SessionProperties("https://stream.example.com/", policy));
    }

    @Test
    @DisplayName("방 생성 시 호스트 토큰과 공유 링크를 돌려준다")
    void createRoomIssuesOwnerCredential() {
        when(credentialIssuer.issue(anyString(), eq("Alice"), eq(ParticipantGrants.owner()))).thenReturn("jwt-owner");

        RoomCreation creation = gateway(ViewerJoinPolicy.PERMISSIVE).createRoom("Alice");

        assertThat(creation.joinCredential()).isEqualTo("jwt-owner");
        assertThat(creation.serverUrl()).isEqualTo(SERVER_URL);
        assertThat(creation.shareableReference()).isEqualTo("https://stream.example.com/stream/" + creation.room().id());
        assertThat(roomRegistry.find(creation.room().id())).map(Room::active).contains(true);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "Al!ce", "Alice\t", "<script>", "012345678901234567890123456789012345678901234567890"})
    void createRoomRejectsMalformedOwner(String owner) {
        assertThatThrownBy(() -> gateway(ViewerJoinPolicy.PERMISSIVE).createRoom(owner))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_IDENTITY));
        assertThat(roomRegistry.size()).isZero();
        verify(credentialIssuer, never()).issue(anyString(), anyString(), any());
    }

    @Test
    void createRoomAcceptsSpacesUnderscoresAndHyphens() {
        when(credentialIssuer.issue(anyString(), anyString(), any())).thenReturn("jwt");

        assertThat(gateway(ViewerJoinPolicy.PERMISSIVE).createRoom("Alice Kim_the-host").room().ownerIdentity())
                .isEqualTo("Alice Kim_the-host");
    }

    @Test
    void createRoomWithoutCredentialsCreatesNothing() {
        when(credentialIssuer.isAvailable()).thenReturn(false);

        assertThatThrownBy(() -> gateway(ViewerJoinPolicy.PERMISSIVE).createRoom("Alice"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.CREDENTIALS_UNAVAILABLE));
        assertThat(roomRegistry.size()).isZero();
    }

    @Test
    @DisplayName("토큰 서명에 실패하면 방금 만든 방은 종료된다")
    void createRoomEndsRoomWhenSigningFails() {
        when(credentialIssuer.issue(anyString(), anyString(), any()))
                .thenThrow(new ProblemException(ErrorCode.CREDENTIALS_UNAVAILABLE, "secret rejected"));

        assertThatThrownBy(() -> gateway(ViewerJoinPolicy.PERMISSIVE).createRoom("Alice"))
                .isInstanceOf(ProblemException.class);

        assertThat(roomRegistry.findAll()).singleElement().satisfies(room -> assertThat(room.active()).isFalse());
    }

    @Test
    void viewerGetsSubscribeOnlyGrants() {
        Room room = roomRegistry.create("Alice");
        when(credentialIssuer.issue(room.id(), "Bob", ParticipantGrants.viewer())).thenReturn("jwt-viewer");

        JoinCredential credential = gateway(ViewerJoinPolicy.PERMISSIVE).issueJoinCredential(room.id(), "Bob", false);

        assertThat(credential.token()).isEqualTo("jwt-viewer");
        assertThat(credential.asOwner()).isFalse();
        assertThat(credential.roomId()).isEqualTo(room.id());
        assertThat(ParticipantGrants.viewer().canPublish()).isFalse();
    }

    @Test
    void permissivePolicyLetsViewersJoinUnknownRooms() {
        when(credentialIssuer.issue("room_unknown", "Bob", ParticipantGrants.viewer())).thenReturn("jwt");

        assertThat(gateway(ViewerJoinPolicy.PERMISSIVE).issueJoinCredential("room_unknown", "Bob", false).token())
                .isEqualTo("jwt");
        assertThat(roomRegistry.size()).isZero();
    }

    @Test
    void strictPolicyRejectsUnknownRooms() {
        assertThatThrownBy(() -> gateway(ViewerJoinPolicy.STRICT).issueJoinCredential("room_unknown", "Bob", false))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.ROOM_NOT_FOUND));
        verify(credentialIssuer, never()).issue(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("종료된 방에는 호스트도 시청자도 참가할 수 없다")
    void endedRoomRejectsEveryone() {
        Room room = roomRegistry.create("Alice");
        roomRegistry.end(room.id());
        SessionGateway gateway = gateway(ViewerJoinPolicy.PERMISSIVE);

        assertThatThrownBy(() -> gateway.issueJoinCredential(room.id(), "Bob", false))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.ROOM_ENDED));
        assertThatThrownBy(() -> gateway.issueJoinCredential(room.id(), "Alice", true))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.ROOM_ENDED));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "room 1", "room/../x", "room?x=1"})
    void malformedRoomIdIsRejectedBeforeLookup(String roomId) {
        assertThatThrownBy(() -> gateway(ViewerJoinPolicy.PERMISSIVE).issueJoinCredential(roomId, "Bob", false))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_ROOM_ID));
        verify(credentialIssuer, never()).issue(anyString(), anyString(), any());
    }

    @Test
    void endRoomTwiceSucceedsTwice() {
        Room room = roomRegistry.create("Alice");
        SessionGateway gateway = gateway(ViewerJoinPolicy.PERMISSIVE);

        Room first = gateway.endRoom(room.id());
        Room second = gateway.endRoom(room.id());

        assertThat(first.active()).isFalse();
        assertThat(second.endedAt()).isEqualTo(first.endedAt());
    }

    @Test
    void endUnknownRoomIsNotFound() {
        assertThatThrownBy(() -> gateway(ViewerJoinPolicy.PERMISSIVE).endRoom("room_unknown"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.ROOM_NOT_FOUND));
    }

    @Test
    void stopRecordingValidatesJobId() {
        SessionGateway gateway = gateway(ViewerJoinPolicy.PERMISSIVE);

        assertThatThrownBy(() -> gateway.stopRecording(" "))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_JOB_ID));
        assertThatThrownBy(() -> gateway.stopRecording("E".repeat(101)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_JOB_ID));
        verifyNoInteractions(recordingCoordinator);
    }

    @Test
    void startRecordingDelegatesAfterValidation() {
        RecordingStart start = new RecordingStart("EG_1", "room_a", "live-recordings/room_a/1.mp4",
                RecordingStatus.STARTING);
        when(recordingCoordinator.startRecording("room_a")).thenReturn(start);

        assertThat(gateway(ViewerJoinPolicy.PERMISSIVE).startRecording("room_a")).isEqualTo(start);
    }
}
