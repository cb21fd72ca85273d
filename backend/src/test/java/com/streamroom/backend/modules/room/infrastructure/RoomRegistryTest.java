package com.streamroom.backend.modules.room.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import com.streamroom.backend.modules.room.domain.RecordingState;
import com.streamroom.backend.modules.room.domain.Room;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RoomRegistryTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private RoomRegistry registry;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        registry = new RoomRegistry(new RoomIdGenerator(clock, new SecureRandom()), clock);
    }

    @Test
    @DisplayName("새 방은 활성 상태이고 녹화 이력이 없다")
    void createReturnsActiveIdleRoom() {
        Room room = registry.create("Alice");

        assertThat(room.id()).matches("room_" + NOW.toEpochMilli() + "_[0-9a-z]{9}");
        assertThat(room.ownerIdentity()).isEqualTo("Alice");
        assertThat(room.createdAt()).isEqualTo(NOW);
        assertThat(room.active()).isTrue();
        assertThat(room.isRecordingActive()).isFalse();
        assertThat(room.recording()).isEqualTo(RecordingState.IDLE);
        assertThat(registry.find(room.id())).contains(room);
    }

    @Test
    void createdIdsAreDistinct() {
        Room first = registry.create("Alice");
        Room second = registry.create("Alice");

        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("방 종료는 멱등이다")
    void endIsIdempotent() {
        Room room = registry.create("Alice");

        Optional<Room> first = registry.end(room.id());
        Optional<Room> second = registry.end(room.id());

        assertThat(first).isPresent();
        assertThat(first.get().active()).isFalse();
        assertThat(first.get().endedAt()).isEqualTo(NOW);
        assertThat(second).contains(first.get());
    }

    @Test
    void endUnknownRoomIsEmpty() {
        assertThat(registry.end("room_missing")).isEmpty();
        assertThat(registry.find("room_missing")).isEmpty();
    }

    @Test
    @DisplayName("update 중 예외가 나면 저장된 방은 바뀌지 않는다")
    void rejectedMutationLeavesRoomUnchanged() {
        Room room = registry.create("Alice");

        assertThatThrownBy(() -> registry.update(room.id(), current -> {
            throw new IllegalStateException("rejected");
        })).isInstanceOf(IllegalStateException.class).hasMessage("rejected");

        assertThat(registry.find(room.id())).contains(room);
    }

    @Test
    void mutationMustKeepRoomId() {
        Room room = registry.create("Alice");
        Room other = Room.open("room_other", "Bob", NOW);

        assertThatThrownBy(() -> registry.update(room.id(), current -> other))
                .isInstanceOf(IllegalStateException.class);
        assertThat(registry.find(room.id())).contains(room);
    }

    @Test
    void findByJobIdScansRecordingState() {
        Room room = registry.create("Alice");
        registry.update(room.id(), current -> current.withRecording(
                new RecordingState.Active("EG_1", "live-recordings/x.mp4", NOW)));

        assertThat(registry.findByJobId("EG_1")).map(Room::id).contains(room.id());
        assertThat(registry.findByJobId("EG_2")).isEmpty();
    }

    @Test
    void snapshotsAreNotAffectedByLaterUpdates() {
        Room room = registry.create("Alice");
        Room snapshot = registry.find(room.id()).orElseThrow();

        registry.end(room.id());

        assertThat(snapshot.active()).isTrue();
        assertThat(registry.findAll()).extracting(Room::active).containsExactly(false);
    }
}
