package com.streamroom.backend.modules.room.infrastructure;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

import com.streamroom.backend.modules.room.domain.Room;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory source of truth for rooms.
 * <p>
 * Values are immutable {@link Room} snapshots. Every mutation goes through
 * {@link ConcurrentHashMap#computeIfPresent}, which runs the check and the write for one key
 * atomically while leaving other rooms uncontended. Mutation functions must not block.
 */
@Component
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);
    private static final int MAX_ID_ATTEMPTS = 5;

    private final ConcurrentMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final RoomIdGenerator idGenerator;
    private final Clock clock;

    public RoomRegistry(RoomIdGenerator idGenerator, Clock clock) {
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    public Room create(String ownerIdentity) {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            Room candidate = Room.open(idGenerator.nextId(), ownerIdentity, clock.instant());
            if (rooms.putIfAbsent(candidate.id(), candidate) == null) {
                log.info("Room created roomId={} owner={} totalRooms={}", candidate.id(), ownerIdentity, rooms.size());
                return candidate;
            }
            log.warn("Room id collision on {}, regenerating", candidate.id());
        }
        throw new IllegalStateException("Could not generate a unique room id after " + MAX_ID_ATTEMPTS + " attempts");
    }

    public Optional<Room> find(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    /**
     * Marks the room inactive. Ending an ended room is a successful no-op.
     *
     * @return the ended room, or empty when no such room exists
     */
    public Optional<Room> end(String roomId) {
        return update(roomId, room -> room.end(clock.instant()));
    }

    /**
     * Atomically replaces the room with {@code mutation.apply(current)}. An exception thrown by the
     * mutation propagates and leaves the stored room unchanged.
     *
     * @return the stored room after the mutation, or empty when no such room exists
     */
    public Optional<Room> update(String roomId, UnaryOperator<Room> mutation) {
        return Optional.ofNullable(rooms.computeIfPresent(roomId, (id, current) -> {
            Room next = mutation.apply(current);
            if (next == null || !next.id().equals(id)) {
                throw new IllegalStateException("Room mutation must return the same room");
            }
            return next;
        }));
    }

    public Optional<Room> findByJobId(String jobId) {
        return rooms.values().stream()
                .filter(room -> room.recordingJobId().filter(jobId::equals).isPresent())
                .findFirst();
    }

    public List<Room> findAll() {
        return rooms.values().stream()
                .sorted(Comparator.comparing(Room::createdAt).thenComparing(Room::id))
                .toList();
    }

    public int size() {
        return rooms.size();
    }
}
