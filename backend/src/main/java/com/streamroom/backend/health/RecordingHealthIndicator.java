package com.streamroom.backend.health;

import com.streamroom.backend.modules.recording.application.RecordingCoordinator;
import com.streamroom.backend.modules.room.domain.Room;
import com.streamroom.backend.modules.room.infrastructure.RoomRegistry;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposed as the {@code recording} health component. Missing recording configuration
 * is reported as a detail, not as DOWN.
 */
@Component("recording")
public class RecordingHealthIndicator implements HealthIndicator {

    static final String AVAILABLE = "available";

    private final RecordingCoordinator recordingCoordinator;
    private final RoomRegistry roomRegistry;

    public RecordingHealthIndicator(RecordingCoordinator recordingCoordinator, RoomRegistry roomRegistry) {
        this.recordingCoordinator = recordingCoordinator;
        this.roomRegistry = roomRegistry;
    }

    @Override
    public Health health() {
        long activeRooms = roomRegistry.findAll().stream().filter(Room::active).count();
        long activeRecordings = roomRegistry.findAll().stream().filter(Room::isRecordingActive).count();
        return Health.up()
                .withDetail(AVAILABLE, recordingCoordinator.isRecordingAvailable())
                .withDetail("activeRooms", activeRooms)
                .withDetail("activeRecordings", activeRecordings)
                .build();
    }
}
