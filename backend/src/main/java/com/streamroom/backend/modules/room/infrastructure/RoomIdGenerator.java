package com.streamroom.backend.modules.room.infrastructure;

import java.security.SecureRandom;
import java.time.Clock;

import org.springframework.stereotype.Component;

/**
 * Generates ids of the form {@code room_{epochMillis}_{9 base36 chars}}.
 */
@Component
public class RoomIdGenerator {

    private static final String PREFIX = "room_";
    private static final char[] ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int RANDOM_LENGTH = 9;

    private final Clock clock;
    private final SecureRandom random;

    public RoomIdGenerator(Clock clock, SecureRandom random) {
        this.clock = clock;
        this.random = random;
    }

    public String nextId() {
        StringBuilder builder = new StringBuilder(PREFIX.length() + 24)
                .append(PREFIX)
                .append(clock.millis())
                .append('_');
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            builder.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return builder.toString();
    }
}
