package com.streamroom.client.network;

import java.time.Instant;

public record NetworkStatus(
        boolean online,
        boolean reconnecting,
        Instant lastDisconnectedAt,
        int reconnectAttempts
) {
}
