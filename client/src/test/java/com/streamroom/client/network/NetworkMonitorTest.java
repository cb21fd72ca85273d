package com.streamroom.client.network;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.streamroom.client.support.ManualClientScheduler;
import com.streamroom.client.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NetworkMonitorTest {

    private MutableClock clock;
    private ManualClientScheduler scheduler;
    private NetworkMonitor monitor;
    private List<NetworkStatus> events;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        scheduler = new ManualClientScheduler(clock);
        monitor = new NetworkMonitor(clock, scheduler);
        events = new ArrayList<>();
        monitor.addListener(events::add);
    }

    @Test
    @DisplayName("5초 넘게 끊겼다가 복구되면 3초 동안 재연결 상태가 된다")
    void longOutageOpensReconnectWindow() {
        monitor.wentOffline();
        scheduler.advance(Duration.ofSeconds(6));
        monitor.cameOnline();

        assertThat(monitor.isReconnecting()).isTrue();
        assertThat(monitor.status().reconnectAttempts()).isEqualTo(1);
        assertThat(monitor.status().online()).isTrue();

        scheduler.advance(Duration.ofMillis(2999));
        assertThat(monitor.isReconnecting()).isTrue();
        scheduler.advance(Duration.ofMillis(1));
        assertThat(monitor.isReconnecting()).isFalse();

        assertThat(events).extracting(NetworkStatus::reconnecting).containsExactly(false, true, false);
    }

    @Test
    void shortOutageDoesNotReconnect() {
        monitor.wentOffline();
        scheduler.advance(Duration.ofSeconds(5));
        monitor.cameOnline();

        assertThat(monitor.isReconnecting()).isFalse();
        assertThat(monitor.status().reconnectAttempts()).isZero();
        assertThat(events).extracting(NetworkStatus::online).containsExactly(false, true);
    }

    @Test
    void repeatedSignalsAreIgnored() {
        monitor.cameOnline();
        monitor.wentOffline();
        monitor.wentOffline();

        assertThat(events).hasSize(1);
        assertThat(monitor.status().lastDisconnectedAt()).isEqualTo(clock.instant());
    }

    @Test
    void reconnectAttemptsAccumulate() {
        for (int i = 0; i < 2; i++) {
            monitor.wentOffline();
            scheduler.advance(Duration.ofSeconds(10));
            monitor.cameOnline();
            scheduler.advance(Duration.ofSeconds(3));
        }

        assertThat(monitor.status().reconnectAttempts()).isEqualTo(2);
        assertThat(monitor.isReconnecting()).isFalse();
    }
}
