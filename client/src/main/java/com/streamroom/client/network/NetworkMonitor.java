package com.streamroom.client.network;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import com.streamroom.client.scheduling.ClientScheduler;
import com.streamroom.client.scheduling.ClientScheduler.Cancellable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks connectivity signals from the host environment.
 * <p>
 * Coming back online after more than {@link #RECONNECT_THRESHOLD} offline opens a short
 * reconnecting window during which consumers should hide transient errors. Advisory only:
 * nothing here blocks or retries requests.
 */
public class NetworkMonitor {

    private static final Logger log = LoggerFactory.getLogger(NetworkMonitor.class);

    public static final Duration RECONNECT_THRESHOLD = Duration.ofSeconds(5);
    public static final Duration RECONNECT_WINDOW = Duration.ofSeconds(3);

    private final Clock clock;
    private final ClientScheduler scheduler;
    private final List<Consumer<NetworkStatus>> listeners = new CopyOnWriteArrayList<>();

    private boolean online = true;
    private boolean reconnecting;
    private Instant lastDisconnectedAt;
    private int reconnectAttempts;
    private Cancellable windowTimer = Cancellable.NONE;

    public NetworkMonitor(Clock clock, ClientScheduler scheduler) {
        this.clock = clock;
        this.scheduler = scheduler;
    }

    public void wentOffline() {
        NetworkStatus snapshot;
        synchronized (this) {
            if (!online) {
                return;
            }
            online = false;
            lastDisconnectedAt = clock.instant();
            snapshot = status();
        }
        log.info("Network offline");
        notifyListeners(snapshot);
    }

    public void cameOnline() {
        NetworkStatus snapshot;
        synchronized (this) {
            if (online) {
                return;
            }
            online = true;
            Duration offlineFor = Duration.between(lastDisconnectedAt, clock.instant());
            if (offlineFor.compareTo(RECONNECT_THRESHOLD) > 0) {
                reconnecting = true;
                reconnectAttempts++;
                windowTimer.cancel();
                windowTimer = scheduler.schedule(this::closeReconnectWindow, RECONNECT_WINDOW);
                log.info("Network back after {}s, reconnecting (attempt {})", offlineFor.toSeconds(), reconnectAttempts);
            }
            snapshot = status();
        }
        notifyListeners(snapshot);
    }

    public synchronized boolean isReconnecting() {
        return reconnecting;
    }

    public synchronized NetworkStatus status() {
        return new NetworkStatus(online, reconnecting, lastDisconnectedAt, reconnectAttempts);
    }

    /**
     * @return handle that unregisters the listener
     */
    public Cancellable addListener(Consumer<NetworkStatus> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void closeReconnectWindow() {
        NetworkStatus snapshot;
        synchronized (this) {
            if (!reconnecting) {
                return;
            }
            reconnecting = false;
            snapshot = status();
        }
        notifyListeners(snapshot);
    }

    private void notifyListeners(NetworkStatus snapshot) {
        for (Consumer<NetworkStatus> listener : listeners) {
            listener.accept(snapshot);
        }
    }
}
