package com.streamroom.client.scheduling;

import java.time.Duration;

/**
 * Timer source for retries, error auto-clear and the elapsed counter.
 * Swapped for a manual implementation in tests.
 */
public interface ClientScheduler {

    Cancellable schedule(Runnable task, Duration delay);

    Cancellable scheduleAtFixedRate(Runnable task, Duration period);

    /**
     * Runs blocking work, such as a gateway call, without holding up timer tasks.
     */
    void execute(Runnable task);

    @FunctionalInterface
    interface Cancellable {

        Cancellable NONE = () -> { };

        void cancel();
    }
}
