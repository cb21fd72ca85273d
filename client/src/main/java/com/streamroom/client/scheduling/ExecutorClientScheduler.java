package com.streamroom.client.scheduling;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ClientScheduler} with one daemon timer thread and one daemon worker thread for
 * blocking work.
 */
public class ExecutorClientScheduler implements ClientScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorClientScheduler.class);

    private final ScheduledExecutorService executor;
    private final ExecutorService worker;

    public ExecutorClientScheduler() {
        this("streamroom-client-timer");
    }

    public ExecutorClientScheduler(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, threadName));
        this.worker = Executors.newSingleThreadExecutor(r -> daemon(r, threadName + "-worker"));
    }

    private static Thread daemon(Runnable runnable, String name) {
        Thread t = new Thread(runnable, name);
        t.setDaemon(true);
        return t;
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, Duration period) {
        long millis = period.toMillis();
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(guarded(task), millis, millis, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void execute(Runnable task) {
        worker.execute(guarded(task));
    }

    /**
     * An uncaught exception would silently cancel a periodic task.
     */
    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduled client task failed", e);
            }
        };
    }

    @Override
    public void close() {
        shutdown(executor);
        shutdown(worker);
    }

    private static void shutdown(ExecutorService service) {
        service.shutdown();
        try {
            if (!service.awaitTermination(2, TimeUnit.SECONDS)) {
                service.shutdownNow();
            }
        } catch (InterruptedException e) {
            service.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
