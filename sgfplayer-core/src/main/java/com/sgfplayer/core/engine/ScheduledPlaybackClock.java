package com.sgfplayer.core.engine;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link PlaybackClock} backed by a single daemon scheduler thread. The clock doubles as an
 * {@link Executor} for that thread so that callers can marshal every engine call onto it.
 */
public final class ScheduledPlaybackClock implements PlaybackClock, Executor, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ScheduledPlaybackClock.class.getName());

    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> activeTask;

    public ScheduledPlaybackClock() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r, "sgf-playback-clock");
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        this.scheduler = executor;
    }

    @Override
    public synchronized void start(Duration interval, Runnable tick) {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(tick, "tick");
        stop();
        long millis = Math.max(1L, interval.toMillis());
        activeTask = scheduler.scheduleAtFixedRate(() -> runLogged(tick), millis, millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void stop() {
        if (activeTask != null) {
            activeTask.cancel(false);
            activeTask = null;
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return activeTask != null;
    }

    /**
     * Runs a task on the clock thread, after any tick that is already executing.
     */
    @Override
    public void execute(Runnable command) {
        Objects.requireNonNull(command, "command");
        scheduler.execute(() -> runLogged(command));
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdownNow();
    }

    private static void runLogged(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException ex) {
            // the scheduler would otherwise swallow the exception and cancel a periodic task
            LOGGER.log(Level.WARNING, "Task on playback clock failed", ex);
        }
    }
}
