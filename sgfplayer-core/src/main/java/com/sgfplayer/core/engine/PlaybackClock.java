package com.sgfplayer.core.engine;

import java.time.Duration;

/**
 * Periodic tick source driving automatic playback. Implementations must deliver ticks on the same
 * logical thread that calls the engine.
 */
public interface PlaybackClock {

    /**
     * Starts ticking at the given interval, replacing any schedule that is already running.
     *
     * @param interval time between consecutive ticks
     * @param tick callback invoked on every tick
     */
    void start(Duration interval, Runnable tick);

    /**
     * Stops ticking. Once this method returns no further tick of the previous schedule starts.
     * Calling it while stopped does nothing.
     */
    void stop();

    boolean isRunning();
}
