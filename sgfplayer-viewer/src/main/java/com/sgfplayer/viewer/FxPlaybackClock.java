package com.sgfplayer.viewer;

import com.sgfplayer.core.engine.PlaybackClock;
import java.time.Duration;
import java.util.Objects;
import javafx.animation.KeyFrame;
import javafx.animation.Timeline;

/**
 * {@link PlaybackClock} that ticks on the JavaFX application thread.
 */
final class FxPlaybackClock implements PlaybackClock {

    private Timeline timeline;

    @Override
    public void start(Duration interval, Runnable tick) {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(tick, "tick");
        stop();
        timeline = new Timeline(new KeyFrame(
                javafx.util.Duration.millis(interval.toMillis()),
                event -> tick.run()));
        timeline.setCycleCount(Timeline.INDEFINITE);
        timeline.play();
    }

    @Override
    public void stop() {
        if (timeline != null) {
            timeline.stop();
            timeline = null;
        }
    }

    @Override
    public boolean isRunning() {
        return timeline != null;
    }
}
