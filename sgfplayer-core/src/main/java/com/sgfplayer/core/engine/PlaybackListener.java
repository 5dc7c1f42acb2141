package com.sgfplayer.core.engine;

/**
 * Observer of a {@link PlaybackEngine}. Callbacks run on the engine's thread after the mutation
 * that triggered them has completed, so the engine can be queried from inside a callback.
 */
public interface PlaybackListener {

    /**
     * Called whenever a new board snapshot has been published.
     */
    default void onPositionChanged(PlaybackEngine engine) {
    }

    /**
     * Called when the playback clock starts or stops.
     */
    default void onPlayingChanged(PlaybackEngine engine, boolean playing) {
    }

    /**
     * Called once when playback runs past the last move.
     */
    default void onPlaybackFinished(PlaybackEngine engine) {
    }
}
