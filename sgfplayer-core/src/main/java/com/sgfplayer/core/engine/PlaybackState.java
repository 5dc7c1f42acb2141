package com.sgfplayer.core.engine;

/**
 * Life-cycle of a {@link PlaybackEngine}.
 */
public enum PlaybackState {
    /** No game loaded, the board is empty. */
    IDLE,
    /** A game is loaded and playback is stopped. */
    READY,
    /** The playback clock is stepping forward on every tick. */
    PLAYING
}
