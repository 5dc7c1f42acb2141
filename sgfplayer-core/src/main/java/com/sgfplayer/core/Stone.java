package com.sgfplayer.core;

/**
 * Colour of a stone on the board. An empty intersection has no stone at all.
 */
public enum Stone {
    BLACK,
    WHITE;

    /**
     * Returns the other colour.
     */
    public Stone opponent() {
        return this == BLACK ? WHITE : BLACK;
    }
}
