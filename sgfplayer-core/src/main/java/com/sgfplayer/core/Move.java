package com.sgfplayer.core;

import java.util.Objects;

/**
 * A single move of a game record. A {@code null} point denotes a pass.
 */
public record Move(Stone color, Point point) {

    public Move {
        Objects.requireNonNull(color, "color");
    }

    public static Move play(Stone color, int x, int y) {
        return new Move(color, new Point(x, y));
    }

    public static Move pass(Stone color) {
        return new Move(color, null);
    }

    public boolean isPass() {
        return point == null;
    }
}
