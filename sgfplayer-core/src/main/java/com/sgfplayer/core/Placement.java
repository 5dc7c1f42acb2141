package com.sgfplayer.core;

import java.util.Objects;

/**
 * Setup stone placed on the board before the first move (handicap or problem setup).
 */
public record Placement(Stone stone, Point point) {

    public Placement {
        Objects.requireNonNull(stone, "stone");
        Objects.requireNonNull(point, "point");
    }
}
