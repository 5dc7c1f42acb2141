package com.sgfplayer.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Zero-based board intersection. {@code x} is the column, {@code y} the row counted from the top.
 */
public record Point(int x, int y) {

    /**
     * Returns {@code true} if this point lies on a square board of the given size.
     */
    public boolean isOnBoard(int size) {
        return x >= 0 && y >= 0 && x < size && y < size;
    }

    /**
     * Returns the orthogonal neighbours that lie on the board, in the order left, right, up, down.
     */
    public List<Point> neighbors(int size) {
        List<Point> result = new ArrayList<>(4);
        if (x > 0) {
            result.add(new Point(x - 1, y));
        }
        if (x < size - 1) {
            result.add(new Point(x + 1, y));
        }
        if (y > 0) {
            result.add(new Point(x, y - 1));
        }
        if (y < size - 1) {
            result.add(new Point(x, y + 1));
        }
        return result;
    }
}
