package com.sgfplayer.core;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable square Go board. Each intersection either holds a {@link Stone} or is empty, in which
 * case {@link #stoneAt(int, int)} returns {@code null}. Every mutation returns a new snapshot.
 */
public final class BoardSnapshot {

    public static final int MIN_SIZE = 2;
    public static final int MAX_SIZE = 25;
    public static final int DEFAULT_SIZE = 19;

    private final int size;
    private final Stone[] cells; // row-major, index = y * size + x

    /**
     * Creates an empty board of the given size.
     */
    public BoardSnapshot(int size) {
        this(checkSize(size), new Stone[size * size]);
    }

    private BoardSnapshot(int size, Stone[] cells) {
        this.size = size;
        this.cells = cells;
    }

    public static BoardSnapshot empty(int size) {
        return new BoardSnapshot(size);
    }

    public int size() {
        return size;
    }

    /**
     * Returns {@code true} if the point lies on this board.
     */
    public boolean isOnBoard(Point point) {
        return point != null && point.isOnBoard(size);
    }

    /**
     * Returns the stone at the given intersection, or {@code null} if it is empty.
     */
    public Stone stoneAt(int x, int y) {
        return cells[index(x, y)];
    }

    public Stone stoneAt(Point point) {
        return stoneAt(point.x(), point.y());
    }

    public boolean isEmpty(Point point) {
        return stoneAt(point) == null;
    }

    /**
     * Returns a new snapshot with {@code stone} placed on {@code point}, overwriting any stone
     * that was already there.
     */
    public BoardSnapshot withStone(Point point, Stone stone) {
        int index = index(point.x(), point.y());
        if (cells[index] == stone) {
            return this;
        }
        Stone[] updated = cells.clone();
        updated[index] = stone;
        return new BoardSnapshot(size, updated);
    }

    /**
     * Returns a new snapshot with every listed intersection emptied.
     */
    public BoardSnapshot withoutStones(Collection<Point> points) {
        if (points.isEmpty()) {
            return this;
        }
        Stone[] updated = cells.clone();
        for (Point point : points) {
            updated[index(point.x(), point.y())] = null;
        }
        return new BoardSnapshot(size, updated);
    }

    /**
     * Returns the number of stones on the board.
     */
    public int stoneCount() {
        int count = 0;
        for (Stone cell : cells) {
            if (cell != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the number of stones of one colour on the board.
     */
    public int stoneCount(Stone stone) {
        int count = 0;
        for (Stone cell : cells) {
            if (cell == stone) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns all occupied intersections in row-major order.
     */
    public Map<Point, Stone> stones() {
        Map<Point, Stone> result = new LinkedHashMap<>();
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                Stone stone = cells[y * size + x];
                if (stone != null) {
                    result.put(new Point(x, y), stone);
                }
            }
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof BoardSnapshot that)) {
            return false;
        }
        return size == that.size && Arrays.equals(cells, that.cells);
    }

    @Override
    public int hashCode() {
        return 31 * size + Arrays.hashCode(cells);
    }

    /**
     * Renders the board as text, one row per line: {@code X} black, {@code O} white, {@code .} empty.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(size * (size + 1));
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                Stone stone = cells[y * size + x];
                builder.append(stone == null ? '.' : stone == Stone.BLACK ? 'X' : 'O');
            }
            builder.append('\n');
        }
        return builder.toString();
    }

    private int index(int x, int y) {
        if (x < 0 || y < 0 || x >= size || y >= size) {
            throw new IllegalArgumentException("Point (" + x + ", " + y + ") is outside a " + size + "x" + size + " board");
        }
        return y * size + x;
    }

    private static int checkSize(int size) {
        if (size < MIN_SIZE || size > MAX_SIZE) {
            throw new IllegalArgumentException(
                    "Board size must be between " + MIN_SIZE + " and " + MAX_SIZE + ": " + size);
        }
        return size;
    }
}
