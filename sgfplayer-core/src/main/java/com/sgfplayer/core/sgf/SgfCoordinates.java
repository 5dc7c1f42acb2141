package com.sgfplayer.core.sgf;

import com.sgfplayer.core.Point;
import java.util.Optional;

/**
 * Conversion between SGF point values ({@code "aa"} is the top-left corner) and board points.
 */
public final class SgfCoordinates {

    private static final int LETTERS = 26;

    private SgfCoordinates() {
    }

    /**
     * Decodes a two-letter SGF point. Any other length, or a letter before {@code 'a'}, yields an
     * empty result, which callers treat as a pass.
     */
    public static Optional<Point> decode(String value) {
        if (value == null || value.length() != 2) {
            return Optional.empty();
        }
        int x = value.charAt(0) - 'a';
        int y = value.charAt(1) - 'a';
        if (x < 0 || y < 0) {
            return Optional.empty();
        }
        return Optional.of(new Point(x, y));
    }

    /**
     * Encodes a point as two lower-case letters, or returns an empty string if it cannot be
     * expressed.
     */
    public static String encode(Point point) {
        if (point == null || point.x() < 0 || point.y() < 0 || point.x() >= LETTERS || point.y() >= LETTERS) {
            return "";
        }
        return new String(new char[] {(char) ('a' + point.x()), (char) ('a' + point.y())});
    }

    /**
     * Formats a point the way Go players read it: a column letter without {@code I} followed by
     * the row counted from the bottom edge, e.g. {@code D4}.
     */
    public static String toHumanReadable(Point point, int boardSize) {
        if (point == null || !point.isOnBoard(boardSize)) {
            return "pass";
        }
        char column = (char) ('A' + point.x() + (point.x() >= 8 ? 1 : 0));
        return column + String.valueOf(boardSize - point.y());
    }
}
