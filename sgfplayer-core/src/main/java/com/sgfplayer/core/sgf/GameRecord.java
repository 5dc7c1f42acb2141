package com.sgfplayer.core.sgf;

import com.sgfplayer.core.BoardSnapshot;
import com.sgfplayer.core.Move;
import com.sgfplayer.core.Placement;
import com.sgfplayer.core.Point;
import com.sgfplayer.core.Stone;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable playable game reconstructed from the main line of an SGF record: board size,
 * descriptive information, setup stones and the ordered move list.
 */
public final class GameRecord {

    private final int boardSize;
    private final GameInfo info;
    private final List<Placement> setup;
    private final List<Move> moves;

    public GameRecord(int boardSize, GameInfo info, List<Placement> setup, List<Move> moves) {
        if (boardSize < BoardSnapshot.MIN_SIZE || boardSize > BoardSnapshot.MAX_SIZE) {
            throw new IllegalArgumentException("Board size must be between " + BoardSnapshot.MIN_SIZE
                    + " and " + BoardSnapshot.MAX_SIZE + ": " + boardSize);
        }
        this.boardSize = boardSize;
        this.info = Objects.requireNonNull(info, "info");
        this.setup = List.copyOf(setup);
        this.moves = List.copyOf(moves);
    }

    /**
     * Parses SGF text and builds the game of its main line.
     */
    public static GameRecord parse(String sgf) throws SgfParseException {
        return fromNodes(SgfParser.parse(sgf));
    }

    /**
     * Folds main-line nodes into a game. Missing or malformed properties fall back to defaults;
     * this method never fails on content.
     */
    public static GameRecord fromNodes(List<SgfNode> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        Integer boardSize = null;
        Map<String, String> metadata = new HashMap<>();
        List<Placement> setup = new ArrayList<>();
        List<Move> moves = new ArrayList<>();

        for (SgfNode node : nodes) {
            for (String key : node.keys()) {
                List<String> values = node.values(key);
                switch (key) {
                    case "SZ" -> {
                        if (boardSize == null && node.first(key) != null) {
                            boardSize = parseBoardSize(node.first(key));
                        }
                    }
                    case "AB" -> addSetup(setup, Stone.BLACK, values);
                    case "AW" -> addSetup(setup, Stone.WHITE, values);
                    case "B" -> moves.add(new Move(Stone.BLACK, SgfCoordinates.decode(node.first(key)).orElse(null)));
                    case "W" -> moves.add(new Move(Stone.WHITE, SgfCoordinates.decode(node.first(key)).orElse(null)));
                    case "EV", "PB", "PW", "BR", "WR", "RE", "DT", "TM", "OT", "KM", "RU" -> {
                        if (!metadata.containsKey(key)) {
                            values.stream().filter(v -> !v.isEmpty()).findFirst().ifPresent(v -> metadata.put(key, v));
                        }
                    }
                    default -> {
                        // not needed for replay
                    }
                }
            }
        }

        GameInfo info = new GameInfo(
                metadata.get("EV"),
                metadata.get("PB"),
                metadata.get("PW"),
                metadata.get("BR"),
                metadata.get("WR"),
                metadata.get("RE"),
                metadata.get("DT"),
                metadata.get("TM"),
                metadata.get("OT"),
                metadata.get("KM"),
                metadata.get("RU"));
        return new GameRecord(boardSize == null ? BoardSnapshot.DEFAULT_SIZE : boardSize, info, setup, moves);
    }

    public int getBoardSize() {
        return boardSize;
    }

    public GameInfo getInfo() {
        return info;
    }

    public List<Placement> getSetup() {
        return setup;
    }

    public List<Move> getMoves() {
        return moves;
    }

    /**
     * Returns the number of black setup stones, or an empty result for an even game.
     */
    public OptionalInt handicap() {
        int count = (int) setup.stream().filter(placement -> placement.stone() == Stone.BLACK).count();
        return count > 0 ? OptionalInt.of(count) : OptionalInt.empty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof GameRecord that)) {
            return false;
        }
        return boardSize == that.boardSize && info.equals(that.info) && setup.equals(that.setup)
                && moves.equals(that.moves);
    }

    @Override
    public int hashCode() {
        return Objects.hash(boardSize, info, setup, moves);
    }

    @Override
    public String toString() {
        return String.format("GameRecord[size=%d, setup=%d, moves=%d, black=%s, white=%s]",
                boardSize, setup.size(), moves.size(), info.playerBlack(), info.playerWhite());
    }

    /**
     * Reads an {@code SZ} value. {@code "W:H"} uses the smaller side since boards are square here.
     * Returns {@code null} if the value holds no number at all.
     */
    static Integer parseBoardSize(String value) {
        String trimmed = value.trim();
        int colon = trimmed.indexOf(':');
        Integer size;
        if (colon >= 0) {
            int left = parseIntOr(trimmed.substring(0, colon), BoardSnapshot.DEFAULT_SIZE);
            int right = parseIntOr(trimmed.substring(colon + 1), left);
            size = Math.min(left, right);
        } else {
            try {
                size = Integer.parseInt(trimmed);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return Math.max(BoardSnapshot.MIN_SIZE, Math.min(BoardSnapshot.MAX_SIZE, size));
    }

    private static int parseIntOr(String text, int fallback) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static void addSetup(List<Placement> setup, Stone stone, List<String> values) {
        for (String value : values) {
            Optional<Point> point = SgfCoordinates.decode(value);
            point.ifPresent(p -> setup.add(new Placement(stone, p)));
        }
    }
}
