package com.sgfplayer.core;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable position reached after replaying a number of moves on top of the setup stones.
 * The position keeps the board, the running capture tallies of both colours, and the marker of
 * the last placed stone.
 */
public final class GamePosition {

    private final BoardSnapshot board;
    private final int blackCaptures;
    private final int whiteCaptures;
    private final Move lastMove;
    private final int lastCaptureCount;
    private final int moveNumber;

    private GamePosition(BoardSnapshot board, int blackCaptures, int whiteCaptures, Move lastMove,
            int lastCaptureCount, int moveNumber) {
        this.board = board;
        this.blackCaptures = blackCaptures;
        this.whiteCaptures = whiteCaptures;
        this.lastMove = lastMove;
        this.lastCaptureCount = lastCaptureCount;
        this.moveNumber = moveNumber;
    }

    /**
     * Creates the position before the first move. Setup stones outside the board are ignored;
     * later placements on the same point overwrite earlier ones.
     */
    public static GamePosition initial(int size, List<Placement> setup) {
        Objects.requireNonNull(setup, "setup");
        BoardSnapshot board = BoardSnapshot.empty(size);
        for (Placement placement : setup) {
            if (board.isOnBoard(placement.point())) {
                board = board.withStone(placement.point(), placement.stone());
            }
        }
        return new GamePosition(board, 0, 0, null, 0, 0);
    }

    public BoardSnapshot getBoard() {
        return board;
    }

    /**
     * Returns the number of white stones captured by Black.
     */
    public int getBlackCaptures() {
        return blackCaptures;
    }

    /**
     * Returns the number of black stones captured by White.
     */
    public int getWhiteCaptures() {
        return whiteCaptures;
    }

    /**
     * Returns the number of stones captured by the given colour.
     */
    public int getCaptures(Stone capturer) {
        return capturer == Stone.BLACK ? blackCaptures : whiteCaptures;
    }

    /**
     * Returns the last stone placed on the board. Empty after a pass, an off-board move, or when no
     * move has been applied yet.
     */
    public Optional<Move> getLastMove() {
        return Optional.ofNullable(lastMove);
    }

    /**
     * Returns how many stones the most recently applied move captured.
     */
    public int getLastCaptureCount() {
        return lastCaptureCount;
    }

    /**
     * Returns how many moves have been applied since the setup position.
     */
    public int getMoveNumber() {
        return moveNumber;
    }

    /**
     * Applies the provided move and returns the resulting position.
     *
     * <p>The move is never rejected: an occupied target is overwritten, and a stone whose group is
     * left without liberties is removed again unless the same move captured something. Passes and
     * points outside the board leave the board untouched.
     */
    public GamePosition applyMove(Move move) {
        Objects.requireNonNull(move, "move");
        Point target = move.point();
        if (move.isPass() || !board.isOnBoard(target)) {
            return new GamePosition(board, blackCaptures, whiteCaptures, null, 0, moveNumber + 1);
        }

        Stone color = move.color();
        Stone opponent = color.opponent();
        BoardSnapshot updated = board.withStone(target, color);

        int captured = 0;
        Set<Point> inspected = new HashSet<>();
        for (Point neighbor : target.neighbors(updated.size())) {
            if (updated.stoneAt(neighbor) != opponent || inspected.contains(neighbor)) {
                continue;
            }
            List<Point> group = GroupAnalyzer.collectGroup(updated, neighbor);
            inspected.addAll(group);
            if (GroupAnalyzer.liberties(updated, group).isEmpty()) {
                captured += group.size();
                updated = updated.withoutStones(group);
            }
        }

        if (captured == 0) {
            List<Point> own = GroupAnalyzer.collectGroup(updated, target);
            if (GroupAnalyzer.liberties(updated, own).isEmpty()) {
                updated = updated.withoutStones(own);
            }
        }

        int newBlack = blackCaptures + (color == Stone.BLACK ? captured : 0);
        int newWhite = whiteCaptures + (color == Stone.WHITE ? captured : 0);
        return new GamePosition(updated, newBlack, newWhite, move, captured, moveNumber + 1);
    }
}
