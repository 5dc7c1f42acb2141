package com.sgfplayer.core.engine;

import com.sgfplayer.core.BoardSnapshot;
import com.sgfplayer.core.GamePosition;
import com.sgfplayer.core.GroupAnalyzer;
import com.sgfplayer.core.Move;
import com.sgfplayer.core.Placement;
import com.sgfplayer.core.Point;
import com.sgfplayer.core.Stone;
import com.sgfplayer.core.sgf.GameRecord;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replays a loaded {@link GameRecord} on a board and exposes playback controls.
 *
 * <p>The published {@link GamePosition} always equals the setup position with the first
 * {@link #getCurrentIndex()} moves applied in order. Backward navigation and seeking rebuild the
 * position from the setup instead of undoing moves.
 *
 * <p>The engine is not thread-safe. All calls, including the ticks of its {@link PlaybackClock},
 * must happen on one logical thread.
 */
public final class PlaybackEngine {

    public static final Duration DEFAULT_PLAY_INTERVAL = Duration.ofMillis(750);
    public static final Duration MIN_PLAY_INTERVAL = Duration.ofMillis(50);

    private static final Logger LOGGER = Logger.getLogger(PlaybackEngine.class.getName());

    private final PlaybackClock clock;
    private final List<PlaybackListener> listeners = new CopyOnWriteArrayList<>();

    private int boardSize = BoardSnapshot.DEFAULT_SIZE;
    private List<Placement> setup = List.of();
    private final List<Move> moves = new ArrayList<>();
    private GamePosition position = GamePosition.initial(boardSize, setup);
    private PlaybackState state = PlaybackState.IDLE;
    private Duration playInterval = DEFAULT_PLAY_INTERVAL;
    private long clockGeneration;

    public PlaybackEngine(PlaybackClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addListener(PlaybackListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(PlaybackListener listener) {
        listeners.remove(listener);
    }

    /**
     * Replaces the current game, discarding position, capture counts and any running playback.
     */
    public void load(GameRecord record) {
        Objects.requireNonNull(record, "record");
        boolean wasPlaying = haltClock();
        boardSize = record.getBoardSize();
        setup = record.getSetup();
        moves.clear();
        moves.addAll(record.getMoves());
        position = GamePosition.initial(boardSize, setup);
        state = PlaybackState.READY;
        LOGGER.info(() -> String.format("Loaded %dx%d game with %d setup stones and %d moves",
                boardSize, boardSize, setup.size(), moves.size()));
        if (wasPlaying) {
            firePlayingChanged(false);
        }
        firePositionChanged();
    }

    /**
     * Returns to the setup position, zeroing both capture counters and stopping playback.
     */
    public void reset() {
        pause();
        position = GamePosition.initial(boardSize, setup);
        firePositionChanged();
    }

    /**
     * Unloads the game and shows an empty board of the last known size.
     */
    public void clear() {
        pause();
        setup = List.of();
        moves.clear();
        position = GamePosition.initial(boardSize, setup);
        state = PlaybackState.IDLE;
        firePositionChanged();
    }

    /**
     * Applies the next move. At the end of the move list this does nothing, except that a running
     * playback is stopped and reported as finished.
     */
    public void stepForward() {
        int index = getCurrentIndex();
        if (index >= moves.size()) {
            if (state == PlaybackState.PLAYING) {
                pause();
                LOGGER.fine("Playback reached the end of the game");
                fire(listener -> listener.onPlaybackFinished(this));
            }
            return;
        }
        Move move = moves.get(index);
        position = position.applyMove(move);
        LOGGER.fine(() -> String.format("Applied move %d: %s, captured %d", index + 1, move, position.getLastCaptureCount()));
        firePositionChanged();
    }

    /**
     * Goes back one move by replaying the game from the setup position. Playback keeps running.
     */
    public void stepBack() {
        int index = getCurrentIndex();
        if (index == 0) {
            return;
        }
        position = replay(index - 1);
        firePositionChanged();
    }

    /**
     * Stops playback and rebuilds the position after {@code targetIndex} moves, clamped to the
     * available range.
     */
    public void seek(int targetIndex) {
        int clamped = Math.max(0, Math.min(targetIndex, moves.size()));
        pause();
        position = replay(clamped);
        firePositionChanged();
    }

    public void play() {
        if (state == PlaybackState.PLAYING) {
            return;
        }
        if (state == PlaybackState.IDLE) {
            LOGGER.fine("Ignoring play request without a loaded game");
            return;
        }
        state = PlaybackState.PLAYING;
        startClock();
        firePlayingChanged(true);
    }

    /**
     * Stops automatic playback. Safe to call at any time.
     */
    public void pause() {
        if (haltClock()) {
            firePlayingChanged(false);
        }
    }

    public void togglePlay() {
        if (state == PlaybackState.PLAYING) {
            pause();
        } else {
            play();
        }
    }

    /**
     * Changes the delay between automatic steps. A running playback continues at the new pace
     * from the current position.
     */
    public void setPlayInterval(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        playInterval = interval.compareTo(MIN_PLAY_INTERVAL) < 0 ? MIN_PLAY_INTERVAL : interval;
        if (state == PlaybackState.PLAYING) {
            startClock();
        }
    }

    public Duration getPlayInterval() {
        return playInterval;
    }

    /**
     * Appends a move that has not been confirmed yet and shows it immediately. A later
     * {@link #load(GameRecord)} replaces it together with the rest of the game.
     */
    public void playMoveOptimistically(Stone color, int x, int y) {
        playMoveOptimistically(Move.play(color, x, y));
    }

    public void playMoveOptimistically(Move move) {
        Objects.requireNonNull(move, "move");
        boolean atEnd = getCurrentIndex() == moves.size();
        moves.add(move);
        position = atEnd ? position.applyMove(move) : replay(moves.size());
        if (state == PlaybackState.IDLE) {
            state = PlaybackState.READY;
        }
        LOGGER.fine(() -> "Optimistic move " + move + " shown as move " + moves.size());
        firePositionChanged();
    }

    /**
     * Applies a move received from a remote source if it directly follows the known moves.
     *
     * @param moveNumber one-based number of the move in the game
     * @return {@code false} if the move was out of order and has been ignored
     */
    public boolean applyRemoteMove(Move move, int moveNumber) {
        int expected = moves.size() + 1;
        if (moveNumber != expected) {
            LOGGER.warning(() -> String.format("Rejecting out-of-order move %d, expected %d", moveNumber, expected));
            return false;
        }
        playMoveOptimistically(move);
        return true;
    }

    public boolean applyRemoteMove(Stone color, int x, int y, int moveNumber) {
        return applyRemoteMove(Move.play(color, x, y), moveNumber);
    }

    public GamePosition getPosition() {
        return position;
    }

    public BoardSnapshot getBoard() {
        return position.getBoard();
    }

    public Optional<Move> getLastMove() {
        return position.getLastMove();
    }

    public int getBlackCaptures() {
        return position.getBlackCaptures();
    }

    public int getWhiteCaptures() {
        return position.getWhiteCaptures();
    }

    public int getLastCaptureCount() {
        return position.getLastCaptureCount();
    }

    /**
     * Returns how many moves of the game are currently applied.
     */
    public int getCurrentIndex() {
        return position.getMoveNumber();
    }

    public int getMaxIndex() {
        return moves.size();
    }

    public int getBoardSize() {
        return boardSize;
    }

    public List<Move> getMoves() {
        return List.copyOf(moves);
    }

    public List<Placement> getSetup() {
        return setup;
    }

    public PlaybackState getState() {
        return state;
    }

    public boolean isPlaying() {
        return state == PlaybackState.PLAYING;
    }

    /**
     * Returns the colour to move after the current position.
     */
    public Stone getTurn() {
        int index = getCurrentIndex();
        return index == 0 ? Stone.BLACK : moves.get(index - 1).color().opponent();
    }

    public List<Point> getGroup(Point point) {
        if (!getBoard().isOnBoard(point)) {
            return List.of();
        }
        return GroupAnalyzer.collectGroup(getBoard(), point);
    }

    public boolean isSuicide(Stone color, Point point) {
        return GroupAnalyzer.isSuicide(getBoard(), color, point);
    }

    public Map<Point, Stone> estimateTerritory(Collection<Point> deadStones) {
        return GroupAnalyzer.estimateTerritory(getBoard(), deadStones);
    }

    private GamePosition replay(int count) {
        GamePosition replayed = GamePosition.initial(boardSize, setup);
        for (int i = 0; i < count; i++) {
            replayed = replayed.applyMove(moves.get(i));
        }
        return replayed;
    }

    private void startClock() {
        long generation = ++clockGeneration;
        clock.start(playInterval, () -> onTick(generation));
    }

    /**
     * Cancels the clock and leaves the playing state. Returns {@code true} if playback was running.
     */
    private boolean haltClock() {
        clockGeneration++;
        clock.stop();
        if (state != PlaybackState.PLAYING) {
            return false;
        }
        state = PlaybackState.READY;
        return true;
    }

    private void onTick(long generation) {
        if (generation != clockGeneration || state != PlaybackState.PLAYING) {
            LOGGER.fine("Ignoring stale playback tick");
            return;
        }
        stepForward();
    }

    private void firePositionChanged() {
        fire(listener -> listener.onPositionChanged(this));
    }

    private void firePlayingChanged(boolean playing) {
        fire(listener -> listener.onPlayingChanged(this, playing));
    }

    private void fire(Consumer<PlaybackListener> event) {
        for (PlaybackListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "Playback listener failed", ex);
            }
        }
    }
}
