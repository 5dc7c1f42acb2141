package com.sgfplayer.core.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sgfplayer.core.BoardSnapshot;
import com.sgfplayer.core.Move;
import com.sgfplayer.core.Point;
import com.sgfplayer.core.Stone;
import com.sgfplayer.core.sgf.GameRecord;
import com.sgfplayer.core.sgf.SgfParseException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PlaybackEngineTest {

    // B[ab] captures the white stone on aa
    private static final String TWELVE_MOVES =
            "(;SZ[9];B[ba];W[aa];B[ab];W[cc];B[dd];W[ee];B[ff];W[gg];B[hh];W[ii];B[ci];W[di])";

    private ManualPlaybackClock clock;
    private PlaybackEngine engine;
    private RecordingListener events;

    @BeforeEach
    void setUp() {
        clock = new ManualPlaybackClock();
        engine = new PlaybackEngine(clock);
        events = new RecordingListener();
        engine.addListener(events);
    }

    private static GameRecord record(String sgf) {
        try {
            return GameRecord.parse(sgf);
        } catch (SgfParseException ex) {
            throw new AssertionError(ex);
        }
    }

    @Test
    void newEngineIsIdleOnEmptyBoard() {
        assertSame(PlaybackState.IDLE, engine.getState());
        assertEquals(BoardSnapshot.DEFAULT_SIZE, engine.getBoardSize());
        assertEquals(0, engine.getBoard().stoneCount());
        assertEquals(0, engine.getCurrentIndex());
        assertEquals(0, engine.getMaxIndex());

        engine.play();
        assertFalse(engine.isPlaying());
        assertFalse(clock.isRunning());
    }

    @Test
    void loadShowsSetupPosition() {
        engine.load(record("(;SZ[19]AB[pd][dp];B[qq])"));

        assertSame(PlaybackState.READY, engine.getState());
        assertEquals(19, engine.getBoardSize());
        assertEquals(2, engine.getBoard().stoneCount(Stone.BLACK));
        assertEquals(0, engine.getCurrentIndex());
        assertEquals(1, engine.getMaxIndex());
        assertTrue(engine.getLastMove().isEmpty());
        assertEquals(1, events.positions);
    }

    @Test
    void stepForwardAppliesMovesUntilTheEnd() {
        engine.load(record("(;SZ[9];B[ee];W[cc])"));

        engine.stepForward();
        assertEquals(1, engine.getCurrentIndex());
        assertSame(Stone.BLACK, engine.getBoard().stoneAt(4, 4));
        assertEquals(Move.play(Stone.BLACK, 4, 4), engine.getLastMove().orElseThrow());

        engine.stepForward();
        BoardSnapshot last = engine.getBoard();
        engine.stepForward();

        assertEquals(2, engine.getCurrentIndex());
        assertSame(last, engine.getBoard());
        assertEquals(0, events.finished);
        assertEquals(3, events.positions);
    }

    @Test
    void stepBackRestoresCapturedStones() {
        engine.load(record(TWELVE_MOVES));
        engine.seek(3);
        assertEquals(1, engine.getBlackCaptures());
        assertEquals(1, engine.getLastCaptureCount());
        assertNull(engine.getBoard().stoneAt(0, 0));

        engine.stepBack();

        assertEquals(2, engine.getCurrentIndex());
        assertEquals(0, engine.getBlackCaptures());
        assertSame(Stone.WHITE, engine.getBoard().stoneAt(0, 0));

        engine.seek(0);
        engine.stepBack();
        assertEquals(0, engine.getCurrentIndex());
    }

    @Test
    void seekClampsToAvailableMoves() {
        engine.load(record(TWELVE_MOVES));

        engine.seek(100);
        assertEquals(12, engine.getCurrentIndex());

        engine.seek(-4);
        assertEquals(0, engine.getCurrentIndex());
        assertEquals(0, engine.getBoard().stoneCount());
    }

    @Test
    void seekingBackAndForthMatchesDirectSeek() {
        engine.load(record(TWELVE_MOVES));
        engine.seek(10);
        engine.seek(3);
        engine.seek(10);

        PlaybackEngine direct = new PlaybackEngine(new ManualPlaybackClock());
        direct.load(record(TWELVE_MOVES));
        direct.seek(10);

        assertEquals(direct.getBoard(), engine.getBoard());
        assertEquals(direct.getBlackCaptures(), engine.getBlackCaptures());
        assertEquals(direct.getWhiteCaptures(), engine.getWhiteCaptures());
        assertEquals(direct.getLastMove(), engine.getLastMove());
    }

    @Test
    void steppingMatchesSeeking() {
        engine.load(record(TWELVE_MOVES));
        for (int i = 0; i < 7; i++) {
            engine.stepForward();
        }
        BoardSnapshot stepped = engine.getBoard();

        engine.reset();
        engine.seek(7);

        assertEquals(stepped, engine.getBoard());
    }

    @Test
    void resetIsIdempotent() {
        engine.load(record("(;SZ[9]AB[cc];B[ba];W[aa];B[ab])"));
        engine.seek(3);

        engine.reset();
        BoardSnapshot first = engine.getBoard();
        engine.reset();

        assertEquals(first, engine.getBoard());
        assertEquals(1, engine.getBoard().stoneCount());
        assertEquals(0, engine.getBlackCaptures());
        assertEquals(0, engine.getWhiteCaptures());
        assertEquals(0, engine.getCurrentIndex());
    }

    @Test
    void eachStepRemovesAsManyStonesAsTheMoverCaptures() {
        // B[ab] takes the white corner stone, W[ih] takes the black one
        GameRecord game = record("(;SZ[9];B[ba];W[aa];B[ab];W[hi];B[ii];W[ih])");
        engine.load(game);

        int capturingSteps = 0;
        while (engine.getCurrentIndex() < engine.getMaxIndex()) {
            Stone mover = game.getMoves().get(engine.getCurrentIndex()).color();
            int stonesBefore = engine.getBoard().stoneCount();
            int capturesBefore = engine.getPosition().getCaptures(mover);

            engine.stepForward();

            int removed = stonesBefore + 1 - engine.getBoard().stoneCount();
            int gained = engine.getPosition().getCaptures(mover) - capturesBefore;
            assertEquals(removed, gained, "move " + engine.getCurrentIndex());
            assertEquals(gained, engine.getLastCaptureCount());
            if (gained > 0) {
                capturingSteps++;
            }
        }

        assertEquals(2, capturingSteps);
        assertEquals(1, engine.getBlackCaptures());
        assertEquals(1, engine.getWhiteCaptures());
    }

    @Test
    void passAndOffBoardMovesOnlyAdvanceTheIndex() {
        engine.load(record("(;SZ[9];B[ee];W[];B[tt])"));
        engine.stepForward();
        BoardSnapshot board = engine.getBoard();

        engine.stepForward();
        assertEquals(board, engine.getBoard());
        assertTrue(engine.getLastMove().isEmpty());

        engine.stepForward();
        assertEquals(board, engine.getBoard());
        assertEquals(3, engine.getCurrentIndex());
        assertEquals(0, engine.getBlackCaptures() + engine.getWhiteCaptures());
    }

    @Test
    void clearReturnsToIdleEmptyBoard() {
        engine.load(record("(;SZ[13]AB[dd];B[gg])"));
        engine.stepForward();

        engine.clear();

        assertSame(PlaybackState.IDLE, engine.getState());
        assertEquals(13, engine.getBoardSize());
        assertEquals(0, engine.getBoard().stoneCount());
        assertEquals(0, engine.getMaxIndex());
        assertTrue(engine.getSetup().isEmpty());
    }

    @Test
    void playStepsOnEveryTickAndFinishesOnce() {
        engine.load(record("(;SZ[9];B[ee];W[cc])"));
        engine.setPlayInterval(Duration.ofMillis(200));

        engine.play();
        assertTrue(engine.isPlaying());
        assertTrue(clock.isRunning());
        assertEquals(Duration.ofMillis(200), clock.interval());
        assertEquals(List.of(true), events.playing);

        clock.tick();
        clock.tick();
        assertEquals(2, engine.getCurrentIndex());
        assertTrue(engine.isPlaying());

        clock.tick();
        assertFalse(engine.isPlaying());
        assertFalse(clock.isRunning());
        assertEquals(1, events.finished);
        assertEquals(List.of(true, false), events.playing);

        clock.tick();
        assertEquals(1, events.finished);
    }

    @Test
    void pauseStopsTheClock() {
        engine.load(record(TWELVE_MOVES));
        engine.play();
        clock.tick();

        engine.pause();
        engine.pause();

        assertFalse(clock.isRunning());
        assertSame(PlaybackState.READY, engine.getState());
        assertEquals(1, engine.getCurrentIndex());
        assertEquals(List.of(true, false), events.playing);
    }

    @Test
    void togglePlaySwitchesState() {
        engine.load(record(TWELVE_MOVES));
        engine.togglePlay();
        assertTrue(engine.isPlaying());
        engine.togglePlay();
        assertFalse(engine.isPlaying());
    }

    @Test
    void seekAndResetStopPlaybackButStepBackDoesNot() {
        engine.load(record(TWELVE_MOVES));
        engine.play();
        clock.tick();
        clock.tick();

        engine.stepBack();
        assertTrue(engine.isPlaying());
        assertEquals(1, engine.getCurrentIndex());

        engine.seek(5);
        assertFalse(engine.isPlaying());

        engine.play();
        engine.reset();
        assertFalse(engine.isPlaying());
        assertFalse(clock.isRunning());
    }

    @Test
    void staleTickAfterLoadIsIgnored() {
        engine.load(record(TWELVE_MOVES));
        engine.play();
        Runnable staleTick = clock.currentTick();
        assertNotNull(staleTick);

        engine.load(record("(;SZ[9];B[ee])"));
        staleTick.run();

        assertEquals(0, engine.getCurrentIndex());
        assertEquals(0, engine.getBoard().stoneCount());
        assertFalse(engine.isPlaying());
    }

    @Test
    void staleTickAfterSeekIsIgnored() {
        engine.load(record(TWELVE_MOVES));
        engine.play();
        Runnable staleTick = clock.currentTick();

        engine.seek(4);
        staleTick.run();

        assertEquals(4, engine.getCurrentIndex());
    }

    @Test
    void changingIntervalWhilePlayingRestartsClock() {
        engine.load(record(TWELVE_MOVES));
        engine.play();
        Runnable oldTick = clock.currentTick();
        int starts = clock.starts();

        engine.setPlayInterval(Duration.ofMillis(10));

        assertEquals(starts + 1, clock.starts());
        assertEquals(PlaybackEngine.MIN_PLAY_INTERVAL, clock.interval());
        assertEquals(PlaybackEngine.MIN_PLAY_INTERVAL, engine.getPlayInterval());
        oldTick.run();
        assertEquals(0, engine.getCurrentIndex());
        clock.tick();
        assertEquals(1, engine.getCurrentIndex());
    }

    @Test
    void intervalChangeWhilePausedDoesNotStartClock() {
        engine.load(record(TWELVE_MOVES));
        engine.setPlayInterval(Duration.ofSeconds(2));
        assertFalse(clock.isRunning());
        assertEquals(0, clock.starts());
    }

    @Test
    void optimisticMoveIsAppendedAndShown() {
        engine.load(record("(;SZ[9];B[ee])"));
        engine.stepForward();

        engine.playMoveOptimistically(Stone.WHITE, 2, 2);

        assertEquals(2, engine.getMaxIndex());
        assertEquals(2, engine.getCurrentIndex());
        assertSame(Stone.WHITE, engine.getBoard().stoneAt(2, 2));
    }

    @Test
    void optimisticMoveWhileNavigatedBackShowsWholeGame() {
        engine.load(record("(;SZ[9];B[ee];W[cc])"));

        engine.playMoveOptimistically(Move.play(Stone.BLACK, 6, 6));

        assertEquals(3, engine.getCurrentIndex());
        assertEquals(3, engine.getBoard().stoneCount());
    }

    @Test
    void optimisticMoveOnIdleEngineMakesItReady() {
        engine.playMoveOptimistically(Stone.BLACK, 3, 3);
        assertSame(PlaybackState.READY, engine.getState());
        assertEquals(1, engine.getCurrentIndex());
    }

    @Test
    void remoteMovesMustArriveInOrder() {
        engine.load(record("(;SZ[9];B[ee])"));
        engine.seek(1);

        assertFalse(engine.applyRemoteMove(Stone.WHITE, 2, 2, 3));
        assertEquals(1, engine.getMaxIndex());

        assertTrue(engine.applyRemoteMove(Stone.WHITE, 2, 2, 2));
        assertEquals(2, engine.getMaxIndex());
        assertSame(Stone.WHITE, engine.getBoard().stoneAt(2, 2));
    }

    @Test
    void turnFollowsLastAppliedMove() {
        engine.load(record("(;SZ[9];B[ee];W[])"));
        assertSame(Stone.BLACK, engine.getTurn());
        engine.stepForward();
        assertSame(Stone.WHITE, engine.getTurn());
        engine.stepForward();
        assertSame(Stone.BLACK, engine.getTurn());
    }

    @Test
    void groupQueriesUseCurrentBoard() {
        engine.load(record("(;SZ[9];B[ee];B[fe];W[aa])"));
        engine.seek(3);

        assertEquals(2, engine.getGroup(new Point(4, 4)).size());
        assertTrue(engine.getGroup(new Point(20, 20)).isEmpty());
        assertFalse(engine.isSuicide(Stone.WHITE, new Point(0, 1)));
        assertTrue(engine.estimateTerritory(List.of()).isEmpty());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        PlaybackEngine isolated = new PlaybackEngine(new ManualPlaybackClock());
        RecordingListener second = new RecordingListener();
        isolated.addListener(new PlaybackListener() {
            @Override
            public void onPositionChanged(PlaybackEngine source) {
                throw new IllegalStateException("boom");
            }
        });
        isolated.addListener(second);

        isolated.load(record("(;SZ[9];B[ee])"));

        assertEquals(1, second.positions);
    }

    @Test
    void removedListenerReceivesNothing() {
        engine.removeListener(events);
        engine.load(record("(;SZ[9];B[ee])"));
        assertEquals(0, events.positions);
    }

    private static final class RecordingListener implements PlaybackListener {
        private int positions;
        private int finished;
        private final List<Boolean> playing = new ArrayList<>();

        @Override
        public void onPositionChanged(PlaybackEngine engine) {
            positions++;
        }

        @Override
        public void onPlayingChanged(PlaybackEngine engine, boolean isPlaying) {
            playing.add(isPlaying);
        }

        @Override
        public void onPlaybackFinished(PlaybackEngine engine) {
            finished++;
        }
    }
}
