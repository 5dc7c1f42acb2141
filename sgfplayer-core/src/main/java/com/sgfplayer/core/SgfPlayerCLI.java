package com.sgfplayer.core;

import com.sgfplayer.core.config.PlayerSettings;
import com.sgfplayer.core.config.SettingsStore;
import com.sgfplayer.core.engine.PlaybackEngine;
import com.sgfplayer.core.engine.PlaybackListener;
import com.sgfplayer.core.engine.ScheduledPlaybackClock;
import com.sgfplayer.core.library.GameEntry;
import com.sgfplayer.core.library.GameLibrary;
import com.sgfplayer.core.sgf.GameInfo;
import com.sgfplayer.core.sgf.SgfCoordinates;
import com.sgfplayer.core.sgf.SgfParseException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Scanner;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Console front-end that replays an SGF file move by move.
 */
public final class SgfPlayerCLI {

    private static final Logger LOGGER = Logger.getLogger(SgfPlayerCLI.class.getName());

    private SgfPlayerCLI() {
    }

    public static void main(String[] args) {
        configureLogging();
        List<String> arguments = Arrays.asList(args);
        Path file = arguments.stream()
                .filter(arg -> !arg.startsWith("--"))
                .findFirst()
                .map(Paths::get)
                .orElse(null);
        if (file == null) {
            printUsage();
            return;
        }

        PlayerSettings settings;
        GameEntry entry;
        try {
            settings = PlayerSettings.fromArgs(arguments, new SettingsStore().load());
            entry = new GameLibrary().loadFile(file);
        } catch (IllegalArgumentException | UncheckedIOException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            printUsage();
            return;
        } catch (IOException | SgfParseException ex) {
            LOGGER.log(Level.SEVERE, "Failed to load " + file, ex);
            return;
        }

        try (ScheduledPlaybackClock clock = new ScheduledPlaybackClock()) {
            PlaybackEngine engine = new PlaybackEngine(clock);
            engine.addListener(new PlaybackListener() {
                @Override
                public void onPositionChanged(PlaybackEngine source) {
                    printBoard(source);
                }

                @Override
                public void onPlaybackFinished(PlaybackEngine source) {
                    System.out.println("End of game.");
                }
            });

            printHeader(entry);
            clock.execute(() -> {
                engine.setPlayInterval(settings.moveInterval());
                engine.load(entry.record());
                if (settings.startGameOnLaunch()) {
                    engine.play();
                }
            });
            runCommandLoop(clock, engine);
        }
    }

    private static void runCommandLoop(ScheduledPlaybackClock clock, PlaybackEngine engine) {
        Scanner scanner = new Scanner(System.in);
        System.out.println("Commands: n(ext), p(revious), g <move>, r(eset), play, pause, q(uit)");
        while (scanner.hasNextLine()) {
            String input = scanner.nextLine().trim();
            if (input.isEmpty()) {
                continue;
            }
            String[] parts = input.split("\\s+");
            switch (parts[0]) {
                case "n" -> clock.execute(engine::stepForward);
                case "p" -> clock.execute(engine::stepBack);
                case "r" -> clock.execute(engine::reset);
                case "play" -> clock.execute(engine::play);
                case "pause" -> clock.execute(engine::pause);
                case "g" -> {
                    if (parts.length < 2) {
                        System.out.println("Usage: g <move>");
                        continue;
                    }
                    int target;
                    try {
                        target = Integer.parseInt(parts[1]);
                    } catch (NumberFormatException ex) {
                        System.out.println("Please enter a valid move number.");
                        continue;
                    }
                    clock.execute(() -> engine.seek(target));
                }
                case "q" -> {
                    return;
                }
                default -> System.out.println("Unknown command: " + parts[0]);
            }
        }
    }

    private static void printHeader(GameEntry entry) {
        GameInfo info = entry.record().getInfo();
        System.out.println(entry.title());
        System.out.printf("Black: %s %s%n", orDash(info.playerBlack()), orEmpty(info.blackRank()));
        System.out.printf("White: %s %s%n", orDash(info.playerWhite()), orEmpty(info.whiteRank()));
        System.out.printf("Komi: %s, Result: %s%n", orDash(info.komi()), orDash(info.result()));
        entry.handicap().ifPresent(handicap -> System.out.printf("Handicap: %d%n", handicap));
    }

    private static void printBoard(PlaybackEngine engine) {
        BoardSnapshot board = engine.getBoard();
        int size = board.size();
        StringBuilder out = new StringBuilder();
        out.append("   ");
        for (int x = 0; x < size; x++) {
            out.append((char) ('A' + x + (x >= 8 ? 1 : 0))).append(' ');
        }
        out.append('\n');
        Point last = engine.getLastMove().map(Move::point).orElse(null);
        for (int y = 0; y < size; y++) {
            out.append(String.format("%2d ", size - y));
            for (int x = 0; x < size; x++) {
                Stone stone = board.stoneAt(x, y);
                char symbol = stone == null ? '.' : stone == Stone.BLACK ? 'X' : 'O';
                if (stone != null && last != null && last.x() == x && last.y() == y) {
                    // last move is shown in lower case
                    symbol = Character.toLowerCase(symbol);
                }
                out.append(symbol).append(' ');
            }
            out.append('\n');
        }
        out.append(String.format("Move %d/%d", engine.getCurrentIndex(), engine.getMaxIndex()));
        engine.getLastMove().ifPresent(move -> out.append(String.format(" - %s %s", move.color(),
                SgfCoordinates.toHumanReadable(move.point(), size))));
        out.append(String.format("%nCaptures - Black: %d, White: %d%n", engine.getBlackCaptures(), engine.getWhiteCaptures()));
        System.out.print(out);
    }

    private static String orDash(String value) {
        return value == null ? "-" : value;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private static void configureLogging() {
        try (InputStream input = SgfPlayerCLI.class.getResourceAsStream("/logging.properties")) {
            if (input != null) {
                LogManager.getLogManager().readConfiguration(input);
            }
        } catch (IOException ex) {
            System.err.println("Could not read logging configuration: " + ex.getMessage());
        }
    }

    private static void printUsage() {
        System.err.println("Usage: SgfPlayerCLI <game.sgf> [--interval=<ms>] [--autoplay]");
    }
}
