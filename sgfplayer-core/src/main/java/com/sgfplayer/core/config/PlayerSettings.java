package com.sgfplayer.core.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * User preferences for playback and the game library.
 *
 * @param moveInterval delay between automatic playback steps
 * @param shuffleGameOrder whether library folders are listed in random order
 * @param startGameOnLaunch whether the first game starts playing as soon as it is loaded
 * @param gameFolder folder the library is read from, or {@code null}
 */
public record PlayerSettings(Duration moveInterval, boolean shuffleGameOrder, boolean startGameOnLaunch,
        Path gameFolder) {

    public static final Duration DEFAULT_MOVE_INTERVAL = Duration.ofMillis(500);
    public static final Duration MIN_MOVE_INTERVAL = Duration.ofMillis(50);

    private static final Logger LOGGER = Logger.getLogger(PlayerSettings.class.getName());

    public PlayerSettings {
        Objects.requireNonNull(moveInterval, "moveInterval");
        if (moveInterval.compareTo(MIN_MOVE_INTERVAL) < 0) {
            moveInterval = MIN_MOVE_INTERVAL;
        }
    }

    public static PlayerSettings defaults() {
        return new PlayerSettings(DEFAULT_MOVE_INTERVAL, false, false, null);
    }

    public PlayerSettings withMoveInterval(Duration interval) {
        return new PlayerSettings(interval, shuffleGameOrder, startGameOnLaunch, gameFolder);
    }

    public PlayerSettings withShuffleGameOrder(boolean shuffle) {
        return new PlayerSettings(moveInterval, shuffle, startGameOnLaunch, gameFolder);
    }

    public PlayerSettings withStartGameOnLaunch(boolean autoplay) {
        return new PlayerSettings(moveInterval, shuffleGameOrder, autoplay, gameFolder);
    }

    public PlayerSettings withGameFolder(Path folder) {
        return new PlayerSettings(moveInterval, shuffleGameOrder, startGameOnLaunch, folder);
    }

    /**
     * Applies command line options on top of {@code base}. Recognised options are
     * {@code --interval=<ms>}, {@code --shuffle}, {@code --autoplay} and {@code --folder=<path>};
     * other options are logged and ignored, arguments without {@code --} are left to the caller.
     *
     * @throws IllegalArgumentException if an option value is malformed
     */
    public static PlayerSettings fromArgs(List<String> args, PlayerSettings base) {
        Objects.requireNonNull(base, "base");
        PlayerSettings settings = base;
        if (args == null) {
            return settings;
        }
        for (String arg : args) {
            if (arg == null || !arg.trim().startsWith("--")) {
                continue;
            }
            String option = arg.trim();
            if (option.startsWith("--interval=")) {
                String value = option.substring("--interval=".length());
                long millis;
                try {
                    millis = Long.parseLong(value);
                } catch (NumberFormatException ex) {
                    throw new IllegalArgumentException("Invalid interval: " + value, ex);
                }
                if (millis < 0L) {
                    throw new IllegalArgumentException("interval must be non-negative");
                }
                settings = settings.withMoveInterval(Duration.ofMillis(millis));
            } else if ("--shuffle".equals(option)) {
                settings = settings.withShuffleGameOrder(true);
            } else if ("--autoplay".equals(option)) {
                settings = settings.withStartGameOnLaunch(true);
            } else if (option.startsWith("--folder=")) {
                settings = settings.withGameFolder(Paths.get(option.substring("--folder=".length())));
            } else {
                LOGGER.warning(() -> "Ignoring unknown option: " + option);
            }
        }
        return settings;
    }
}
