package com.sgfplayer.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persists {@link PlayerSettings} as a properties file.
 */
public final class SettingsStore {

    private static final Logger LOGGER = Logger.getLogger(SettingsStore.class.getName());
    private static final String DEFAULT_FILE_NAME = "settings.properties";
    private static final Path DEFAULT_PATH = Paths.get(System.getProperty("user.home"), ".sgfplayer", DEFAULT_FILE_NAME);

    static final String MOVE_INTERVAL = "moveInterval";
    static final String SHUFFLE_GAME_ORDER = "shuffleGameOrder";
    static final String START_GAME_ON_LAUNCH = "startGameOnLaunch";
    static final String GAME_FOLDER = "gameFolder";

    private final Path storagePath;

    public SettingsStore() {
        this(DEFAULT_PATH);
    }

    public SettingsStore(Path storagePath) {
        this.storagePath = storagePath;
    }

    public Path getStoragePath() {
        return storagePath;
    }

    /**
     * Reads the stored settings. A missing file yields the defaults; unreadable values fall back to
     * their default individually.
     */
    public PlayerSettings load() {
        PlayerSettings defaults = PlayerSettings.defaults();
        if (!Files.exists(storagePath)) {
            return defaults;
        }
        Properties properties = new Properties();
        try (InputStream input = Files.newInputStream(storagePath)) {
            properties.load(input);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to read settings from " + storagePath, ex);
            throw new UncheckedIOException(ex);
        }

        Duration interval = defaults.moveInterval();
        String intervalValue = properties.getProperty(MOVE_INTERVAL);
        if (intervalValue != null) {
            try {
                interval = Duration.ofMillis(Long.parseLong(intervalValue.trim()));
            } catch (NumberFormatException ex) {
                LOGGER.log(Level.WARNING, "Ignoring invalid move interval: {0}", intervalValue);
            }
        }
        String folder = properties.getProperty(GAME_FOLDER);
        return new PlayerSettings(
                interval,
                Boolean.parseBoolean(properties.getProperty(SHUFFLE_GAME_ORDER)),
                Boolean.parseBoolean(properties.getProperty(START_GAME_ON_LAUNCH)),
                folder == null || folder.isBlank() ? null : Paths.get(folder));
    }

    public void save(PlayerSettings settings) {
        Properties properties = new Properties();
        properties.setProperty(MOVE_INTERVAL, Long.toString(settings.moveInterval().toMillis()));
        properties.setProperty(SHUFFLE_GAME_ORDER, Boolean.toString(settings.shuffleGameOrder()));
        properties.setProperty(START_GAME_ON_LAUNCH, Boolean.toString(settings.startGameOnLaunch()));
        if (settings.gameFolder() != null) {
            properties.setProperty(GAME_FOLDER, settings.gameFolder().toString());
        }
        try {
            Path parent = storagePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream output = Files.newOutputStream(storagePath)) {
                properties.store(output, "SGF Player settings");
            }
            LOGGER.fine(() -> "Saved settings to " + storagePath);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to save settings to " + storagePath, ex);
            throw new UncheckedIOException(ex);
        }
    }
}
