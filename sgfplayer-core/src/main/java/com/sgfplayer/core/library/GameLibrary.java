package com.sgfplayer.core.library;

import com.sgfplayer.core.sgf.GameRecord;
import com.sgfplayer.core.sgf.SgfParseException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads SGF files from disk into {@link GameEntry} instances.
 */
public final class GameLibrary {

    private static final Logger LOGGER = Logger.getLogger(GameLibrary.class.getName());
    private static final String SGF_EXTENSION = ".sgf";

    private final boolean shuffle;
    private final Random random;
    private final ExecutorService ioExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "game-library-io");
        thread.setDaemon(true);
        return thread;
    });

    public GameLibrary() {
        this(false, new Random());
    }

    /**
     * @param shuffle whether folder listings are returned in random order instead of by path
     * @param random source of the shuffle order
     */
    public GameLibrary(boolean shuffle, Random random) {
        this.shuffle = shuffle;
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Reads and parses a single SGF file. Bytes that are not valid UTF-8 are replaced.
     */
    public GameEntry loadFile(Path file) throws IOException, SgfParseException {
        Objects.requireNonNull(file, "file");
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        GameRecord record = GameRecord.parse(text);
        LOGGER.fine(() -> "Loaded " + file + ": " + record);
        return new GameEntry(file, record);
    }

    /**
     * Loads every {@code .sgf} file below {@code folder}. Files that cannot be read or parsed are
     * logged and left out.
     */
    public List<GameEntry> loadFolder(Path folder) throws IOException {
        Objects.requireNonNull(folder, "folder");
        List<Path> files;
        try (Stream<Path> walk = Files.walk(folder)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(GameLibrary::isVisible)
                    .filter(GameLibrary::hasSgfExtension)
                    .sorted()
                    .collect(Collectors.toCollection(ArrayList::new));
        }
        if (shuffle) {
            Collections.shuffle(files, random);
        }

        List<GameEntry> entries = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                entries.add(loadFile(file));
            } catch (IOException | SgfParseException ex) {
                LOGGER.log(Level.WARNING, "Failed to load " + file, ex);
            }
        }
        LOGGER.info(() -> String.format("Loaded %d of %d games from %s", entries.size(), files.size(), folder));
        return entries;
    }

    /**
     * Loads a folder on the library's background thread.
     */
    public CompletableFuture<List<GameEntry>> loadFolderAsync(Path folder) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return loadFolder(folder);
            } catch (IOException ex) {
                throw new CompletionException(new UncheckedIOException(ex));
            }
        }, ioExecutor);
    }

    private static boolean hasSgfExtension(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(SGF_EXTENSION);
    }

    private static boolean isVisible(Path file) {
        return !file.getFileName().toString().startsWith(".");
    }
}
