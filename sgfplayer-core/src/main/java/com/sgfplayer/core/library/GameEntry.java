package com.sgfplayer.core.library;

import com.sgfplayer.core.sgf.GameRecord;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A game record together with the file it was read from.
 */
public record GameEntry(Path path, GameRecord record) {

    public GameEntry {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(record, "record");
    }

    /**
     * Returns the event name, or the file name without its extension if the record has none.
     */
    public String title() {
        String event = record.getInfo().event();
        if (event != null && !event.isEmpty()) {
            return event;
        }
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    public OptionalInt handicap() {
        return record.handicap();
    }

    /**
     * Returns a key that identifies the file across sessions.
     */
    public String fingerprint() {
        return path.getFileName() + "_" + path.toAbsolutePath().normalize().toString().hashCode();
    }
}
