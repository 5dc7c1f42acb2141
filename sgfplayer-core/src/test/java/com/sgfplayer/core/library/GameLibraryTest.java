package com.sgfplayer.core.library;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sgfplayer.core.sgf.GameRecord;
import com.sgfplayer.core.sgf.SgfParseException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;
import java.util.Random;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GameLibraryTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static List<String> fileNames(List<GameEntry> entries) {
        return entries.stream().map(entry -> entry.path().getFileName().toString()).collect(Collectors.toList());
    }

    @Test
    void loadsSingleFile() throws Exception {
        Path file = write("game.sgf", "(;SZ[9]PB[Black];B[ee])");

        GameEntry entry = new GameLibrary().loadFile(file);

        assertEquals(file, entry.path());
        assertEquals(9, entry.record().getBoardSize());
        assertEquals("Black", entry.record().getInfo().playerBlack());
    }

    @Test
    void loadsFileStartingWithByteOrderMark() throws Exception {
        Path file = tempDir.resolve("bom.sgf");
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = "(;GM[1]SZ[9];B[ee])".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, content, 0, bom.length);
        System.arraycopy(body, 0, content, bom.length, body.length);
        Files.write(file, content);

        GameEntry entry = new GameLibrary().loadFile(file);

        assertEquals(9, entry.record().getBoardSize());
        assertEquals(1, entry.record().getMoves().size());
    }

    @Test
    void loadFilePropagatesParseErrors() throws IOException {
        Path file = write("broken.sgf", "not sgf at all");
        assertThrows(SgfParseException.class, () -> new GameLibrary().loadFile(file));
    }

    @Test
    void loadsSgfFilesSortedByPathAndSkipsBrokenOnes() throws IOException {
        write("b.sgf", "(;SZ[9];B[aa])");
        write("a.SGF", "(;SZ[13])");
        write("c.sgf", "garbage");
        write("notes.txt", "(;SZ[9])");
        write(".hidden.sgf", "(;SZ[9])");
        write("nested/d.sgf", "(;SZ[19])");

        List<GameEntry> entries = new GameLibrary().loadFolder(tempDir);

        assertEquals(List.of("a.SGF", "b.sgf", "d.sgf"), fileNames(entries));
        assertEquals(13, entries.get(0).record().getBoardSize());
    }

    @Test
    void shuffleIsRepeatableWithSeed() throws IOException {
        for (char c = 'a'; c <= 'h'; c++) {
            write(c + ".sgf", "(;SZ[9])");
        }

        List<String> first = fileNames(new GameLibrary(true, new Random(42)).loadFolder(tempDir));
        List<String> second = fileNames(new GameLibrary(true, new Random(42)).loadFolder(tempDir));
        List<String> sorted = fileNames(new GameLibrary().loadFolder(tempDir));

        assertEquals(first, second);
        assertEquals(8, first.size());
        assertTrue(first.containsAll(sorted));
        assertNotEquals(sorted, first);
    }

    @Test
    void loadsFolderInBackground() throws Exception {
        write("a.sgf", "(;SZ[9])");

        List<GameEntry> entries = new GameLibrary().loadFolderAsync(tempDir).get(5, TimeUnit.SECONDS);

        assertEquals(1, entries.size());
    }

    @Test
    void missingFolderFailsTheFuture() {
        Path missing = tempDir.resolve("missing");
        CompletionException ex = assertThrows(CompletionException.class,
                () -> new GameLibrary().loadFolderAsync(missing).join());
        assertTrue(ex.getCause() instanceof UncheckedIOException);
    }

    @Test
    void titleFallsBackToFileName() throws SgfParseException {
        GameEntry named = new GameEntry(tempDir.resolve("round1.sgf"), GameRecord.parse("(;EV[Meijin])"));
        GameEntry unnamed = new GameEntry(tempDir.resolve("round2.sgf"), GameRecord.parse("(;SZ[9])"));

        assertEquals("Meijin", named.title());
        assertEquals("round2", unnamed.title());
    }

    @Test
    void exposesHandicapAndFingerprint() throws SgfParseException {
        Path path = tempDir.resolve("handicap.sgf");
        GameEntry entry = new GameEntry(path, GameRecord.parse("(;SZ[19]AB[dd][pp][dp]AW[pd])"));

        assertEquals(OptionalInt.of(3), entry.handicap());
        assertTrue(entry.fingerprint().startsWith("handicap.sgf_"));
        assertEquals(entry.fingerprint(), new GameEntry(path, entry.record()).fingerprint());
    }
}
