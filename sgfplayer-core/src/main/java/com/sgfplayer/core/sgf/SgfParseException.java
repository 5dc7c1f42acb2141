package com.sgfplayer.core.sgf;

/**
 * Thrown when SGF text lacks the structure required to read a game tree at all.
 */
public class SgfParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int offset;

    public SgfParseException(String message, int offset) {
        super(message + " (offset " + offset + ")");
        this.offset = offset;
    }

    /**
     * Returns the character offset, after line-ending normalisation, at which parsing failed.
     */
    public int getOffset() {
        return offset;
    }
}
