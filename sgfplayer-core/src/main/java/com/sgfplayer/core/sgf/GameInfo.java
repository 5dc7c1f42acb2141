package com.sgfplayer.core.sgf;

/**
 * Descriptive game properties. Every field is optional and {@code null} when the record does not
 * provide it; none of them affects replay.
 */
public record GameInfo(
        String event,
        String playerBlack,
        String playerWhite,
        String blackRank,
        String whiteRank,
        String result,
        String date,
        String timeLimit,
        String overtime,
        String komi,
        String ruleset) {

    private static final GameInfo EMPTY = new GameInfo(null, null, null, null, null, null, null, null, null, null, null);

    public static GameInfo empty() {
        return EMPTY;
    }
}
