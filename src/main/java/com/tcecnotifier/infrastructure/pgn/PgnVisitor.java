package com.tcecnotifier.infrastructure.pgn;

/**
 * Callbacks invoked by {@link PgnReader} while it walks one game.
 *
 * @param <R> The value produced at the end of the game
 */
public interface PgnVisitor<R> {

    default void beginGame() {}

    /** A tag pair such as {@code [White "Stockfish 17"]}, value already unescaped. */
    default void header(String key, String value) {}

    /** A move in Standard Algebraic Notation, stripped of move numbers and annotation glyphs. */
    default void san(String san) {}

    /** The text between braces, or after a semicolon up to the end of the line. */
    default void comment(String comment) {}

    /**
     * Called on {@code (}.
     *
     * @return true to skip the whole variation, nested ones included
     */
    default boolean beginVariation() {
        return true;
    }

    /** Called on {@code )} for variations that were not skipped. */
    default void endVariation() {}

    /** The result marker: {@code 1-0}, {@code 0-1}, {@code 1/2-1/2} or {@code *}. */
    default void outcome(String result) {}

    R endGame() throws PgnParseException;
}
