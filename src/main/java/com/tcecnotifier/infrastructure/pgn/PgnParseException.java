package com.tcecnotifier.infrastructure.pgn;

/**
 * Thrown when a PGN text cannot be turned into a game.
 */
public class PgnParseException extends Exception {

    public enum Reason {
        /** The text holds no game at all. */
        EMPTY_INPUT,
        /** White, Black, Date or Event is missing. */
        MISSING_REQUIRED_HEADER,
        /** The token stream is broken, e.g. an unterminated comment. */
        MALFORMED
    }

    private final Reason reason;

    public PgnParseException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
