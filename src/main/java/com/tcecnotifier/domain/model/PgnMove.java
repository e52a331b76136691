package com.tcecnotifier.domain.model;

import java.util.Objects;

/**
 * One played half-move and whether the feed marked it as an opening book move.
 */
public record PgnMove(String notation, boolean inBook) {

    /** Comments on book moves start with this prefix, e.g. {@code {book, mb=+0+0+0+0+0,}}. */
    public static final String BOOK_MOVE_COMMENT_PREFIX = "book,";

    public PgnMove {
        Objects.requireNonNull(notation, "notation");
    }

    /**
     * Creates a move from its SAN text and the comment that followed it.
     */
    public static PgnMove fromComment(String notation, String comment) {
        return new PgnMove(notation, comment.startsWith(BOOK_MOVE_COMMENT_PREFIX));
    }
}
