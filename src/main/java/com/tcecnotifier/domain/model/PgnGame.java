package com.tcecnotifier.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A game parsed from the live PGN feed, possibly still in progress.
 *
 * Two games are equal when their identity hashes are equal, see {@link GameIdentityHasher}.
 */
public final class PgnGame {

    private final EngineName whitePlayer;
    private final EngineName blackPlayer;
    private final String date;
    private final String event;
    private final List<PgnMove> moves;
    private final long identityHash;

    public PgnGame(EngineName whitePlayer, EngineName blackPlayer, String date, String event, List<PgnMove> moves) {
        this.whitePlayer = Objects.requireNonNull(whitePlayer, "whitePlayer");
        this.blackPlayer = Objects.requireNonNull(blackPlayer, "blackPlayer");
        this.date = Objects.requireNonNull(date, "date");
        this.event = Objects.requireNonNull(event, "event");
        this.moves = List.copyOf(moves);
        this.identityHash = GameIdentityHasher.computeHash(this);
    }

    public EngineName getWhitePlayer() {
        return whitePlayer;
    }

    public EngineName getBlackPlayer() {
        return blackPlayer;
    }

    /** Date tag exactly as published, e.g. "2025.12.02". */
    public String getDate() {
        return date;
    }

    public String getEvent() {
        return event;
    }

    public List<PgnMove> getMoves() {
        return moves;
    }

    /**
     * The opening book line: every move up to, not including, the first non-book move.
     *
     * Moves later in the game can be reported as book again (tablebase moves,
     * moves with no engine info), so only the leading run counts.
     */
    public List<PgnMove> opening() {
        List<PgnMove> opening = new ArrayList<>();
        for (PgnMove move : moves) {
            if (!move.inBook()) {
                break;
            }
            opening.add(move);
        }
        return opening;
    }

    /**
     * The game is out of book once any played move is not a book move.
     */
    public boolean outOfBook() {
        return moves.stream().anyMatch(move -> !move.inBook());
    }

    public boolean hasPlayer(String player) {
        return whitePlayer.matches(player) || blackPlayer.matches(player);
    }

    public long identityHash() {
        return identityHash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PgnGame other)) {
            return false;
        }
        return identityHash == other.identityHash;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(identityHash);
    }

    @Override
    public String toString() {
        return whitePlayer + " vs " + blackPlayer + " (" + event + ", " + date + ", " + moves.size() + " plies)";
    }
}
