package com.tcecnotifier.infrastructure.pgn;

import com.tcecnotifier.domain.model.PgnGame;
import com.tcecnotifier.infrastructure.pgn.PgnParseException.Reason;

import java.util.Optional;

/**
 * Parses the first game of a PGN text.
 */
public final class PgnParser {

    private PgnParser() {}

    /**
     * @param pgn PGN text holding one game, tags block and movetext
     * @return The parsed game
     * @throws PgnParseException if the text holds no game, misses a required
     *         header, or is malformed
     */
    public static PgnGame parse(String pgn) throws PgnParseException {
        Optional<PgnGame> game = new PgnReader(pgn).readGame(new PgnGameBuilder());

        if (game.isEmpty()) {
            throw new PgnParseException(Reason.EMPTY_INPUT, "Empty PGN");
        }

        return game.get();
    }
}
