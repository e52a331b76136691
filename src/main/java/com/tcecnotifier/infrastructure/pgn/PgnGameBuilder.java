package com.tcecnotifier.infrastructure.pgn;

import com.tcecnotifier.domain.model.EngineName;
import com.tcecnotifier.domain.model.PgnGame;
import com.tcecnotifier.domain.model.PgnMove;
import com.tcecnotifier.infrastructure.pgn.PgnParseException.Reason;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Visitor that assembles a {@link PgnGame} from the feed.
 *
 * A comment belongs to the move before it, but moves and comments arrive as
 * separate tokens, so each move is held back until the next move (or the end
 * of the game) shows that its comment is complete. A comment that arrives
 * while no move is held back, such as the engine options comment before the
 * first move, is dropped when the next move arrives.
 *
 * Variations are skipped entirely.
 */
public class PgnGameBuilder implements PgnVisitor<PgnGame> {

    static final String EVENT_KEY = "Event";
    static final String WHITE_HEADER_KEY = "White";
    static final String BLACK_HEADER_KEY = "Black";
    static final String DATE_HEADER_KEY = "Date";

    private static final List<String> REQUIRED_HEADERS =
        List.of(WHITE_HEADER_KEY, BLACK_HEADER_KEY, DATE_HEADER_KEY, EVENT_KEY);

    private final Map<String, String> headers = new HashMap<>();
    private final List<PgnMove> moves = new ArrayList<>();

    private String lastSan;
    private String lastComment;

    @Override
    public void header(String key, String value) {
        if (REQUIRED_HEADERS.contains(key)) {
            headers.put(key, value);
        }
    }

    @Override
    public void san(String san) {
        if (lastSan != null) {
            addMove(lastSan, lastComment);
        }

        lastComment = null;
        lastSan = san;
    }

    @Override
    public void comment(String comment) {
        lastComment = comment;
    }

    @Override
    public boolean beginVariation() {
        return true;
    }

    @Override
    public PgnGame endGame() throws PgnParseException {
        // Handle the last move we saw
        if (lastSan != null) {
            addMove(lastSan, lastComment);
            lastSan = null;
            lastComment = null;
        }

        List<String> missing = REQUIRED_HEADERS.stream()
            .filter(key -> !headers.containsKey(key))
            .toList();
        if (!missing.isEmpty()) {
            throw new PgnParseException(Reason.MISSING_REQUIRED_HEADER,
                "Missing required header(s): " + String.join(", ", missing));
        }

        return new PgnGame(
            new EngineName(headers.get(WHITE_HEADER_KEY)),
            new EngineName(headers.get(BLACK_HEADER_KEY)),
            headers.get(DATE_HEADER_KEY),
            headers.get(EVENT_KEY),
            moves
        );
    }

    private void addMove(String san, String comment) {
        moves.add(PgnMove.fromComment(san, comment != null ? comment : ""));
    }
}
