package com.tcecnotifier.infrastructure.pgn;

import com.tcecnotifier.infrastructure.pgn.PgnParseException.Reason;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pull scanner over PGN text that drives a {@link PgnVisitor} through one game.
 *
 * Handles tag pairs, brace and semicolon comments, move numbers, NAGs,
 * annotation glyphs, {@code %} escape lines and recursive variations. Moves are
 * checked for SAN shape only, never for legality.
 */
public class PgnReader {

    private static final Pattern MOVE_NUMBER_PATTERN = Pattern.compile("\\d+\\.+");
    private static final Pattern GLYPH_SUFFIX_PATTERN = Pattern.compile("[!?]+$");
    private static final Pattern SAN_PATTERN = Pattern.compile(
        "([KQRBNP]?[a-h]?[1-8]?x?[a-h][1-8](=?[QRBN])?|O-O(-O)?|0-0(-0)?|[KQRBNP]@[a-h][1-8]|--|Z0)[+#]?");
    private static final Set<String> RESULTS = Set.of("1-0", "0-1", "1/2-1/2", "*");
    private static final String TOKEN_DELIMITERS = "{}()[];$\"";

    private final String text;
    private final int begin;
    private int pos;

    public PgnReader(String text) {
        this.text = Objects.requireNonNull(text, "text");
        this.begin = text.startsWith("\uFEFF") ? 1 : 0;
        this.pos = begin;
    }

    /**
     * Reads the next game, visiting each of its tokens.
     *
     * @return The visitor's result, or empty if no game is left in the text
     * @throws PgnParseException if the token stream is malformed or the visitor rejects the game
     */
    public <R> Optional<R> readGame(PgnVisitor<R> visitor) throws PgnParseException {
        skipBlank();
        if (atEnd()) {
            return Optional.empty();
        }

        visitor.beginGame();
        readHeaders(visitor);
        readMovetext(visitor);
        return Optional.of(visitor.endGame());
    }

    private void readHeaders(PgnVisitor<?> visitor) throws PgnParseException {
        skipBlank();
        while (!atEnd()) {
            char c = peek();
            if (c == '[') {
                readTag(visitor);
            } else if (c == '{' || c == ';') {
                // comments between tag pairs; one ahead of the movetext stays there
                int mark = pos;
                if (c == '{') {
                    readBraceComment();
                } else {
                    readLineComment();
                }
                skipBlank();
                if (atEnd() || peek() != '[') {
                    pos = mark;
                    return;
                }
            } else {
                return;
            }
            skipBlank();
        }
    }

    private void readTag(PgnVisitor<?> visitor) throws PgnParseException {
        int start = pos;
        pos++;
        skipWhitespace();

        int keyStart = pos;
        while (!atEnd() && !Character.isWhitespace(peek()) && peek() != '"' && peek() != ']') {
            pos++;
        }
        String key = text.substring(keyStart, pos);
        if (key.isEmpty()) {
            throw malformed("Tag without a name", start);
        }

        skipWhitespace();
        if (atEnd() || peek() != '"') {
            throw malformed("Expected quoted value for tag " + key, start);
        }
        pos++;

        StringBuilder value = new StringBuilder();
        while (true) {
            if (atEnd()) {
                throw malformed("Unterminated value for tag " + key, start);
            }
            char c = text.charAt(pos++);
            if (c == '"') {
                break;
            }
            if (c == '\\' && !atEnd()) {
                c = text.charAt(pos++);
            }
            value.append(c);
        }

        skipWhitespace();
        if (atEnd() || peek() != ']') {
            throw malformed("Unterminated tag " + key, start);
        }
        pos++;

        visitor.header(key, value.toString());
    }

    private void readMovetext(PgnVisitor<?> visitor) throws PgnParseException {
        // variations the visitor chose to walk into
        int depth = 0;

        while (true) {
            skipBlank();
            if (atEnd()) {
                break;
            }

            char c = peek();
            if (c == '{') {
                visitor.comment(readBraceComment());
            } else if (c == ';') {
                visitor.comment(readLineComment());
            } else if (c == '(') {
                pos++;
                if (visitor.beginVariation()) {
                    skipVariation();
                } else {
                    depth++;
                }
            } else if (c == ')') {
                if (depth == 0) {
                    throw malformed("Unbalanced ')'", pos);
                }
                pos++;
                depth--;
                visitor.endVariation();
            } else if (c == '$') {
                readNag();
            } else if (c == '[') {
                // tag section of the next game
                if (depth > 0) {
                    throw malformed("Unterminated variation", pos);
                }
                return;
            } else {
                int start = pos;
                String token = readToken();
                if (RESULTS.contains(token)) {
                    if (depth > 0) {
                        throw malformed("Result inside variation", start);
                    }
                    visitor.outcome(token);
                    return;
                }
                String san = stripMoveNumber(token);
                if (!san.isEmpty()) {
                    visitSan(visitor, san, start);
                }
            }
        }

        if (depth > 0) {
            throw malformed("Unterminated variation", pos);
        }
    }

    private void visitSan(PgnVisitor<?> visitor, String token, int start) throws PgnParseException {
        if (token.chars().allMatch(ch -> ch == '.')) {
            return;
        }
        String san = GLYPH_SUFFIX_PATTERN.matcher(token).replaceFirst("");
        if (!SAN_PATTERN.matcher(san).matches()) {
            throw malformed("Unexpected token '" + token + "'", start);
        }
        visitor.san(san);
    }

    private static String stripMoveNumber(String token) {
        Matcher matcher = MOVE_NUMBER_PATTERN.matcher(token);
        if (matcher.lookingAt()) {
            return token.substring(matcher.end());
        }
        return token;
    }

    private String readToken() throws PgnParseException {
        int start = pos;
        while (!atEnd() && !Character.isWhitespace(peek()) && TOKEN_DELIMITERS.indexOf(peek()) < 0) {
            pos++;
        }
        if (pos == start) {
            throw malformed("Unexpected character '" + peek() + "'", start);
        }
        return text.substring(start, pos);
    }

    private String readBraceComment() throws PgnParseException {
        int start = pos;
        int end = text.indexOf('}', pos + 1);
        if (end < 0) {
            throw malformed("Unterminated comment", start);
        }
        pos = end + 1;
        return text.substring(start + 1, end);
    }

    private String readLineComment() {
        int end = text.indexOf('\n', pos + 1);
        if (end < 0) {
            end = text.length();
        }
        String comment = text.substring(pos + 1, end);
        pos = end;
        return comment.endsWith("\r") ? comment.substring(0, comment.length() - 1) : comment;
    }

    private void readNag() throws PgnParseException {
        int start = pos;
        pos++;
        while (!atEnd() && Character.isDigit(peek())) {
            pos++;
        }
        if (pos == start + 1) {
            throw malformed("NAG without a number", start);
        }
    }

    private void skipVariation() throws PgnParseException {
        int start = pos - 1;
        int depth = 1;
        while (depth > 0) {
            if (atEnd()) {
                throw malformed("Unterminated variation", start);
            }
            char c = peek();
            if (c == '{') {
                readBraceComment();
            } else if (c == ';') {
                readLineComment();
            } else {
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                }
                pos++;
            }
        }
    }

    /** Skips whitespace and {@code %} escape lines. */
    private void skipBlank() {
        while (!atEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '%' && (pos == begin || text.charAt(pos - 1) == '\n')) {
                int end = text.indexOf('\n', pos);
                pos = end < 0 ? text.length() : end;
            } else {
                return;
            }
        }
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return text.charAt(pos);
    }

    private static PgnParseException malformed(String message, int offset) {
        return new PgnParseException(Reason.MALFORMED, message + " at offset " + offset);
    }
}
