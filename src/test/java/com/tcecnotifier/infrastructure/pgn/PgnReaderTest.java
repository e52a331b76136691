package com.tcecnotifier.infrastructure.pgn;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PgnReader.
 */
class PgnReaderTest {

    @Test
    void testVisitsTokensInOrder() throws Exception {
        RecordingVisitor visitor = new RecordingVisitor(true);
        String pgn = "[White \"Lunar\"]\n[Black \"Colossus\"]\n\n{intro} 1. e4 {book,} ; line comment\ne5 $1 2. Nf3 *";

        Optional<List<String>> events = new PgnReader(pgn).readGame(visitor);

        assertEquals(List.of(
            "begin",
            "header White=Lunar",
            "header Black=Colossus",
            "comment intro",
            "san e4",
            "comment book,",
            "comment  line comment",
            "san e5",
            "san Nf3",
            "outcome *",
            "end"), events.orElseThrow());
    }

    @Test
    void testSkippedVariationProducesNoEvents() throws Exception {
        RecordingVisitor visitor = new RecordingVisitor(true);

        new PgnReader("1. e4 (1. d4 {x} (1. c4) ; ) inside line comment\n) e5 *").readGame(visitor);

        assertEquals(List.of("begin", "san e4", "begin variation", "san e5", "outcome *", "end"), visitor.events);
    }

    @Test
    void testWalksIntoVariationWhenNotSkipped() throws Exception {
        RecordingVisitor visitor = new RecordingVisitor(false);

        new PgnReader("1. e4 (1. d4 d5) e5 1-0").readGame(visitor);

        assertEquals(List.of(
            "begin", "san e4", "begin variation", "san d4", "san d5", "end variation", "san e5", "outcome 1-0", "end"),
            visitor.events);
    }

    @Test
    void testReadsConsecutiveGames() throws Exception {
        PgnReader reader = new PgnReader("[Event \"A\"]\n1. e4 1-0\n\n[Event \"B\"]\n1. d4 0-1\n");

        List<String> first = reader.readGame(new RecordingVisitor(true)).orElseThrow();
        List<String> second = reader.readGame(new RecordingVisitor(true)).orElseThrow();

        assertEquals(List.of("begin", "header Event=A", "san e4", "outcome 1-0", "end"), first);
        assertEquals(List.of("begin", "header Event=B", "san d4", "outcome 0-1", "end"), second);
        assertTrue(reader.readGame(new RecordingVisitor(true)).isEmpty());
    }

    @Test
    void testAcceptsSanShapes() throws Exception {
        RecordingVisitor visitor = new RecordingVisitor(true);

        new PgnReader("1. O-O O-O-O 2. exd8=Q+ Nbd7 3. R1e2# Qh4xe1 4. -- Kxh1 1/2-1/2").readGame(visitor);

        assertEquals(List.of("begin", "san O-O", "san O-O-O", "san exd8=Q+", "san Nbd7", "san R1e2#",
            "san Qh4xe1", "san --", "san Kxh1", "outcome 1/2-1/2", "end"), visitor.events);
    }

    @Test
    void testSkipsEscapeLinesAndByteOrderMark() throws Exception {
        RecordingVisitor visitor = new RecordingVisitor(true);

        new PgnReader("\uFEFF% generated by the feed\n[Event \"A\"]\n%comment\n1. e4 *").readGame(visitor);

        assertEquals(List.of("begin", "header Event=A", "san e4", "outcome *", "end"), visitor.events);
    }

    @Test
    void testRejectsNagWithoutNumber() {
        PgnParseException e = assertThrows(PgnParseException.class,
            () -> new PgnReader("1. e4 $ e5 *").readGame(new RecordingVisitor(true)));

        assertEquals(PgnParseException.Reason.MALFORMED, e.getReason());
    }

    @Test
    void testRejectsResultInsideVariation() {
        PgnParseException e = assertThrows(PgnParseException.class,
            () -> new PgnReader("1. e4 (1. d4 1-0) *").readGame(new RecordingVisitor(false)));

        assertEquals(PgnParseException.Reason.MALFORMED, e.getReason());
    }

    /**
     * Visitor that records every callback.
     */
    private static class RecordingVisitor implements PgnVisitor<List<String>> {
        private final boolean skipVariations;
        private final List<String> events = new ArrayList<>();

        RecordingVisitor(boolean skipVariations) {
            this.skipVariations = skipVariations;
        }

        @Override
        public void beginGame() {
            events.add("begin");
        }

        @Override
        public void header(String key, String value) {
            events.add("header " + key + "=" + value);
        }

        @Override
        public void san(String san) {
            events.add("san " + san);
        }

        @Override
        public void comment(String comment) {
            events.add("comment " + comment);
        }

        @Override
        public boolean beginVariation() {
            events.add("begin variation");
            return skipVariations;
        }

        @Override
        public void endVariation() {
            events.add("end variation");
        }

        @Override
        public void outcome(String result) {
            events.add("outcome " + result);
        }

        @Override
        public List<String> endGame() {
            events.add("end");
            return events;
        }
    }
}
