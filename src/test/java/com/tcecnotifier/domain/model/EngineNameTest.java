package com.tcecnotifier.domain.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EngineName.
 */
class EngineNameTest {

    @Test
    void testMatchesIgnoresVersion() {
        assertTrue(new EngineName("Lunar 2").matches("Lunar"));
        assertTrue(new EngineName("Lunar 2.0").matches("Lunar"));
        assertTrue(new EngineName("Lunar 2.0.1").matches("Lunar"));
        assertTrue(new EngineName("Lunar v2.0.1").matches("Lunar"));
    }

    @Test
    void testMatchesIgnoresDateVersion() {
        assertTrue(new EngineName("Colossus 2025b").matches("Colossus"));
    }

    @Test
    void testMatchesIsCaseInsensitive() {
        assertTrue(new EngineName("Stockfish 17").matches("stockfish"));
        assertTrue(new EngineName("stockfish dev").matches("STOCKFISH"));
    }

    @Test
    void testMatchesIsSubstringOfPublishedName() {
        assertTrue(new EngineName("Stockfish dev-20251201").matches("Stockfish"));
        assertFalse(new EngineName("Lunar").matches("Lunar Eclipse"));
        assertFalse(new EngineName("Minic 3.44").matches("c4ke"));
    }

    @Test
    void testNormalize() {
        assertEquals("lunar", EngineName.normalize("Lunar 2.0.1"));
        assertEquals("lunar", EngineName.normalize("  Lunar v2"));
        assertEquals("colossus", EngineName.normalize("Colossus 2025b"));
        assertEquals("c4ke", EngineName.normalize("c4ke 1.1"));
        assertEquals("winter 4.02c", EngineName.normalize("Winter 4.02c"));
        // No version suffix: only lower-cased
        assertEquals("sirius 54101d91", EngineName.normalize("Sirius 54101d91"));
    }

    @Test
    void testNormalizeStripsDateTagBeforeVersion() {
        assertEquals("colossus", EngineName.normalize("Colossus 2025b 1.2"));
        assertEquals("obsidian dev", EngineName.normalize("Obsidian 2024a dev"));
    }

    @Test
    void testNormalizeStripsDigitsOfProperName() {
        // Known limitation of the heuristic
        assertEquals("chess", EngineName.normalize("Chess 4"));
    }

    @Test
    void testEqualityUsesNormalizedForm() {
        EngineName a = new EngineName("Lunar 2.0.1");
        EngineName b = new EngineName("lunar");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(new EngineName("Lunar"), new EngineName("Lunatic"));
    }

    @Test
    void testEqualityAndHashAgreeForAllPairs() {
        List<String> names = List.of(
            "Lunar", "Lunar 2", "LUNAR v2.0", "Lunar 2.0.1", "Colossus 2025b", "colossus",
            "Stockfish 17", "Stockfish", "Chess 4", "Chess", "Minic 3.44", "Winter 4.02c");

        for (String a : names) {
            for (String b : names) {
                EngineName nameA = new EngineName(a);
                EngineName nameB = new EngineName(b);
                boolean sameNormalized = EngineName.normalize(a).equals(EngineName.normalize(b));

                assertEquals(sameNormalized, nameA.equals(nameB), a + " / " + b);
                if (sameNormalized) {
                    assertEquals(nameA.hashCode(), nameB.hashCode(), a + " / " + b);
                }
            }
        }
    }

    @Test
    void testHashSetDeduplicatesVersions() {
        Set<EngineName> names = new HashSet<>();
        names.add(new EngineName("Lunar 2"));
        names.add(new EngineName("Lunar 2.0.1"));
        names.add(new EngineName("Colossus 2025b"));

        assertEquals(2, names.size());
    }

    @Test
    void testToStringRendersRawName() {
        EngineName name = new EngineName("Lunar 2.0.1");

        assertEquals("Lunar 2.0.1", name.toString());
        assertEquals("Lunar 2.0.1", name.getRaw());
        assertEquals("lunar", name.getNormalized());
    }
}
