package com.tcecnotifier.domain.model;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Display name of a chess engine as published by the live feed.
 *
 * Two names are equal when their normalized forms are equal, so "Lunar 2.0.1"
 * and "lunar" identify the same engine. The raw name is kept for display.
 */
public final class EngineName {

    // " 2", " v2", " 2.0", " v1.2.3" at the end of the name
    private static final Pattern VERSION_PATTERN = Pattern.compile(" v?(\\d+)(\\.\\d+)?(\\.\\d+)?$");

    // " 2025a", anywhere in the name
    private static final Pattern DATE_VERSION_PATTERN = Pattern.compile(" \\d{4}[a-zA-Z]");

    private final String raw;
    private final String normalized;

    public EngineName(String raw) {
        this.raw = Objects.requireNonNull(raw, "raw");
        this.normalized = normalize(raw);
    }

    /**
     * Normalizes an engine name for comparison.
     *
     * Rules:
     * 1. Convert to lowercase
     * 2. Strip a trailing version number (v1.2.3)
     * 3. Strip date-coded build tags (2025a)
     *
     * An engine whose proper name ends in digits ("Chess 4") loses them too.
     */
    public static String normalize(String name) {
        String normalized = name.toLowerCase(Locale.ROOT);
        normalized = VERSION_PATTERN.matcher(normalized).replaceAll("").trim();
        normalized = DATE_VERSION_PATTERN.matcher(normalized).replaceAll("").trim();
        return normalized;
    }

    /**
     * Returns true if the normalized form of {@code candidate} occurs inside this name.
     * A short configured name such as "Lunar" therefore matches "Lunar 2.0.1".
     */
    public boolean matches(String candidate) {
        return normalized.contains(normalize(candidate));
    }

    public String getRaw() {
        return raw;
    }

    public String getNormalized() {
        return normalized;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EngineName other)) {
            return false;
        }
        return normalized.equals(other.normalized);
    }

    @Override
    public int hashCode() {
        return normalized.hashCode();
    }

    @Override
    public String toString() {
        return raw;
    }
}
