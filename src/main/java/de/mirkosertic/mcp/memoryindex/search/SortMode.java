package de.mirkosertic.mcp.memoryindex.search;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

public enum SortMode {
    RELEVANCE,
    DATE,
    DURATION,
    TITLE;

    /**
     * Case-insensitive lookup. Blank input means {@link #RELEVANCE}.
     */
    public static SortMode fromString(final @Nullable String value) {
        if (value == null || value.isBlank()) {
            return RELEVANCE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sort mode '" + value
                    + "', expected one of relevance, date, duration, title", e);
        }
    }
}
