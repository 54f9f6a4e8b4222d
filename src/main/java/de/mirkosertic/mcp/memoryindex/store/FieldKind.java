package de.mirkosertic.mcp.memoryindex.store;

import java.util.Locale;

/**
 * Closed set of text sources a document field can come from.
 */
public enum FieldKind {

    REPORT("report", false),
    TRANSCRIPT("transcript", true),
    OCR("ocr", true),
    TOPIC("topic", false);

    private final String code;
    private final boolean timeBearing;

    FieldKind(final String code, final boolean timeBearing) {
        this.code = code;
        this.timeBearing = timeBearing;
    }

    public String code() {
        return code;
    }

    /**
     * Whether snippets from this kind can be correlated with timeline entries.
     */
    public boolean isTimeBearing() {
        return timeBearing;
    }

    /**
     * Parses a stored or user supplied field kind code.
     *
     * @throws IllegalArgumentException if the code does not name a known kind
     */
    public static FieldKind fromCode(final String code) {
        final String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (final FieldKind kind : values()) {
            if (kind.code.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown field kind: " + code);
    }
}
