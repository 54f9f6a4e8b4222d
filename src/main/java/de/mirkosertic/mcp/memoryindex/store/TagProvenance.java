package de.mirkosertic.mcp.memoryindex.store;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

public enum TagProvenance {

    AUTO("auto"),
    MANUAL("manual");

    private final String code;

    TagProvenance(final String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static TagProvenance fromCode(final @Nullable String code) {
        if (code != null && MANUAL.code.equals(code.trim().toLowerCase(Locale.ROOT))) {
            return MANUAL;
        }
        return AUTO;
    }
}
