package de.mirkosertic.mcp.memoryindex.store;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Where a document was acquired from.
 */
public enum SourceCategory {

    LOCAL("local"),
    VIDEO("video"),
    YOUTUBE("youtube"),
    BILIBILI("bilibili"),
    TWITTER("twitter"),
    XIAOHONGSHU("xiaohongshu"),
    DOUYIN("douyin"),
    TIKTOK("tiktok"),
    ZHIHU("zhihu"),
    REDDIT("reddit"),
    WEB_ARCHIVE("web_archive"),
    UNKNOWN("unknown");

    private final String code;

    SourceCategory(final String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Lenient lookup, unknown or missing codes map to {@link #UNKNOWN}.
     */
    public static SourceCategory fromCode(final @Nullable String code) {
        if (code == null || code.isBlank()) {
            return UNKNOWN;
        }
        final String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (final SourceCategory category : values()) {
            if (category.code.equals(normalized)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
