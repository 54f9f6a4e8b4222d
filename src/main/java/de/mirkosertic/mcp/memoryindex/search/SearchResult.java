package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import de.mirkosertic.mcp.memoryindex.store.SourceCategory;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * One ranked result row.
 *
 * @param fullText  the complete field text, only present for short fields
 * @param timeRange approximate snippet position for transcript and OCR matches
 * @param rawRank   backend native rank of the best match, {@code null} for literal scan matches
 *                  and multi-keyword results
 * @param score     normalized and combined relevance in [0,1]
 */
public record SearchResult(
        long documentId,
        String title,
        FieldKind fieldKind,
        String snippet,
        @Nullable String fullText,
        @Nullable TimeRange timeRange,
        List<String> tags,
        SourceCategory sourceCategory,
        @Nullable Integer durationSeconds,
        @Nullable String fileRef,
        @Nullable Double rawRank,
        double score,
        Instant createdAt,
        List<String> matchedKeywords
) {
}
