package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.search.SearchResult;
import de.mirkosertic.mcp.memoryindex.search.TimeRange;

import java.util.List;

/**
 * One search result as returned to clients.
 */
public record SearchHit(
        long documentId,
        String title,
        String fieldKind,
        String snippet,
        String fullText,
        Double startSeconds,
        Double endSeconds,
        List<String> tags,
        String sourceCategory,
        Integer durationSeconds,
        String fileRef,
        Double rawRank,
        double score,
        String createdAt,
        List<String> matchedKeywords
) {

    public static SearchHit from(final SearchResult result) {
        final TimeRange timeRange = result.timeRange();
        return new SearchHit(
                result.documentId(),
                result.title(),
                result.fieldKind().code(),
                result.snippet(),
                result.fullText(),
                timeRange == null ? null : timeRange.startSeconds(),
                timeRange == null ? null : timeRange.endSeconds(),
                result.tags(),
                result.sourceCategory().code(),
                result.durationSeconds(),
                result.fileRef(),
                result.rawRank(),
                result.score(),
                result.createdAt().toString(),
                result.matchedKeywords());
    }
}
