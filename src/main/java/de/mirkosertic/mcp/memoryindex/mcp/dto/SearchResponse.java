package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.ToolResponse;

import java.util.List;

/**
 * Response DTO for the search tool.
 *
 * @param status   ok, empty_query, degraded or failed
 * @param warnings backend failures that were bypassed
 */
public record SearchResponse(
        boolean success,
        String status,
        List<SearchHit> results,
        int resultCount,
        List<String> warnings,
        long searchTimeMs,
        String error
) implements ToolResponse {

    public static SearchResponse success(final String status, final List<SearchHit> results,
                                         final List<String> warnings, final long searchTimeMs) {
        return new SearchResponse(true, status, results, results.size(), warnings, searchTimeMs, null);
    }

    public static SearchResponse error(final String errorMessage) {
        return new SearchResponse(false, null, null, 0, null, 0, errorMessage);
    }
}
