package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.ToolResponse;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the getIndexStats tool.
 */
public record IndexStatsResponse(
        boolean success,
        long documentCount,
        long indexedFieldCount,
        long tagCount,
        long topicCount,
        long timelineEntryCount,
        Map<String, Long> documentsByCategory,
        Map<String, Long> fieldsByKind,
        String indexPath,
        int schemaVersion,
        List<BackendStatus> backends,
        QueryRuntimeMetrics queryRuntimeMetrics,
        String error
) implements ToolResponse {

    /**
     * State of one index backend.
     */
    public record BackendStatus(String backend, long fieldCount, boolean rebuildRequired) {
    }

    /**
     * Aggregate search statistics since startup.
     */
    public record QueryRuntimeMetrics(
            long totalQueries,
            String averageDurationMs,
            long minDurationMs,
            long maxDurationMs,
            String averageResultCount,
            Long p50Ms,
            Long p90Ms,
            Long p99Ms,
            long degradedQueries,
            long failedQueries,
            Map<String, Long> routeCounts
    ) {
    }

    public static IndexStatsResponse error(final String errorMessage) {
        return new IndexStatsResponse(false, 0, 0, 0, 0, 0, null, null, null, 0, null, null, errorMessage);
    }
}
