package de.mirkosertic.mcp.memoryindex.store;

import java.util.Map;

public record StoreStatistics(
        long documents,
        long indexedFields,
        long tags,
        long topics,
        long timelineEntries,
        Map<String, Long> documentsByCategory,
        Map<String, Long> fieldsByKind
) {
}
