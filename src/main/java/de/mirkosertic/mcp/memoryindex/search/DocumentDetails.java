package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.store.IndexedField;
import de.mirkosertic.mcp.memoryindex.store.StoredDocument;
import de.mirkosertic.mcp.memoryindex.store.Topic;

import java.util.List;

/**
 * Everything stored for one document.
 */
public record DocumentDetails(
        StoredDocument document,
        List<String> tags,
        List<IndexedField> fields,
        List<Topic> topics,
        int timelineEntries
) {
}
