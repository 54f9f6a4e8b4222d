package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.store.TopicHit;

public record TopicHitEntry(
        long documentId,
        String documentTitle,
        String sourceCategory,
        TopicEntry topic
) {

    public static TopicHitEntry from(final TopicHit hit) {
        return new TopicHitEntry(hit.documentId(), hit.documentTitle(), hit.sourceCategory().code(),
                TopicEntry.fromTopic(hit.topic()));
    }
}
