package de.mirkosertic.mcp.memoryindex.store;

public record TopicHit(long documentId, String documentTitle, SourceCategory sourceCategory, Topic topic) {
}
