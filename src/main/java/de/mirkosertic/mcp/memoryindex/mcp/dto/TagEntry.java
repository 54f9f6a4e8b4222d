package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.store.TagUsage;

public record TagEntry(String name, String category, int usageCount, int documentCount) {

    public static TagEntry from(final TagUsage usage) {
        return new TagEntry(usage.name(), usage.category(), usage.usageCount(), usage.documentCount());
    }
}
