package de.mirkosertic.mcp.memoryindex.store;

import org.jspecify.annotations.Nullable;

public record TagUsage(String name, @Nullable String category, int usageCount, int documentCount) {
}
