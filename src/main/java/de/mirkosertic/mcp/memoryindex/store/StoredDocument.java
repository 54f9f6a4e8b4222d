package de.mirkosertic.mcp.memoryindex.store;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A content entity produced by the acquisition pipeline. The search core only reads it.
 */
public record StoredDocument(
        long id,
        String title,
        SourceCategory sourceCategory,
        @Nullable Integer durationSeconds,
        @Nullable String fileRef,
        Instant createdAt
) {
}
