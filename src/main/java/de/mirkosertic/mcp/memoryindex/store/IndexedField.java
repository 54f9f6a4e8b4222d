package de.mirkosertic.mcp.memoryindex.store;

/**
 * One immutable piece of searchable text belonging to a document.
 */
public record IndexedField(
        long id,
        long documentId,
        FieldKind kind,
        String text,
        String contentHash
) {
}
