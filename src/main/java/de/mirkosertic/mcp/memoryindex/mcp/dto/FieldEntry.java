package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.store.IndexedField;

public record FieldEntry(long id, String fieldKind, String text, String contentHash) {

    public static FieldEntry from(final IndexedField field) {
        return new FieldEntry(field.id(), field.kind().code(), field.text(), field.contentHash());
    }
}
