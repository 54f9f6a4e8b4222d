package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;

import java.util.Map;

public record AddIndexedFieldRequest(
        @Description("Id of an existing document.")
        long documentId,

        @Description("Field kind: report, transcript, ocr or topic.")
        String fieldKind,

        @Description("Text to make searchable. Adding the same text twice has no effect.")
        String text
) {

    public static AddIndexedFieldRequest fromMap(final Map<String, Object> args) {
        return new AddIndexedFieldRequest(
                Arguments.requireLong(args, "documentId"),
                Arguments.requireString(args, "fieldKind"),
                Arguments.string(args, "text"));
    }
}
