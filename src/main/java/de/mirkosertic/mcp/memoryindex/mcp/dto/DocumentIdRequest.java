package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;

import java.util.Map;

/**
 * Request DTO for tools addressing a single document: getDocument and deleteDocument.
 */
public record DocumentIdRequest(
        @Description("Id of the document.")
        long documentId
) {

    public static DocumentIdRequest fromMap(final Map<String, Object> args) {
        return new DocumentIdRequest(Arguments.requireLong(args, "documentId"));
    }
}
