package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.ToolResponse;

import java.util.List;

/**
 * Response DTO for listDocuments and searchByTags.
 */
public record DocumentListResponse(
        boolean success,
        List<DocumentEntry> documents,
        int count,
        String error
) implements ToolResponse {

    public static DocumentListResponse success(final List<DocumentEntry> documents) {
        return new DocumentListResponse(true, documents, documents.size(), null);
    }

    public static DocumentListResponse error(final String errorMessage) {
        return new DocumentListResponse(false, null, 0, errorMessage);
    }
}
