package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.ToolResponse;
import de.mirkosertic.mcp.memoryindex.search.DocumentDetails;

import java.util.List;

/**
 * Response DTO for the getDocument tool.
 */
public record GetDocumentResponse(
        boolean success,
        DocumentEntry document,
        List<FieldEntry> fields,
        List<TopicEntry> topics,
        Integer timelineEntries,
        String error
) implements ToolResponse {

    public static GetDocumentResponse success(final DocumentDetails details) {
        return new GetDocumentResponse(true,
                DocumentEntry.of(details.document(), details.tags()),
                details.fields().stream().map(FieldEntry::from).toList(),
                details.topics().stream().map(TopicEntry::fromTopic).toList(),
                details.timelineEntries(),
                null);
    }

    public static GetDocumentResponse error(final String errorMessage) {
        return new GetDocumentResponse(false, null, null, null, null, errorMessage);
    }
}
