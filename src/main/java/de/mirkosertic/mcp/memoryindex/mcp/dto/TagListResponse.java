package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.ToolResponse;

import java.util.List;

/**
 * Response DTO for popularTags.
 */
public record TagListResponse(
        boolean success,
        List<TagEntry> tags,
        String error
) implements ToolResponse {

    public static TagListResponse success(final List<TagEntry> tags) {
        return new TagListResponse(true, tags, null);
    }

    public static TagListResponse error(final String errorMessage) {
        return new TagListResponse(false, null, errorMessage);
    }
}
