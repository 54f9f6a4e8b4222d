package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.ToolResponse;

import java.util.List;

public record TagSuggestionResponse(
        boolean success,
        String prefix,
        List<String> suggestions,
        String error
) implements ToolResponse {

    public static TagSuggestionResponse success(final String prefix, final List<String> suggestions) {
        return new TagSuggestionResponse(true, prefix, suggestions, null);
    }

    public static TagSuggestionResponse error(final String errorMessage) {
        return new TagSuggestionResponse(false, null, null, errorMessage);
    }
}
