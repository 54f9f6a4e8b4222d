package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.ToolResponse;

/**
 * Response DTO for write tools that only report what they did.
 */
public record SimpleMessageResponse(
        boolean success,
        String message,
        String error
) implements ToolResponse {

    public static SimpleMessageResponse success(final String message) {
        return new SimpleMessageResponse(true, message, null);
    }

    public static SimpleMessageResponse error(final String errorMessage) {
        return new SimpleMessageResponse(false, null, errorMessage);
    }
}
