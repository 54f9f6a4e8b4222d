package de.mirkosertic.mcp.memoryindex.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.List;

/**
 * Turns response records into MCP tool results carrying one JSON text content.
 */
public final class ToolResultHelper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    public static McpSchema.CallToolResult createResult(final ToolResponse response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(!response.success())
                .build();
    }

    /**
     * Error result for failures that happen before a typed response exists, e.g. invalid arguments.
     */
    public static McpSchema.CallToolResult createErrorResult(final String errorMessage) {
        final ObjectNode error = OBJECT_MAPPER.createObjectNode()
                .put("success", false)
                .put("error", errorMessage == null ? "" : errorMessage);
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(error.toString())))
                .isError(true)
                .build();
    }

    public static String toJson(final Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            return OBJECT_MAPPER.createObjectNode()
                    .put("success", false)
                    .put("error", "JSON serialization error: " + e.getOriginalMessage())
                    .toString();
        }
    }
}
