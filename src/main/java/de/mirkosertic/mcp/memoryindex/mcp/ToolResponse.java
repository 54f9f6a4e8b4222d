package de.mirkosertic.mcp.memoryindex.mcp;

/**
 * Implemented by every tool response record. A response with {@code success == false} is reported to the
 * client as a tool error.
 */
public interface ToolResponse {

    boolean success();
}
