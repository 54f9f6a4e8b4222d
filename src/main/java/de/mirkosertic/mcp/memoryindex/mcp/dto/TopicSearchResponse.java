package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.ToolResponse;

import java.util.List;

public record TopicSearchResponse(
        boolean success,
        List<TopicHitEntry> topics,
        int count,
        String error
) implements ToolResponse {

    public static TopicSearchResponse success(final List<TopicHitEntry> topics) {
        return new TopicSearchResponse(true, topics, topics.size(), null);
    }

    public static TopicSearchResponse error(final String errorMessage) {
        return new TopicSearchResponse(false, null, 0, errorMessage);
    }
}
