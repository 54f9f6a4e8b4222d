package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

public record SuggestTagsRequest(
        @Description("Beginning of the tag name.")
        String prefix,

        @Nullable
        @Description("Maximum number of suggestions. Default is 10, maximum is 50.")
        Integer limit
) {

    public static SuggestTagsRequest fromMap(final Map<String, Object> args) {
        return new SuggestTagsRequest(
                Arguments.string(args, "prefix"),
                Arguments.integer(args, "limit"));
    }

    public int effectiveLimit() {
        return Arguments.limit(limit, 10, 50);
    }
}
