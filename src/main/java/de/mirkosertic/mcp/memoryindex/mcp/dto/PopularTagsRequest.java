package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

public record PopularTagsRequest(
        @Nullable
        @Description("Maximum number of tags. Default is 20, maximum is 200.")
        Integer limit
) {

    public static PopularTagsRequest fromMap(final Map<String, Object> args) {
        return new PopularTagsRequest(Arguments.integer(args, "limit"));
    }

    public int effectiveLimit() {
        return Arguments.limit(limit, 20, 200);
    }
}
