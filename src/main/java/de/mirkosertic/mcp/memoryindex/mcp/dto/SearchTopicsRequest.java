package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

public record SearchTopicsRequest(
        @Description("Text that must occur in the topic title or summary (case-insensitive substring).")
        String query,

        @Nullable
        @Description("Maximum number of topics. Default is 20, maximum is 100.")
        Integer limit,

        @Nullable
        @Description("Number of topics to skip. Default is 0.")
        Integer offset
) {

    public static SearchTopicsRequest fromMap(final Map<String, Object> args) {
        return new SearchTopicsRequest(
                Arguments.string(args, "query"),
                Arguments.integer(args, "limit"),
                Arguments.integer(args, "offset"));
    }

    public int effectiveLimit() {
        return Arguments.limit(limit, 20, 100);
    }

    public int effectiveOffset() {
        return Arguments.offset(offset);
    }
}
