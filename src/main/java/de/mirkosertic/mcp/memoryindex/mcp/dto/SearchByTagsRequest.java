package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

public record SearchByTagsRequest(
        @Nullable
        @Description("Tag names, compared case-insensitively. Empty or omitted: no tag filter.")
        List<String> tags,

        @Nullable
        @Description("true (default): documents must carry all tags, newest first. false: any tag, most matched tags first.")
        Boolean matchAll,

        @Nullable
        @Description("Maximum number of documents. Default is 20, maximum is 100.")
        Integer limit,

        @Nullable
        @Description("Number of documents to skip. Default is 0.")
        Integer offset
) {

    public static SearchByTagsRequest fromMap(final Map<String, Object> args) {
        final List<String> tags = Arguments.stringList(args, "tags");
        return new SearchByTagsRequest(
                tags == null ? List.of() : tags,
                Arguments.bool(args, "matchAll"),
                Arguments.integer(args, "limit"),
                Arguments.integer(args, "offset"));
    }

    public boolean effectiveMatchAll() {
        return matchAll == null || matchAll;
    }

    public int effectiveLimit() {
        return Arguments.limit(limit, 20, 100);
    }

    public int effectiveOffset() {
        return Arguments.offset(offset);
    }
}
