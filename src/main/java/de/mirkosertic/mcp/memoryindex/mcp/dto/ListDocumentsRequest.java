package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;
import de.mirkosertic.mcp.memoryindex.store.SourceCategory;
import org.jspecify.annotations.Nullable;

import java.util.Map;

public record ListDocumentsRequest(
        @Nullable
        @Description("Only list documents of this source category, e.g. video, bilibili, web_archive.")
        String sourceCategory,

        @Nullable
        @Description("Maximum number of documents. Default is 20, maximum is 100.")
        Integer limit,

        @Nullable
        @Description("Number of documents to skip. Default is 0.")
        Integer offset
) {

    public static ListDocumentsRequest fromMap(final Map<String, Object> args) {
        return new ListDocumentsRequest(
                Arguments.string(args, "sourceCategory"),
                Arguments.integer(args, "limit"),
                Arguments.integer(args, "offset"));
    }

    public @Nullable SourceCategory effectiveCategory() {
        return sourceCategory == null || sourceCategory.isBlank() ? null : SourceCategory.fromCode(sourceCategory);
    }

    public int effectiveLimit() {
        return Arguments.limit(limit, 20, 100);
    }

    public int effectiveOffset() {
        return Arguments.offset(offset);
    }
}
