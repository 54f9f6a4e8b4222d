package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;
import de.mirkosertic.mcp.memoryindex.search.SearchOptions;
import de.mirkosertic.mcp.memoryindex.search.SortMode;
import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for the search tool.
 */
public record SearchRequest(
        @Description("Keywords separated by whitespace. Latin keywords tolerate small typos, Chinese keywords are segmented.")
        String query,

        @Nullable
        @Description("Only return documents carrying these tags.")
        List<String> tags,

        @Nullable
        @Description("true (default): documents must carry all tags. false: any tag is enough.")
        Boolean matchAllTags,

        @Nullable
        @Description("Restrict matches to one field kind: report, transcript, ocr or topic.")
        String fieldKind,

        @Nullable
        @Description("Maximum number of results. Default is 20, maximum is 100.")
        Integer limit,

        @Nullable
        @Description("Number of results to skip. Default is 0.")
        Integer offset,

        @Nullable
        @Description("Sort order: relevance (default), date, duration or title.")
        String sortBy,

        @Nullable
        @Description("Drop results whose relevance (0.0 to 1.0) is below this value. Default is 0.")
        Double minRelevance,

        @Nullable
        @Description("true (default): one result per document. false: one result per matching field.")
        Boolean aggregate,

        @Nullable
        @Description("For several keywords: true requires every keyword to match, false (default) any keyword.")
        Boolean matchAllKeywords,

        @Nullable
        @Description("Typo tolerant matching. Default is true.")
        Boolean fuzzy
) {

    static final int MAX_LIMIT = 100;

    public static SearchRequest fromMap(final Map<String, Object> args) {
        return new SearchRequest(
                Arguments.string(args, "query"),
                Arguments.stringList(args, "tags"),
                Arguments.bool(args, "matchAllTags"),
                Arguments.string(args, "fieldKind"),
                Arguments.integer(args, "limit"),
                Arguments.integer(args, "offset"),
                Arguments.string(args, "sortBy"),
                Arguments.decimal(args, "minRelevance"),
                Arguments.bool(args, "aggregate"),
                Arguments.bool(args, "matchAllKeywords"),
                Arguments.bool(args, "fuzzy"));
    }

    /**
     * @throws IllegalArgumentException for an unknown field kind or sort mode
     */
    public SearchOptions toOptions() {
        return SearchOptions.builder(query == null ? "" : query)
                .tags(tags == null ? List.of() : tags)
                .matchAllTags(matchAllTags == null || matchAllTags)
                .fieldFilter(fieldKind == null || fieldKind.isBlank() ? null : FieldKind.fromCode(fieldKind))
                .limit(Arguments.limit(limit, SearchOptions.DEFAULT_LIMIT, MAX_LIMIT))
                .offset(Arguments.offset(offset))
                .sortBy(SortMode.fromString(sortBy))
                .minRelevance(minRelevance == null ? 0.0 : minRelevance)
                .aggregate(aggregate == null || aggregate)
                .matchAllKeywords(matchAllKeywords != null && matchAllKeywords)
                .fuzzy(fuzzy == null || fuzzy)
                .build();
    }
}
