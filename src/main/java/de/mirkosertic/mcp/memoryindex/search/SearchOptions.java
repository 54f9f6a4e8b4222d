package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Parameters of a free-text search.
 *
 * @param tags             tag filter, empty for no filter
 * @param matchAllTags     AND (true) or OR (false) semantics for the tag filter
 * @param fieldFilter      restricts matches to one field kind, {@code null} for all
 * @param minRelevance     results scoring below this value are dropped
 * @param aggregate        one result per document (true) or one per matching field (false)
 * @param matchAllKeywords AND (true) or OR (false) semantics across keywords
 * @param fuzzy            typo tolerant matching
 */
public record SearchOptions(
        String query,
        List<String> tags,
        boolean matchAllTags,
        @Nullable FieldKind fieldFilter,
        int limit,
        int offset,
        SortMode sortBy,
        double minRelevance,
        boolean aggregate,
        boolean matchAllKeywords,
        boolean fuzzy
) {

    public static final int DEFAULT_LIMIT = 20;

    public SearchOptions {
        query = query == null ? "" : query;
        tags = tags == null ? List.of() : List.copyOf(tags);
        sortBy = sortBy == null ? SortMode.RELEVANCE : sortBy;
        limit = Math.max(0, limit);
        offset = Math.max(0, offset);
    }

    public static Builder builder(final String query) {
        return new Builder(query);
    }

    public static final class Builder {

        private final String query;
        private List<String> tags = List.of();
        private boolean matchAllTags = true;
        private @Nullable FieldKind fieldFilter;
        private int limit = DEFAULT_LIMIT;
        private int offset = 0;
        private SortMode sortBy = SortMode.RELEVANCE;
        private double minRelevance = 0.0;
        private boolean aggregate = true;
        private boolean matchAllKeywords = false;
        private boolean fuzzy = true;

        private Builder(final String query) {
            this.query = query;
        }

        public Builder tags(final List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder matchAllTags(final boolean matchAllTags) {
            this.matchAllTags = matchAllTags;
            return this;
        }

        public Builder fieldFilter(final @Nullable FieldKind fieldFilter) {
            this.fieldFilter = fieldFilter;
            return this;
        }

        public Builder limit(final int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(final int offset) {
            this.offset = offset;
            return this;
        }

        public Builder sortBy(final SortMode sortBy) {
            this.sortBy = sortBy;
            return this;
        }

        public Builder minRelevance(final double minRelevance) {
            this.minRelevance = minRelevance;
            return this;
        }

        public Builder aggregate(final boolean aggregate) {
            this.aggregate = aggregate;
            return this;
        }

        public Builder matchAllKeywords(final boolean matchAllKeywords) {
            this.matchAllKeywords = matchAllKeywords;
            return this;
        }

        public Builder fuzzy(final boolean fuzzy) {
            this.fuzzy = fuzzy;
            return this;
        }

        public SearchOptions build() {
            return new SearchOptions(query, tags, matchAllTags, fieldFilter, limit, offset, sortBy,
                    minRelevance, aggregate, matchAllKeywords, fuzzy);
        }
    }
}
