package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.index.BackendFailure;

import java.util.List;

/**
 * Result of {@link SearchService#search(SearchOptions)}. Searches never throw; problems show up in the
 * status and the failure list.
 */
public record SearchOutcome(SearchStatus status, List<SearchResult> results, List<BackendFailure> failures) {

    public SearchOutcome {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }

    public static SearchOutcome emptyQuery() {
        return new SearchOutcome(SearchStatus.EMPTY_QUERY, List.of(), List.of());
    }

    public static SearchOutcome failed(final List<BackendFailure> failures) {
        return new SearchOutcome(SearchStatus.FAILED, List.of(), failures);
    }
}
