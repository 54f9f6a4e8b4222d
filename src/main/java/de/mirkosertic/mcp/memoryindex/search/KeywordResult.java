package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.index.BackendFailure;
import de.mirkosertic.mcp.memoryindex.index.BackendKind;

import java.util.List;
import java.util.Set;

/**
 * Everything the planner retrieved for one keyword.
 *
 * @param routes   backends that answered successfully
 * @param failures backend failures encountered and bypassed
 * @param failed   true if no route answered at all
 */
public record KeywordResult(
        String keyword,
        List<ScoredHit> hits,
        Set<BackendKind> routes,
        List<BackendFailure> failures,
        boolean failed
) {

    public KeywordResult {
        hits = List.copyOf(hits);
        routes = Set.copyOf(routes);
        failures = List.copyOf(failures);
    }
}
