package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.index.BackendKind;
import de.mirkosertic.mcp.memoryindex.index.IndexHit;

/**
 * A backend hit annotated with the route and variant that found it.
 *
 * @param keyword the query keyword the hit belongs to
 * @param score   normalized rank multiplied by the variant weight
 */
public record ScoredHit(IndexHit hit, BackendKind backend, QueryVariant variant, String keyword, double score) {

    public long documentId() {
        return hit.documentId();
    }

    /**
     * Native rank for presentation. Literal matches have none.
     */
    public Double rawRankOrNull() {
        return backend == BackendKind.LITERAL ? null : hit.rawRank();
    }
}
