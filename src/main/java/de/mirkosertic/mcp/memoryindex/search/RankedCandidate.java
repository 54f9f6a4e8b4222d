package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.store.StoredDocument;

/**
 * A ranked match joined with its stored document, ready for sorting and pagination.
 */
public record RankedCandidate(StoredDocument document, RankedMatch match) {

    public double score() {
        return match.score();
    }
}
