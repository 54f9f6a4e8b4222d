package de.mirkosertic.mcp.memoryindex.index;

/**
 * Retrieval routes a query can take.
 */
public enum BackendKind {

    /**
     * Ranked boolean retrieval over whitespace tokens, with prefix and wildcard terms.
     */
    EXACT,

    /**
     * Ranked retrieval over dictionary segmented tokens, with edit-distance term matching.
     */
    SEGMENTED,

    /**
     * Case-insensitive substring scan over the stored text of the exact index.
     */
    LITERAL
}
