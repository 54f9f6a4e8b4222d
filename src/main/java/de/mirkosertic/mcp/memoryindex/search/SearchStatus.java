package de.mirkosertic.mcp.memoryindex.search;

/**
 * How a search completed. Only {@link #FAILED} means the result list is empty because of an error.
 */
public enum SearchStatus {

    OK,

    /**
     * The query contained no keywords. Not an error.
     */
    EMPTY_QUERY,

    /**
     * Results were produced, but at least one backend failed and was bypassed.
     */
    DEGRADED,

    /**
     * No route could answer the query.
     */
    FAILED
}
