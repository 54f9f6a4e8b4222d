package de.mirkosertic.mcp.memoryindex.index;

import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.jspecify.annotations.Nullable;

/**
 * Substring containment scan over stored field text, used when token based retrieval fails or finds nothing.
 */
public interface LiteralScanner {

    /**
     * Case-insensitive containment scan.
     *
     * @return at most {@code limit} hits in index order, each with raw rank 0
     */
    BackendResult scan(String literal, @Nullable FieldKind fieldFilter, int limit);
}
