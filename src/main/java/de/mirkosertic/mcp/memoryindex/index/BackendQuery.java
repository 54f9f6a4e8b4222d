package de.mirkosertic.mcp.memoryindex.index;

import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.jspecify.annotations.Nullable;

/**
 * A single-keyword query against one backend.
 *
 * @param text        the keyword or pattern, may contain {@code *} and {@code ?} for the exact backend
 * @param fieldFilter restricts hits to one field kind, or {@code null} for all kinds
 * @param limit       maximum number of field hits
 * @param approximate whether edit-distance matching should be applied (segmented backend only)
 */
public record BackendQuery(String text, @Nullable FieldKind fieldFilter, int limit, boolean approximate) {
}
