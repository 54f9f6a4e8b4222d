package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.store.StoredDocument;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A document listing row.
 *
 * @param summary short summary derived from the newest report, {@code null} if there is none
 */
public record DocumentOverview(StoredDocument document, List<String> tags, @Nullable String summary) {
}
