package de.mirkosertic.mcp.memoryindex.store;

import java.util.List;

/**
 * A document together with its tags and the number of requested tags it carries.
 */
public record TaggedDocument(StoredDocument document, List<String> tags, int matchedTagCount) {
}
