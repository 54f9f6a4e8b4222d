package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.search.DocumentOverview;
import de.mirkosertic.mcp.memoryindex.store.StoredDocument;
import de.mirkosertic.mcp.memoryindex.store.TaggedDocument;

import java.util.List;

/**
 * Document metadata as returned to clients.
 *
 * @param summary         short report summary, only in document listings
 * @param matchedTagCount number of requested tags the document carries, only in tag searches
 */
public record DocumentEntry(
        long id,
        String title,
        String sourceCategory,
        Integer durationSeconds,
        String fileRef,
        String createdAt,
        List<String> tags,
        String summary,
        Integer matchedTagCount
) {

    public static DocumentEntry of(final StoredDocument document, final List<String> tags) {
        return new DocumentEntry(document.id(), document.title(), document.sourceCategory().code(),
                document.durationSeconds(), document.fileRef(), document.createdAt().toString(), tags, null, null);
    }

    public static DocumentEntry fromOverview(final DocumentOverview overview) {
        final StoredDocument document = overview.document();
        return new DocumentEntry(document.id(), document.title(), document.sourceCategory().code(),
                document.durationSeconds(), document.fileRef(), document.createdAt().toString(), overview.tags(),
                overview.summary(), null);
    }

    public static DocumentEntry fromTagged(final TaggedDocument tagged) {
        final StoredDocument document = tagged.document();
        return new DocumentEntry(document.id(), document.title(), document.sourceCategory().code(),
                document.durationSeconds(), document.fileRef(), document.createdAt().toString(), tagged.tags(),
                null, tagged.matchedTagCount());
    }
}
