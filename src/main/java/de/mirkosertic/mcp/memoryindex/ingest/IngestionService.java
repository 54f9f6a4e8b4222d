package de.mirkosertic.mcp.memoryindex.ingest;

import de.mirkosertic.mcp.memoryindex.index.IndexBackend;
import de.mirkosertic.mcp.memoryindex.store.ContentStore;
import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import de.mirkosertic.mcp.memoryindex.store.IndexedField;
import de.mirkosertic.mcp.memoryindex.store.StoredDocument;
import de.mirkosertic.mcp.memoryindex.store.TagProvenance;
import de.mirkosertic.mcp.memoryindex.store.TimelineEntry;
import de.mirkosertic.mcp.memoryindex.store.Topic;
import de.mirkosertic.mcp.memoryindex.util.TextCleaner;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

/**
 * Write side of the memory index, called by the content pipeline.
 * <p>
 * The content store is written first and is the source of truth; both index backends are updated and
 * committed before a call returns, so a search issued afterwards sees the change.
 */
public class IngestionService {

    private static final Logger logger = LoggerFactory.getLogger(IngestionService.class);

    private final ContentStore contentStore;
    private final List<IndexBackend> backends;

    public IngestionService(final ContentStore contentStore, final List<IndexBackend> backends) {
        this.contentStore = contentStore;
        this.backends = List.copyOf(backends);
    }

    public void upsertDocument(final StoredDocument document) {
        contentStore.upsertDocument(document);
        logger.info("Upserted document {} '{}' ({})", document.id(), document.title(), document.sourceCategory());
    }

    /**
     * Stores and indexes a field. Text that is blank after cleaning is ignored.
     *
     * @return the stored field, empty if the text was ignored
     * @throws IllegalArgumentException if the document does not exist
     */
    public Optional<IndexedField> addIndexedField(final long documentId, final FieldKind kind,
                                                  final @Nullable String text) throws IOException {
        final String cleaned = TextCleaner.cleanPreservingWhitespace(text);
        if (cleaned == null || cleaned.isBlank()) {
            logger.debug("Ignoring blank {} field for document {}", kind, documentId);
            return Optional.empty();
        }
        final IndexedField field = contentStore.addIndexedField(documentId, kind, cleaned.strip());
        for (final IndexBackend backend : backends) {
            backend.index(documentId, kind, field.text());
            backend.commit();
        }
        logger.info("Indexed {} field of document {} ({} chars)", kind, documentId, field.text().length());
        return Optional.of(field);
    }

    /**
     * @return number of tags newly linked to the document
     */
    public int addTags(final long documentId, final List<String> tagNames, final TagProvenance provenance,
                       final double confidence, final @Nullable String category) {
        final int linked = contentStore.addTags(documentId, tagNames, provenance, confidence, category);
        logger.info("Linked {} of {} tags to document {}", linked, tagNames.size(), documentId);
        return linked;
    }

    /**
     * Stores the topics and indexes each one as a {@link FieldKind#TOPIC} field.
     */
    public void addTopics(final long documentId, final List<Topic> topics) throws IOException {
        contentStore.addTopics(documentId, topics);
        for (final Topic topic : topics) {
            addIndexedField(documentId, FieldKind.TOPIC, topic.searchableText());
        }
        logger.info("Added {} topics to document {}", topics.size(), documentId);
    }

    public void addTimelineEntries(final long documentId, final List<TimelineEntry> entries) {
        contentStore.addTimelineEntries(documentId, entries);
        logger.info("Added {} timeline entries to document {}", entries.size(), documentId);
    }

    /**
     * Removes the document from the store (with fields, tags, topics and timeline) and from both indexes.
     *
     * @return false if the document did not exist
     */
    public boolean deleteDocument(final long documentId) throws IOException {
        final boolean deleted = contentStore.deleteDocument(documentId);
        // Index rows may outlive a store row after a crash, so the indexes are cleaned either way
        for (final IndexBackend backend : backends) {
            backend.remove(documentId);
            backend.commit();
        }
        if (deleted) {
            logger.info("Deleted document {}", documentId);
        } else {
            logger.info("Document {} not found, index entries purged", documentId);
        }
        return deleted;
    }

    /**
     * Drops both indexes and re-indexes every stored field.
     */
    public RebuildResult rebuildIndexes() throws IOException {
        final long startTime = System.currentTimeMillis();
        logger.info("Rebuilding {} indexes from the content store", backends.size());
        for (final IndexBackend backend : backends) {
            backend.clear();
        }
        final long fields;
        try {
            fields = contentStore.forEachIndexedField(field -> {
                for (final IndexBackend backend : backends) {
                    try {
                        backend.index(field.documentId(), field.kind(), field.text());
                    } catch (final IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }
            });
        } catch (final UncheckedIOException e) {
            throw e.getCause();
        }
        for (final IndexBackend backend : backends) {
            backend.rebuildCompleted();
        }
        final long duration = System.currentTimeMillis() - startTime;
        logger.info("Rebuild finished: {} fields in {}ms", fields, duration);
        return new RebuildResult(fields, duration);
    }

    /**
     * Rebuilds if any backend is flagged, for example after a schema change or a detected corruption.
     */
    public Optional<RebuildResult> rebuildIfRequired() throws IOException {
        final boolean required = backends.stream().anyMatch(IndexBackend::isRebuildRequired);
        if (!required) {
            return Optional.empty();
        }
        return Optional.of(rebuildIndexes());
    }
}
