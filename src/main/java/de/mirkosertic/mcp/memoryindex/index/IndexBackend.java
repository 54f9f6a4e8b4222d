package de.mirkosertic.mcp.memoryindex.index;

import de.mirkosertic.mcp.memoryindex.store.FieldKind;

import java.io.Closeable;
import java.io.IOException;

/**
 * Contract shared by both inverted indexes.
 * <p>
 * Each backend is single-writer/multi-reader: writes may come from several threads (the underlying
 * {@code IndexWriter} serializes them), reads never block on writers. Changes become visible to
 * {@link #search(BackendQuery)} once {@link #commit()} returns.
 */
public interface IndexBackend extends Closeable {

    BackendKind kind();

    /**
     * Adds or replaces the field row {@code (documentId, kind, text)}. Indexing identical content twice
     * leaves a single row.
     */
    void index(long documentId, FieldKind kind, String text) throws IOException;

    /**
     * Removes every field row of the document.
     */
    void remove(long documentId) throws IOException;

    /**
     * Runs a query. Failures are reported in the result, never thrown.
     */
    BackendResult search(BackendQuery query);

    /**
     * Makes pending writes durable and visible to searches.
     */
    void commit() throws IOException;

    /**
     * Removes every row. Used before a full rebuild.
     */
    void clear() throws IOException;

    /**
     * Whether the index must be rebuilt from the content store before it can be trusted.
     */
    boolean isRebuildRequired();

    void markRebuildRequired(String reason);

    /**
     * Called once a full rebuild has been committed.
     */
    void rebuildCompleted() throws IOException;

    /**
     * Number of live field rows.
     */
    long fieldCount();
}
