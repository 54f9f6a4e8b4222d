package de.mirkosertic.mcp.memoryindex.index;

import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexFormatTooNewException;
import org.apache.lucene.index.IndexFormatTooOldException;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Lucene plumbing shared by both backends: one {@link IndexWriter} and one NRT {@link SearcherManager}
 * per index directory, schema version bookkeeping in the commit user data, and translation of read
 * failures into {@link BackendResult} failures.
 */
public abstract class AbstractLuceneIndex implements IndexBackend {

    private static final Logger logger = LoggerFactory.getLogger(AbstractLuceneIndex.class);

    static final String SCHEMA_VERSION_KEY = "schema_version";

    private final Path indexPath;
    private final long nrtRefreshIntervalMs;
    private final Analyzer analyzer;

    private Directory directory;
    private IndexWriter indexWriter;
    private volatile @Nullable SearcherManager searcherManager;
    private ScheduledExecutorService refreshScheduler;

    private volatile boolean rebuildRequired;
    private volatile @Nullable String rebuildReason;

    /**
     * Work done with an acquired searcher.
     */
    @FunctionalInterface
    protected interface SearcherCallback {
        List<IndexHit> apply(IndexSearcher searcher) throws IOException;
    }

    protected AbstractLuceneIndex(final Path indexPath, final long nrtRefreshIntervalMs, final Analyzer analyzer) {
        this.indexPath = indexPath;
        this.nrtRefreshIntervalMs = nrtRefreshIntervalMs;
        this.analyzer = analyzer;
    }

    protected abstract Document createDocument(long documentId, FieldKind kind, String text);

    protected abstract List<IndexHit> doSearch(IndexSearcher searcher, BackendQuery query) throws IOException;

    /**
     * Opens the index. An index written with another schema version, or one that cannot be read at all,
     * is flagged for rebuild. A new or empty index never is.
     */
    public void init() throws IOException {
        if (!Files.exists(indexPath)) {
            Files.createDirectories(indexPath);
            logger.info("Created index directory: {}", indexPath.toAbsolutePath());
        }

        directory = FSDirectory.open(indexPath);
        IndexWriterConfig.OpenMode openMode = IndexWriterConfig.OpenMode.CREATE_OR_APPEND;

        if (DirectoryReader.indexExists(directory)) {
            try (DirectoryReader reader = DirectoryReader.open(directory)) {
                final String storedVersion = reader.getIndexCommit().getUserData().get(SCHEMA_VERSION_KEY);
                if (reader.numDocs() > 0 && !currentSchemaVersion().equals(storedVersion)) {
                    markRebuildRequired("schema version " + storedVersion + " differs from "
                            + currentSchemaVersion());
                }
            } catch (final CorruptIndexException | IndexFormatTooOldException | IndexFormatTooNewException e) {
                logger.error("{} index at {} is unreadable, recreating it", kind(), indexPath, e);
                openMode = IndexWriterConfig.OpenMode.CREATE;
                markRebuildRequired("unreadable index: " + e.getMessage());
            }
        }

        final IndexWriterConfig config = new IndexWriterConfig(analyzer);
        config.setOpenMode(openMode);
        indexWriter = new IndexWriter(directory, config);

        if (!rebuildRequired) {
            stampSchemaVersion();
        }
        indexWriter.commit();

        searcherManager = new SearcherManager(indexWriter, null);

        refreshScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "lucene-nrt-refresh-" + kind().name().toLowerCase());
            t.setDaemon(true);
            return t;
        });
        refreshScheduler.scheduleAtFixedRate(this::maybeRefreshSearcher,
                nrtRefreshIntervalMs, nrtRefreshIntervalMs, TimeUnit.MILLISECONDS);

        logger.info("{} index initialized at: {} (rebuild required: {})",
                kind(), indexPath.toAbsolutePath(), rebuildRequired);
    }

    private void maybeRefreshSearcher() {
        final SearcherManager manager = searcherManager;
        if (manager == null) {
            return;
        }
        try {
            manager.maybeRefresh();
        } catch (final IOException | AlreadyClosedException e) {
            logger.warn("Failed to refresh SearcherManager of {} index", kind(), e);
        }
    }

    private static String currentSchemaVersion() {
        return String.valueOf(IndexedFieldDocumentFactory.SCHEMA_VERSION);
    }

    private void stampSchemaVersion() {
        indexWriter.setLiveCommitData(Map.of(SCHEMA_VERSION_KEY, currentSchemaVersion()).entrySet());
    }

    @Override
    public void index(final long documentId, final FieldKind kind, final String text) throws IOException {
        final String key = IndexedFieldDocumentFactory.fieldKey(documentId, kind, text);
        writer().updateDocument(new Term(IndexedFieldDocumentFactory.FIELD_KEY, key),
                createDocument(documentId, kind, text));
    }

    @Override
    public void remove(final long documentId) throws IOException {
        writer().deleteDocuments(new Term(IndexedFieldDocumentFactory.DOCUMENT_ID, String.valueOf(documentId)));
    }

    @Override
    public void commit() throws IOException {
        final IndexWriter writer = writer();
        if (!rebuildRequired) {
            stampSchemaVersion();
        }
        writer.commit();
        final SearcherManager manager = searcherManager;
        if (manager != null) {
            manager.maybeRefreshBlocking();
        }
    }

    @Override
    public void clear() throws IOException {
        writer().deleteAll();
        logger.info("{} index cleared", kind());
    }

    @Override
    public boolean isRebuildRequired() {
        return rebuildRequired;
    }

    public @Nullable String getRebuildReason() {
        return rebuildReason;
    }

    @Override
    public void markRebuildRequired(final String reason) {
        if (!rebuildRequired) {
            logger.warn("{} index flagged for rebuild: {}", kind(), reason);
        }
        this.rebuildReason = reason;
        this.rebuildRequired = true;
    }

    @Override
    public void rebuildCompleted() throws IOException {
        rebuildRequired = false;
        rebuildReason = null;
        commit();
        logger.info("{} index rebuild completed", kind());
    }

    @Override
    public BackendResult search(final BackendQuery query) {
        return execute(kind(), searcher -> doSearch(searcher, query));
    }

    /**
     * Runs the callback with an acquired searcher. Read failures become failed results: structural
     * failures flag the index for rebuild, everything else is reported as unavailable.
     */
    protected BackendResult execute(final BackendKind reportedKind, final SearcherCallback callback) {
        final SearcherManager manager = searcherManager;
        if (manager == null) {
            return BackendResult.failed(BackendFailure.unavailable(reportedKind, kind() + " index is not initialized"));
        }

        final IndexSearcher searcher;
        try {
            searcher = manager.acquire();
        } catch (final AlreadyClosedException e) {
            return BackendResult.failed(BackendFailure.unavailable(reportedKind, kind() + " index is closed"));
        } catch (final IOException e) {
            logger.warn("Could not acquire searcher for {} index", kind(), e);
            return BackendResult.failed(BackendFailure.unavailable(reportedKind, e.getMessage()));
        }

        try {
            return BackendResult.ok(callback.apply(searcher));
        } catch (final CorruptIndexException | IndexFormatTooOldException | IndexFormatTooNewException e) {
            logger.error("{} index is corrupt", kind(), e);
            markRebuildRequired("corruption detected during search: " + e.getMessage());
            return BackendResult.failed(BackendFailure.corruption(reportedKind, e.getMessage()));
        } catch (final IOException e) {
            logger.warn("{} query failed", reportedKind, e);
            return BackendResult.failed(BackendFailure.unavailable(reportedKind, e.getMessage()));
        } catch (final AlreadyClosedException e) {
            return BackendResult.failed(BackendFailure.unavailable(reportedKind, kind() + " index is closed"));
        } catch (final IndexSearcher.TooManyClauses e) {
            logger.warn("{} query expanded to too many clauses", reportedKind);
            return BackendResult.failed(BackendFailure.unavailable(reportedKind, e.getMessage()));
        } finally {
            try {
                manager.release(searcher);
            } catch (final IOException e) {
                logger.warn("Failed to release searcher of {} index", kind(), e);
            }
        }
    }

    /**
     * Adds a filter clause restricting hits to one field kind.
     */
    protected static Query withFieldFilter(final Query query, final @Nullable FieldKind fieldFilter) {
        if (fieldFilter == null) {
            return query;
        }
        return new BooleanQuery.Builder()
                .add(query, BooleanClause.Occur.MUST)
                .add(new TermQuery(new Term(IndexedFieldDocumentFactory.FIELD_KIND, fieldFilter.code())),
                        BooleanClause.Occur.FILTER)
                .build();
    }

    @Override
    public long fieldCount() {
        final SearcherManager manager = searcherManager;
        if (manager == null) {
            return 0;
        }
        try {
            final IndexSearcher searcher = manager.acquire();
            try {
                return searcher.getIndexReader().numDocs();
            } finally {
                manager.release(searcher);
            }
        } catch (final IOException | AlreadyClosedException e) {
            logger.warn("Could not count documents of {} index", kind(), e);
            return 0;
        }
    }

    public Path getIndexPath() {
        return indexPath;
    }

    private IndexWriter writer() throws IOException {
        final IndexWriter writer = indexWriter;
        if (writer == null) {
            throw new IOException(kind() + " index is not initialized");
        }
        return writer;
    }

    @Override
    public void close() throws IOException {
        if (refreshScheduler != null) {
            refreshScheduler.shutdown();
            try {
                if (!refreshScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    refreshScheduler.shutdownNow();
                }
            } catch (final InterruptedException e) {
                refreshScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        // Close SearcherManager before IndexWriter
        final SearcherManager manager = searcherManager;
        searcherManager = null;
        if (manager != null) {
            manager.close();
        }
        if (indexWriter != null) {
            indexWriter.close();
            indexWriter = null;
        }
        if (directory != null) {
            directory.close();
        }
        analyzer.close();
        logger.info("{} index closed", kind());
    }
}
