package de.mirkosertic.mcp.memoryindex;

import de.mirkosertic.mcp.memoryindex.index.BackendFailure;
import de.mirkosertic.mcp.memoryindex.index.BackendKind;
import de.mirkosertic.mcp.memoryindex.index.IndexBackend;
import de.mirkosertic.mcp.memoryindex.index.IndexedFieldDocumentFactory;
import de.mirkosertic.mcp.memoryindex.ingest.IngestionService;
import de.mirkosertic.mcp.memoryindex.ingest.RebuildResult;
import de.mirkosertic.mcp.memoryindex.mcp.SchemaGenerator;
import de.mirkosertic.mcp.memoryindex.mcp.ToolResultHelper;
import de.mirkosertic.mcp.memoryindex.mcp.dto.AddIndexedFieldRequest;
import de.mirkosertic.mcp.memoryindex.mcp.dto.AddTagsRequest;
import de.mirkosertic.mcp.memoryindex.mcp.dto.AddTimelineEntriesRequest;
import de.mirkosertic.mcp.memoryindex.mcp.dto.AddTopicsRequest;
import de.mirkosertic.mcp.memoryindex.mcp.dto.DocumentEntry;
import de.mirkosertic.mcp.memoryindex.mcp.dto.DocumentIdRequest;
import de.mirkosertic.mcp.memoryindex.mcp.dto.DocumentListResponse;
import de.mirkosertic.mcp.memoryindex.mcp.dto.GetDocumentResponse;
import de.mirkosertic.mcp.memoryindex.mcp.dto.IndexStatsResponse;
import de.mirkosertic.mcp.memoryindex.mcp.dto.IngestDocumentRequest;
import de.mirkosertic.mcp.memoryindex.mcp.dto.ListDocumentsRequest;
import de.mirkosertic.mcp.memoryindex.mcp.dto.PopularTagsRequest;
import de.mirkosertic.mcp.memoryindex.mcp.dto.SearchByTagsRequest;
import de.mirkosertic.mcp.memoryindex.mcp.dto.SearchHit;
import de.mirkosertic.mcp.memoryindex.mcp.dto.SearchRequest;
import de.mirkosertic.mcp.memoryindex.mcp.dto.SearchResponse;
import de.mirkosertic.mcp.memoryindex.mcp.dto.SearchTopicsRequest;
import de.mirkosertic.mcp.memoryindex.mcp.dto.SimpleMessageResponse;
import de.mirkosertic.mcp.memoryindex.mcp.dto.SuggestTagsRequest;
import de.mirkosertic.mcp.memoryindex.mcp.dto.TagEntry;
import de.mirkosertic.mcp.memoryindex.mcp.dto.TagListResponse;
import de.mirkosertic.mcp.memoryindex.mcp.dto.TagSuggestionResponse;
import de.mirkosertic.mcp.memoryindex.mcp.dto.TopicHitEntry;
import de.mirkosertic.mcp.memoryindex.mcp.dto.TopicSearchResponse;
import de.mirkosertic.mcp.memoryindex.search.DocumentDetails;
import de.mirkosertic.mcp.memoryindex.search.QueryRuntimeStats;
import de.mirkosertic.mcp.memoryindex.search.SearchOptions;
import de.mirkosertic.mcp.memoryindex.search.SearchOutcome;
import de.mirkosertic.mcp.memoryindex.search.SearchService;
import de.mirkosertic.mcp.memoryindex.search.SearchStatus;
import de.mirkosertic.mcp.memoryindex.store.ContentStore;
import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import de.mirkosertic.mcp.memoryindex.store.IndexedField;
import de.mirkosertic.mcp.memoryindex.store.StoreStatistics;
import de.mirkosertic.mcp.memoryindex.store.StoredDocument;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * MCP tools of the memory index: hybrid search, tag and topic lookups, ingestion and index maintenance.
 */
public class MemoryIndexTools {

    private static final Logger logger = LoggerFactory.getLogger(MemoryIndexTools.class);

    private static final String SEARCH_DESCRIPTION = """
            Search archived reports, transcripts, OCR text and topics. \
            The query is split into keywords on whitespace. Latin-script keywords of 3 to 8 letters tolerate small \
            typos (a missing or an extra character); disable this with fuzzy=false. Keywords containing Chinese \
            characters are segmented and matched approximately. Several keywords are combined: a document's score is \
            the average of its best per-keyword scores, weighted by how many keywords it matched. \
            Use matchAllKeywords=true to require every keyword. \
            Filter by tags (AND by default), by field kind, and by minimum relevance (0.0 to 1.0). \
            Returns: results with snippet, score, tags, optional full text for short fields, and for transcript/OCR \
            matches an approximate time range. The status is degraded if an index was bypassed.""";

    private final SearchService searchService;
    private final IngestionService ingestionService;
    private final ContentStore contentStore;
    private final List<IndexBackend> backends;
    private final String indexPath;

    public MemoryIndexTools(final SearchService searchService,
                            final IngestionService ingestionService,
                            final ContentStore contentStore,
                            final List<IndexBackend> backends,
                            final String indexPath) {
        this.searchService = searchService;
        this.ingestionService = ingestionService;
        this.contentStore = contentStore;
        this.backends = List.copyOf(backends);
        this.indexPath = indexPath;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        // Query tools
        tools.add(tool("search", SEARCH_DESCRIPTION,
                SchemaGenerator.generateSchema(SearchRequest.class), this::search));
        tools.add(tool("searchByTags",
                "Find documents by tags only, without text search. AND mode returns documents carrying every tag, "
                        + "newest first; OR mode ranks by the number of matched tags, then recency. Without tags "
                        + "no filter applies and the newest documents are returned.",
                SchemaGenerator.generateSchema(SearchByTagsRequest.class), this::searchByTags));
        tools.add(tool("searchTopics",
                "Find topics (chapters) whose title or summary contains the given text.",
                SchemaGenerator.generateSchema(SearchTopicsRequest.class), this::searchTopics));
        tools.add(tool("popularTags",
                "List the most used tags with their usage counts.",
                SchemaGenerator.generateSchema(PopularTagsRequest.class), this::popularTags));
        tools.add(tool("suggestTags",
                "Complete a tag name prefix to existing tag names, most used first.",
                SchemaGenerator.generateSchema(SuggestTagsRequest.class), this::suggestTags));
        tools.add(tool("getDocument",
                "Get a document with its tags, all stored field texts and its topics.",
                SchemaGenerator.generateSchema(DocumentIdRequest.class), this::getDocument));
        tools.add(tool("listDocuments",
                "List documents newest first with tags and a short summary of their latest report.",
                SchemaGenerator.generateSchema(ListDocumentsRequest.class), this::listDocuments));

        // Ingestion tools
        tools.add(tool("ingestDocument",
                "Create a document or replace its metadata. Text is added separately with addIndexedField.",
                SchemaGenerator.generateSchema(IngestDocumentRequest.class), this::ingestDocument));
        tools.add(tool("addIndexedField",
                "Add searchable text (report, transcript, ocr or topic) to a document. Fields are immutable; "
                        + "adding new text for the same kind keeps the old text searchable as well.",
                SchemaGenerator.generateSchema(AddIndexedFieldRequest.class), this::addIndexedField));
        tools.add(tool("addTags",
                "Attach tags to a document. Missing tags are created.",
                SchemaGenerator.generateSchema(AddTagsRequest.class), this::addTags));
        tools.add(tool("addTopics",
                "Add topics (chapters) to a document.",
                SchemaGenerator.generateSchema(AddTopicsRequest.class), this::addTopics));
        tools.add(tool("addTimelineEntries",
                "Add timeline entries to a video or audio document. They let search results point to a position "
                        + "in time.",
                SchemaGenerator.generateSchema(AddTimelineEntriesRequest.class), this::addTimelineEntries));
        tools.add(tool("deleteDocument",
                "Delete a document together with its fields, tags, topics, timeline and index entries.",
                SchemaGenerator.generateSchema(DocumentIdRequest.class), this::deleteDocument));

        // Maintenance tools
        tools.add(tool("rebuildIndex",
                "Rebuild both full-text indexes from the stored documents. Only needed after corruption.",
                SchemaGenerator.emptySchema(), args -> rebuildIndex()));
        tools.add(tool("getIndexStats",
                "Get document, field, tag and topic counts, index state and search runtime statistics.",
                SchemaGenerator.emptySchema(), args -> getIndexStats()));

        return tools;
    }

    private static McpServerFeatures.SyncToolSpecification tool(
            final String name, final String description, final McpSchema.JsonSchema schema,
            final Function<Map<String, Object>, McpSchema.CallToolResult> handler) {
        return McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name(name)
                        .description(description)
                        .inputSchema(schema)
                        .build())
                .callHandler((exchange, request) -> handler.apply(
                        request.arguments() == null ? Map.of() : request.arguments()))
                .build();
    }

    // ------------------------------------------------------------------
    // Query tools
    // ------------------------------------------------------------------

    McpSchema.CallToolResult search(final Map<String, Object> args) {
        final SearchOptions options;
        try {
            options = SearchRequest.fromMap(args).toOptions();
        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid search request: {}", e.getMessage());
            return ToolResultHelper.createResult(SearchResponse.error("Invalid search request: " + e.getMessage()));
        }

        logger.info("Search request: query='{}', tags={}, fieldKind={}, limit={}, offset={}, sortBy={}",
                options.query(), options.tags(), options.fieldFilter(), options.limit(), options.offset(),
                options.sortBy());

        final long startTime = System.nanoTime();
        final SearchOutcome outcome = searchService.search(options);
        final long durationMs = (System.nanoTime() - startTime) / 1_000_000;

        if (outcome.status() == SearchStatus.FAILED) {
            return ToolResultHelper.createResult(SearchResponse.error(
                    "Search failed, no index could answer the query" + describeFailures(outcome.failures())));
        }
        final List<SearchHit> hits = outcome.results().stream().map(SearchHit::from).toList();
        final List<String> warnings = outcome.failures().stream()
                .map(failure -> failure.backend() + " " + failure.reason() + ": " + failure.message())
                .toList();
        return ToolResultHelper.createResult(SearchResponse.success(
                outcome.status().name().toLowerCase(Locale.ROOT), hits, warnings, durationMs));
    }

    private static String describeFailures(final List<BackendFailure> failures) {
        if (failures.isEmpty()) {
            return "";
        }
        final StringBuilder result = new StringBuilder(" (");
        for (int i = 0; i < failures.size(); i++) {
            if (i > 0) {
                result.append("; ");
            }
            result.append(failures.get(i).backend()).append(": ").append(failures.get(i).message());
        }
        return result.append(')').toString();
    }

    McpSchema.CallToolResult searchByTags(final Map<String, Object> args) {
        final SearchByTagsRequest request = SearchByTagsRequest.fromMap(args);
        try {
            final List<DocumentEntry> documents = searchService
                    .searchByTags(request.tags(), request.effectiveMatchAll(), request.effectiveLimit(),
                            request.effectiveOffset())
                    .stream().map(DocumentEntry::fromTagged).toList();
            return ToolResultHelper.createResult(DocumentListResponse.success(documents));
        } catch (final DataAccessException e) {
            logger.error("Tag search failed", e);
            return ToolResultHelper.createResult(DocumentListResponse.error("Tag search failed: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult searchTopics(final Map<String, Object> args) {
        final SearchTopicsRequest request = SearchTopicsRequest.fromMap(args);
        if (request.query() == null || request.query().isBlank()) {
            return ToolResultHelper.createResult(TopicSearchResponse.error("query is required"));
        }
        try {
            final List<TopicHitEntry> topics = searchService
                    .searchTopics(request.query(), request.effectiveLimit(), request.effectiveOffset())
                    .stream().map(TopicHitEntry::from).toList();
            return ToolResultHelper.createResult(TopicSearchResponse.success(topics));
        } catch (final DataAccessException e) {
            logger.error("Topic search failed", e);
            return ToolResultHelper.createResult(TopicSearchResponse.error("Topic search failed: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult popularTags(final Map<String, Object> args) {
        final PopularTagsRequest request = PopularTagsRequest.fromMap(args);
        try {
            final List<TagEntry> tags = searchService.popularTags(request.effectiveLimit())
                    .stream().map(TagEntry::from).toList();
            return ToolResultHelper.createResult(TagListResponse.success(tags));
        } catch (final DataAccessException e) {
            logger.error("Loading popular tags failed", e);
            return ToolResultHelper.createResult(TagListResponse.error("Loading tags failed: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult suggestTags(final Map<String, Object> args) {
        final SuggestTagsRequest request = SuggestTagsRequest.fromMap(args);
        final String prefix = request.prefix() == null ? "" : request.prefix();
        try {
            return ToolResultHelper.createResult(TagSuggestionResponse.success(prefix,
                    searchService.suggestTags(prefix, request.effectiveLimit())));
        } catch (final DataAccessException e) {
            logger.error("Tag suggestion failed", e);
            return ToolResultHelper.createResult(TagSuggestionResponse.error("Tag suggestion failed: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getDocument(final Map<String, Object> args) {
        final long documentId;
        try {
            documentId = DocumentIdRequest.fromMap(args).documentId();
        } catch (final IllegalArgumentException e) {
            return ToolResultHelper.createResult(GetDocumentResponse.error(e.getMessage()));
        }
        try {
            final Optional<DocumentDetails> details = searchService.getDocument(documentId);
            if (details.isEmpty()) {
                return ToolResultHelper.createResult(GetDocumentResponse.error("Document not found: " + documentId));
            }
            return ToolResultHelper.createResult(GetDocumentResponse.success(details.get()));
        } catch (final DataAccessException e) {
            logger.error("Loading document {} failed", documentId, e);
            return ToolResultHelper.createResult(GetDocumentResponse.error("Loading document failed: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult listDocuments(final Map<String, Object> args) {
        final ListDocumentsRequest request = ListDocumentsRequest.fromMap(args);
        try {
            final List<DocumentEntry> documents = searchService
                    .listDocuments(request.effectiveCategory(), request.effectiveLimit(), request.effectiveOffset())
                    .stream().map(DocumentEntry::fromOverview).toList();
            return ToolResultHelper.createResult(DocumentListResponse.success(documents));
        } catch (final DataAccessException e) {
            logger.error("Listing documents failed", e);
            return ToolResultHelper.createResult(DocumentListResponse.error("Listing documents failed: " + e.getMessage()));
        }
    }

    // ------------------------------------------------------------------
    // Ingestion tools
    // ------------------------------------------------------------------

    McpSchema.CallToolResult ingestDocument(final Map<String, Object> args) {
        return write("ingestDocument", () -> {
            final StoredDocument document = IngestDocumentRequest.fromMap(args).toDocument();
            ingestionService.upsertDocument(document);
            return "Document " + document.id() + " stored";
        });
    }

    McpSchema.CallToolResult addIndexedField(final Map<String, Object> args) {
        return write("addIndexedField", () -> {
            final AddIndexedFieldRequest request = AddIndexedFieldRequest.fromMap(args);
            final FieldKind kind = FieldKind.fromCode(request.fieldKind());
            final Optional<IndexedField> field = ingestionService.addIndexedField(request.documentId(), kind,
                    request.text());
            return field
                    .map(stored -> "Indexed " + kind.code() + " field " + stored.id() + " of document "
                            + request.documentId())
                    .orElse("Text is empty, nothing indexed");
        });
    }

    McpSchema.CallToolResult addTags(final Map<String, Object> args) {
        return write("addTags", () -> {
            final AddTagsRequest request = AddTagsRequest.fromMap(args);
            if (request.tags().isEmpty()) {
                throw new IllegalArgumentException("At least one tag is required");
            }
            final int linked = ingestionService.addTags(request.documentId(), request.tags(),
                    request.effectiveProvenance(), request.effectiveConfidence(), request.category());
            return "Linked " + linked + " new tags to document " + request.documentId();
        });
    }

    McpSchema.CallToolResult addTopics(final Map<String, Object> args) {
        return write("addTopics", () -> {
            final AddTopicsRequest request = AddTopicsRequest.fromMap(args);
            ingestionService.addTopics(request.documentId(), request.toTopics());
            return "Added " + request.topics().size() + " topics to document " + request.documentId();
        });
    }

    McpSchema.CallToolResult addTimelineEntries(final Map<String, Object> args) {
        return write("addTimelineEntries", () -> {
            final AddTimelineEntriesRequest request = AddTimelineEntriesRequest.fromMap(args);
            ingestionService.addTimelineEntries(request.documentId(), request.toEntries());
            return "Added " + request.entries().size() + " timeline entries to document " + request.documentId();
        });
    }

    McpSchema.CallToolResult deleteDocument(final Map<String, Object> args) {
        return write("deleteDocument", () -> {
            final long documentId = DocumentIdRequest.fromMap(args).documentId();
            if (!ingestionService.deleteDocument(documentId)) {
                throw new IllegalArgumentException("Document not found: " + documentId);
            }
            return "Document " + documentId + " deleted";
        });
    }

    McpSchema.CallToolResult rebuildIndex() {
        return write("rebuildIndex", () -> {
            final RebuildResult result = ingestionService.rebuildIndexes();
            return "Rebuilt indexes from " + result.fieldsIndexed() + " fields in " + result.durationMs() + "ms";
        });
    }

    @FunctionalInterface
    private interface WriteOperation {
        String run() throws IOException;
    }

    /**
     * Runs a write tool. Invalid arguments are reported as they are, storage failures are logged.
     */
    private McpSchema.CallToolResult write(final String toolName, final WriteOperation operation) {
        try {
            final String message = operation.run();
            return ToolResultHelper.createResult(SimpleMessageResponse.success(message));
        } catch (final IllegalArgumentException e) {
            logger.warn("{} rejected: {}", toolName, e.getMessage());
            return ToolResultHelper.createResult(SimpleMessageResponse.error(e.getMessage()));
        } catch (final IOException | DataAccessException e) {
            logger.error("{} failed", toolName, e);
            return ToolResultHelper.createResult(SimpleMessageResponse.error(toolName + " failed: " + e.getMessage()));
        }
    }

    // ------------------------------------------------------------------
    // Statistics
    // ------------------------------------------------------------------

    McpSchema.CallToolResult getIndexStats() {
        try {
            final StoreStatistics statistics = contentStore.statistics();
            final List<IndexStatsResponse.BackendStatus> backendStatus = backends.stream()
                    .map(backend -> new IndexStatsResponse.BackendStatus(
                            backend.kind().name().toLowerCase(Locale.ROOT),
                            backend.fieldCount(),
                            backend.isRebuildRequired()))
                    .toList();
            final IndexStatsResponse response = new IndexStatsResponse(
                    true,
                    statistics.documents(),
                    statistics.indexedFields(),
                    statistics.tags(),
                    statistics.topics(),
                    statistics.timelineEntries(),
                    statistics.documentsByCategory(),
                    statistics.fieldsByKind(),
                    indexPath,
                    IndexedFieldDocumentFactory.SCHEMA_VERSION,
                    backendStatus,
                    runtimeMetrics(searchService.getRuntimeStats()),
                    null);
            logger.info("Index stats: {} documents, {} fields", statistics.documents(), statistics.indexedFields());
            return ToolResultHelper.createResult(response);
        } catch (final DataAccessException e) {
            logger.error("Loading index statistics failed", e);
            return ToolResultHelper.createResult(IndexStatsResponse.error("Loading statistics failed: " + e.getMessage()));
        }
    }

    private static IndexStatsResponse.QueryRuntimeMetrics runtimeMetrics(final QueryRuntimeStats stats) {
        final QueryRuntimeStats.Percentiles percentiles = stats.getPercentiles();
        final Map<String, Long> routes = new LinkedHashMap<>();
        for (final Map.Entry<BackendKind, Long> entry : stats.getRouteCounts().entrySet()) {
            routes.put(entry.getKey().name().toLowerCase(Locale.ROOT), entry.getValue());
        }
        return new IndexStatsResponse.QueryRuntimeMetrics(
                stats.getTotalQueries(),
                String.format(Locale.ROOT, "%.1f", stats.getAverageDurationMs()),
                stats.getMinDurationMs(),
                stats.getMaxDurationMs(),
                String.format(Locale.ROOT, "%.1f", stats.getAverageResultCount()),
                percentiles == null ? null : percentiles.p50(),
                percentiles == null ? null : percentiles.p90(),
                percentiles == null ? null : percentiles.p99(),
                stats.getDegradedQueries(),
                stats.getFailedQueries(),
                routes);
    }
}
