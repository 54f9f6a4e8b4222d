package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.config.ApplicationConfig;
import de.mirkosertic.mcp.memoryindex.index.BackendFailure;
import de.mirkosertic.mcp.memoryindex.index.BackendKind;
import de.mirkosertic.mcp.memoryindex.store.ContentStore;
import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import de.mirkosertic.mcp.memoryindex.store.SourceCategory;
import de.mirkosertic.mcp.memoryindex.store.StoredDocument;
import de.mirkosertic.mcp.memoryindex.store.TagUsage;
import de.mirkosertic.mcp.memoryindex.store.TaggedDocument;
import de.mirkosertic.mcp.memoryindex.store.TopicHit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Query side of the memory index.
 *
 * <p>A free-text search runs through these stages:</p>
 * <ol>
 *   <li>split the query into keywords and resolve the tag filter</li>
 *   <li>retrieve per keyword through the {@link QueryPlanner}, in parallel when more than one keyword is given</li>
 *   <li>aggregate a single keyword's hits, or combine several keywords into one score per document</li>
 *   <li>drop deleted documents, candidates outside the tag filter and candidates below the minimum relevance</li>
 *   <li>sort with {@link ResultOrdering}, paginate, then attach tags, snippets and timeline positions</li>
 * </ol>
 *
 * <p>Searches never throw. Bypassed backend failures make the outcome {@link SearchStatus#DEGRADED}; if nothing
 * could answer it is {@link SearchStatus#FAILED} with no results.</p>
 */
public class SearchService implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

    private final ContentStore contentStore;
    private final QueryPlanner planner;
    private final ResultAggregator aggregator = new ResultAggregator();
    private final MultiKeywordCombiner combiner = new MultiKeywordCombiner();
    private final SnippetExtractor snippetExtractor;
    private final TimelineResolver timelineResolver;
    private final ReportSummaryExtractor summaryExtractor;
    private final QueryRuntimeStats runtimeStats = new QueryRuntimeStats();
    private final int fullContentMaxChars;
    private final int candidateLimit;
    private final @Nullable ExecutorService keywordExecutor;

    public SearchService(final ContentStore contentStore, final QueryPlanner planner, final ApplicationConfig config) {
        this.contentStore = contentStore;
        this.planner = planner;
        this.snippetExtractor = new SnippetExtractor(config.getSnippetContextChars(), config.getSnippetFallbackChars());
        this.timelineResolver = new TimelineResolver(contentStore, config.getTimelineProbeChars(),
                config.getTimelineWindowSeconds());
        this.summaryExtractor = new ReportSummaryExtractor(50);
        this.fullContentMaxChars = config.getFullContentMaxChars();
        this.candidateLimit = config.getCandidateLimit();

        final int threads = config.getKeywordThreads();
        if (threads > 1) {
            final AtomicInteger threadCounter = new AtomicInteger(0);
            this.keywordExecutor = Executors.newFixedThreadPool(threads, r -> {
                final Thread thread = new Thread(r, "keyword-search-" + threadCounter.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            });
        } else {
            this.keywordExecutor = null;
        }
        logger.info("Search service initialized (keyword threads: {}, candidate limit: {})", threads, candidateLimit);
    }

    // ------------------------------------------------------------------
    // Free-text search
    // ------------------------------------------------------------------

    public SearchOutcome search(final SearchOptions options) {
        final List<String> keywords = QueryPlanner.keywords(options.query());
        if (keywords.isEmpty()) {
            return SearchOutcome.emptyQuery();
        }

        final long startTime = System.currentTimeMillis();
        final Set<BackendKind> routes = EnumSet.noneOf(BackendKind.class);
        SearchOutcome outcome;
        try {
            outcome = execute(options, keywords, routes);
        } catch (final RuntimeException e) {
            logger.error("Search for '{}' failed", options.query(), e);
            outcome = SearchOutcome.failed(List.of());
        }
        final long duration = System.currentTimeMillis() - startTime;
        runtimeStats.recordQuery(duration, outcome.results().size(), routes, outcome.status());

        logger.info("Search '{}' ({} keywords, sort {}) returned {} results with status {} in {}ms",
                options.query(), keywords.size(), options.sortBy(), outcome.results().size(), outcome.status(),
                duration);
        return outcome;
    }

    private SearchOutcome execute(final SearchOptions options, final List<String> keywords,
                                  final Set<BackendKind> routes) {
        final Set<Long> allowedDocuments = resolveTagFilter(options);
        if (allowedDocuments != null && allowedDocuments.isEmpty()) {
            logger.debug("Tag filter {} matches no document", options.tags());
            return new SearchOutcome(SearchStatus.OK, List.of(), List.of());
        }

        final boolean narrowWindow = keywords.size() == 1
                && allowedDocuments == null
                && options.sortBy() == SortMode.RELEVANCE;
        final int window = narrowWindow
                ? (int) Math.min(candidateLimit, (long) options.offset() + options.limit())
                : candidateLimit;

        final List<KeywordResult> keywordResults = retrieveAll(keywords, options, window);
        final List<BackendFailure> failures = new ArrayList<>();
        int failedKeywords = 0;
        for (final KeywordResult keywordResult : keywordResults) {
            routes.addAll(keywordResult.routes());
            failures.addAll(keywordResult.failures());
            if (keywordResult.failed()) {
                failedKeywords++;
            }
        }
        if (failedKeywords == keywordResults.size()) {
            return SearchOutcome.failed(failures);
        }

        final List<RankedMatch> matches = keywords.size() == 1
                ? aggregator.aggregate(keywordResults.get(0).hits(), options.aggregate())
                : combiner.combine(keywordResults, options.matchAllKeywords());

        final List<RankedMatch> accepted = new ArrayList<>(matches.size());
        final Set<Long> documentIds = new LinkedHashSet<>();
        for (final RankedMatch match : matches) {
            if (allowedDocuments != null && !allowedDocuments.contains(match.documentId())) {
                continue;
            }
            if (match.score() < options.minRelevance()) {
                continue;
            }
            accepted.add(match);
            documentIds.add(match.documentId());
        }

        final Map<Long, StoredDocument> documents = contentStore.findDocuments(documentIds);
        final List<RankedCandidate> candidates = new ArrayList<>(accepted.size());
        for (final RankedMatch match : accepted) {
            final StoredDocument document = documents.get(match.documentId());
            if (document != null) {
                candidates.add(new RankedCandidate(document, match));
            }
        }
        candidates.sort(ResultOrdering.comparator(options.sortBy()));

        final int from = Math.min(options.offset(), candidates.size());
        final int to = (int) Math.min(candidates.size(), (long) from + options.limit());
        final List<SearchResult> results = toResults(candidates.subList(from, to));

        final SearchStatus status = failures.isEmpty() ? SearchStatus.OK : SearchStatus.DEGRADED;
        return new SearchOutcome(status, results, failures);
    }

    /**
     * @return documents passing the tag filter, or {@code null} if no filter was requested
     */
    private @Nullable Set<Long> resolveTagFilter(final SearchOptions options) {
        final List<String> tags = options.tags().stream().filter(tag -> tag != null && !tag.isBlank()).toList();
        if (tags.isEmpty()) {
            return null;
        }
        return options.matchAllTags()
                ? contentStore.documentIdsWithAllTags(tags)
                : contentStore.documentIdsWithAnyTag(tags);
    }

    private List<KeywordResult> retrieveAll(final List<String> keywords, final SearchOptions options,
                                            final int window) {
        final FieldKind fieldFilter = options.fieldFilter();
        if (keywords.size() == 1 || keywordExecutor == null) {
            final List<KeywordResult> results = new ArrayList<>(keywords.size());
            for (final String keyword : keywords) {
                results.add(planner.retrieve(keyword, fieldFilter, window, options.fuzzy()));
            }
            return results;
        }

        final List<Future<KeywordResult>> futures = new ArrayList<>(keywords.size());
        for (final String keyword : keywords) {
            futures.add(keywordExecutor.submit(() -> planner.retrieve(keyword, fieldFilter, window, options.fuzzy())));
        }
        // Collected in keyword order so the merge does not depend on completion order
        final List<KeywordResult> results = new ArrayList<>(futures.size());
        for (final Future<KeywordResult> future : futures) {
            try {
                results.add(future.get());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(pending -> pending.cancel(true));
                throw new IllegalStateException("Interrupted while retrieving keywords", e);
            } catch (final ExecutionException e) {
                if (e.getCause() instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                throw new IllegalStateException("Keyword retrieval failed", e.getCause());
            }
        }
        return results;
    }

    private List<SearchResult> toResults(final List<RankedCandidate> page) {
        if (page.isEmpty()) {
            return List.of();
        }
        final Set<Long> pageIds = new LinkedHashSet<>();
        page.forEach(candidate -> pageIds.add(candidate.document().id()));
        final Map<Long, List<String>> tags = contentStore.tagsFor(pageIds);

        final List<SearchResult> results = new ArrayList<>(page.size());
        for (final RankedCandidate candidate : page) {
            final StoredDocument document = candidate.document();
            final RankedMatch match = candidate.match();
            final ScoredHit hit = match.representative();
            final String text = hit.hit().matchedText();

            final String snippet = snippetExtractor.extract(text, snippetTerms(match));
            final TimeRange timeRange = timelineResolver
                    .resolve(document.id(), hit.hit().fieldKind(), snippet)
                    .orElse(null);

            results.add(new SearchResult(
                    document.id(),
                    document.title(),
                    hit.hit().fieldKind(),
                    snippet,
                    text.length() <= fullContentMaxChars ? text : null,
                    timeRange,
                    tags.getOrDefault(document.id(), List.of()),
                    document.sourceCategory(),
                    document.durationSeconds(),
                    document.fileRef(),
                    match.rawRank(),
                    match.score(),
                    document.createdAt(),
                    match.matchedKeywords()));
        }
        return results;
    }

    /**
     * Matched keywords first, then the literal parts of the variant that produced the hit, which is what
     * occurs in the text after a typo tolerant match.
     */
    static List<String> snippetTerms(final RankedMatch match) {
        final Set<String> terms = new LinkedHashSet<>(match.matchedKeywords());
        for (final String part : match.representative().variant().pattern().split("[*?]")) {
            if (part.length() >= 2) {
                terms.add(part);
            }
        }
        return new ArrayList<>(terms);
    }

    // ------------------------------------------------------------------
    // Tags, topics and documents
    // ------------------------------------------------------------------

    /**
     * Documents carrying all (AND) or any (OR) of the given tags. An empty tag list applies no filter, as in
     * {@link #search}, and returns the newest documents.
     */
    public List<TaggedDocument> searchByTags(final List<String> tags, final boolean matchAll,
                                             final int limit, final int offset) {
        final List<TaggedDocument> documents = contentStore.searchByTags(tags, matchAll, limit, offset);
        logger.info("Tag search {} ({}) returned {} documents", tags, matchAll ? "AND" : "OR", documents.size());
        return documents;
    }

    public List<TopicHit> searchTopics(final String query, final int limit, final int offset) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        final List<TopicHit> topics = contentStore.searchTopics(query, limit, offset);
        logger.info("Topic search '{}' returned {} topics", query, topics.size());
        return topics;
    }

    public List<TagUsage> popularTags(final int limit) {
        return contentStore.popularTags(limit);
    }

    public List<String> suggestTags(final String prefix, final int limit) {
        return contentStore.suggestTags(prefix == null ? "" : prefix, limit);
    }

    public Optional<DocumentDetails> getDocument(final long documentId) {
        return contentStore.findDocument(documentId).map(document -> new DocumentDetails(
                document,
                contentStore.tagsFor(List.of(documentId)).getOrDefault(documentId, List.of()),
                contentStore.fieldsForDocument(documentId),
                contentStore.topicsForDocument(documentId),
                contentStore.timelineForDocument(documentId).size()));
    }

    /**
     * Newest documents first, each with its tags and a summary of its latest report.
     */
    public List<DocumentOverview> listDocuments(final @Nullable SourceCategory category, final int limit,
                                                final int offset) {
        final List<StoredDocument> documents = contentStore.listDocuments(category, limit, offset);
        final Set<Long> ids = new LinkedHashSet<>();
        documents.forEach(document -> ids.add(document.id()));
        final Map<Long, List<String>> tags = contentStore.tagsFor(ids);

        final List<DocumentOverview> overviews = new ArrayList<>(documents.size());
        for (final StoredDocument document : documents) {
            final String summary = contentStore.latestFieldText(document.id(), FieldKind.REPORT)
                    .flatMap(summaryExtractor::extract)
                    .orElse(null);
            overviews.add(new DocumentOverview(document, tags.getOrDefault(document.id(), List.of()), summary));
        }
        return overviews;
    }

    public QueryRuntimeStats getRuntimeStats() {
        return runtimeStats;
    }

    @Override
    public void close() {
        if (keywordExecutor == null) {
            return;
        }
        keywordExecutor.shutdown();
        try {
            if (!keywordExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Keyword search threads did not terminate in time, forcing shutdown");
                keywordExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for keyword search threads to terminate", e);
            keywordExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
