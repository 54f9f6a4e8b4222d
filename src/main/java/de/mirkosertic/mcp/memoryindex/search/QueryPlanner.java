package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.analysis.AnalysisStrategy;
import de.mirkosertic.mcp.memoryindex.index.BackendFailure;
import de.mirkosertic.mcp.memoryindex.index.BackendKind;
import de.mirkosertic.mcp.memoryindex.index.BackendQuery;
import de.mirkosertic.mcp.memoryindex.index.BackendResult;
import de.mirkosertic.mcp.memoryindex.index.IndexBackend;
import de.mirkosertic.mcp.memoryindex.index.IndexHit;
import de.mirkosertic.mcp.memoryindex.index.LiteralScanner;
import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Single-keyword retrieval: classifies the keyword's script, picks the backend, runs the fuzzy variant
 * chain and adds a literal scan.
 *
 * <p>Two routes are evaluated for every keyword:</p>
 * <ol>
 *   <li>the primary backend. For the exact backend every variant is queried in priority order until enough
 *       distinct documents are collected; documents already found by a higher priority variant are skipped.</li>
 *   <li>a literal substring scan over the stored text of the exact backend. It contributes only documents the
 *       token route did not return, such as a keyword buried inside a larger token, and scores them below
 *       every token hit.</li>
 * </ol>
 * A failing route is recorded and the other one still answers. The keyword only counts as failed if no route
 * answered.
 */
public class QueryPlanner {

    private static final Logger logger = LoggerFactory.getLogger(QueryPlanner.class);

    /**
     * Field rows requested per wanted document, since one document can match in several fields.
     */
    private static final int FIELDS_PER_DOCUMENT = 4;

    private final IndexBackend exactBackend;
    private final IndexBackend segmentedBackend;
    private final LiteralScanner literalScanner;
    private final FuzzyVariantGenerator variantGenerator;
    private final ScoreNormalizer normalizer;
    private final int candidateLimit;

    public QueryPlanner(final IndexBackend exactBackend,
                        final IndexBackend segmentedBackend,
                        final LiteralScanner literalScanner,
                        final FuzzyVariantGenerator variantGenerator,
                        final ScoreNormalizer normalizer,
                        final int candidateLimit) {
        this.exactBackend = exactBackend;
        this.segmentedBackend = segmentedBackend;
        this.literalScanner = literalScanner;
        this.variantGenerator = variantGenerator;
        this.normalizer = normalizer;
        this.candidateLimit = candidateLimit;
    }

    /**
     * Splits a raw query into keywords on whitespace. Repeated keywords keep their first occurrence.
     */
    public static List<String> keywords(final @Nullable String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        final Set<String> keywords = new LinkedHashSet<>();
        for (final String part : query.trim().split("\\s+")) {
            if (!part.isEmpty()) {
                keywords.add(part);
            }
        }
        return new ArrayList<>(keywords);
    }

    /**
     * Retrieves hits for one keyword.
     *
     * @param documentLimit number of distinct documents after which the variant chain stops
     */
    public KeywordResult retrieve(final String keyword, final @Nullable FieldKind fieldFilter,
                                  final int documentLimit, final boolean fuzzy) {
        final int hitLimit = (int) Math.min(candidateLimit, (long) Math.max(1, documentLimit) * FIELDS_PER_DOCUMENT);
        final List<ScoredHit> hits = new ArrayList<>();
        final Set<BackendKind> routes = EnumSet.noneOf(BackendKind.class);
        final List<BackendFailure> failures = new ArrayList<>();

        final AnalysisStrategy strategy = ScriptClassifier.classify(keyword);
        if (strategy == AnalysisStrategy.SEGMENTED) {
            retrieveSegmented(keyword, fieldFilter, hitLimit, fuzzy, hits, routes, failures);
        } else {
            retrieveExact(keyword, fieldFilter, documentLimit, hitLimit, fuzzy, hits, routes, failures);
        }

        addLiteralHits(keyword, fieldFilter, hits, routes, failures);

        final boolean failed = routes.isEmpty();
        if (failed) {
            logger.warn("No route could answer keyword '{}': {}", keyword, failures);
        } else if (!failures.isEmpty()) {
            logger.warn("Keyword '{}' answered by {} after failures: {}", keyword, routes, failures);
        }
        return new KeywordResult(keyword, hits, routes, failures, failed);
    }

    /**
     * Merges substring matches for documents the token route missed. Their score is capped at the lowest token
     * score of the keyword, so they never outrank a token match.
     */
    private void addLiteralHits(final String keyword, final @Nullable FieldKind fieldFilter,
                                final List<ScoredHit> hits, final Set<BackendKind> routes,
                                final List<BackendFailure> failures) {
        // Documents already matched by tokens occupy scan slots too, so the scan gets the full candidate limit
        final BackendResult result = literalScanner.scan(keyword, fieldFilter, candidateLimit);
        if (!result.isOk()) {
            failures.add(result.failure());
            return;
        }
        routes.add(BackendKind.LITERAL);

        final Set<Long> tokenDocuments = new HashSet<>();
        double ceiling = 1.0;
        for (final ScoredHit hit : hits) {
            tokenDocuments.add(hit.documentId());
            ceiling = Math.min(ceiling, hit.score());
        }
        final QueryVariant literal = QueryVariant.of(keyword, VariantKind.LITERAL);
        int added = 0;
        for (final IndexHit hit : result.hits()) {
            if (tokenDocuments.contains(hit.documentId())) {
                continue;
            }
            final double score = normalizer.normalize(BackendKind.LITERAL, hit.rawRank(), 1.0) * literal.weight();
            hits.add(new ScoredHit(hit, BackendKind.LITERAL, literal, keyword, Math.min(score, ceiling)));
            added++;
        }
        logger.debug("Literal scan for '{}' added {} hits", keyword, added);
    }

    private void retrieveSegmented(final String keyword, final @Nullable FieldKind fieldFilter, final int hitLimit,
                                   final boolean fuzzy, final List<ScoredHit> hits, final Set<BackendKind> routes,
                                   final List<BackendFailure> failures) {
        final BackendResult result = segmentedBackend.search(new BackendQuery(keyword, fieldFilter, hitLimit, fuzzy));
        if (!result.isOk()) {
            failures.add(result.failure());
            return;
        }
        routes.add(BackendKind.SEGMENTED);
        final QueryVariant variant = QueryVariant.of(keyword, fuzzy ? VariantKind.APPROXIMATE : VariantKind.EXACT);
        final double best = ScoreNormalizer.bestRawRank(BackendKind.SEGMENTED, result.hits());
        for (final IndexHit hit : result.hits()) {
            hits.add(score(hit, BackendKind.SEGMENTED, variant, keyword, best));
        }
        logger.debug("Segmented route for '{}' found {} hits", keyword, result.hits().size());
    }

    private void retrieveExact(final String keyword, final @Nullable FieldKind fieldFilter, final int documentLimit,
                               final int hitLimit, final boolean fuzzy, final List<ScoredHit> hits,
                               final Set<BackendKind> routes, final List<BackendFailure> failures) {
        final Set<Long> seenDocuments = new HashSet<>();
        for (final QueryVariant variant : variantGenerator.variants(keyword, fuzzy)) {
            final BackendResult result = exactBackend.search(
                    new BackendQuery(variant.pattern(), fieldFilter, hitLimit, false));
            if (!result.isOk()) {
                // Further variants would hit the same broken backend
                failures.add(result.failure());
                return;
            }
            routes.add(BackendKind.EXACT);

            final double best = ScoreNormalizer.bestRawRank(BackendKind.EXACT, result.hits());
            final Set<Long> variantDocuments = new HashSet<>();
            for (final IndexHit hit : result.hits()) {
                if (seenDocuments.contains(hit.documentId())) {
                    continue;
                }
                hits.add(score(hit, BackendKind.EXACT, variant, keyword, best));
                variantDocuments.add(hit.documentId());
            }
            seenDocuments.addAll(variantDocuments);
            logger.debug("Variant '{}' ({}) of '{}' added {} documents", variant.pattern(), variant.kind(),
                    keyword, variantDocuments.size());

            if (seenDocuments.size() >= documentLimit) {
                return;
            }
        }
    }

    private ScoredHit score(final IndexHit hit, final BackendKind backend, final QueryVariant variant,
                            final String keyword, final double bestRawRank) {
        final double normalized = normalizer.normalize(backend, hit.rawRank(), bestRawRank);
        return new ScoredHit(hit, backend, variant, keyword, normalized * variant.weight());
    }
}
