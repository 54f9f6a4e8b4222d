package de.mirkosertic.mcp.memoryindex.index;

import de.mirkosertic.mcp.memoryindex.analysis.EnglishStemmingAnalyzer;
import de.mirkosertic.mcp.memoryindex.analysis.TextSegmenter;
import de.mirkosertic.mcp.memoryindex.analysis.UnicodeNormalizingAnalyzer;
import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.miscellaneous.PerFieldAnalyzerWrapper;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.LeafReader;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MultiTermQuery;
import org.apache.lucene.search.PhraseQuery;
import org.apache.lucene.search.PrefixQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.WildcardQuery;
import org.apache.lucene.util.Bits;
import org.apache.lucene.util.automaton.Operations;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static de.mirkosertic.mcp.memoryindex.index.IndexedFieldDocumentFactory.CONTENT;
import static de.mirkosertic.mcp.memoryindex.index.IndexedFieldDocumentFactory.CONTENT_STEMMED;
import static de.mirkosertic.mcp.memoryindex.index.IndexedFieldDocumentFactory.FIELD_KIND;

/**
 * Ranked boolean retrieval over whitespace-delimited tokens.
 *
 * <p>Plain keywords match the unstemmed {@code content} field and, at reduced weight, the English stemmed
 * {@code content_stemmed} shadow field. Patterns with a trailing {@code *} become prefix queries, other
 * {@code *}/{@code ?} patterns become wildcard queries. Both are rewritten with
 * {@link MultiTermQuery.TopTermsBlendedFreqScoringRewrite} so expanded terms keep BM25 scoring
 * instead of a constant score.</p>
 *
 * <p>Raw ranks are negated BM25 scores: more negative is better.</p>
 */
public class ExactTokenIndex extends AbstractLuceneIndex implements LiteralScanner {

    private static final Logger logger = LoggerFactory.getLogger(ExactTokenIndex.class);

    private static final int TOP_TERMS = 50;
    private static final float STEMMED_BOOST = 0.5f;

    private final TextSegmenter contentAnalysis = new TextSegmenter(new UnicodeNormalizingAnalyzer(), CONTENT);
    private final TextSegmenter stemmedAnalysis =
            new TextSegmenter(new EnglishStemmingAnalyzer(), CONTENT_STEMMED);

    public ExactTokenIndex(final Path indexPath, final long nrtRefreshIntervalMs) {
        super(indexPath, nrtRefreshIntervalMs, createAnalyzer());
    }

    private static Analyzer createAnalyzer() {
        return new PerFieldAnalyzerWrapper(new UnicodeNormalizingAnalyzer(),
                Map.of(CONTENT_STEMMED, new EnglishStemmingAnalyzer()));
    }

    @Override
    public BackendKind kind() {
        return BackendKind.EXACT;
    }

    @Override
    protected Document createDocument(final long documentId, final FieldKind kind, final String text) {
        return IndexedFieldDocumentFactory.createExactDocument(documentId, kind, text);
    }

    @Override
    protected List<IndexHit> doSearch(final IndexSearcher searcher, final BackendQuery query) throws IOException {
        final Query textQuery = buildQuery(query.text());
        if (textQuery == null) {
            return List.of();
        }
        final Query effective = withFieldFilter(textQuery, query.fieldFilter());
        logger.debug("Exact query: {}", effective);

        final TopDocs topDocs = searcher.search(effective, Math.max(1, query.limit()));
        final StoredFields storedFields = searcher.storedFields();
        final List<IndexHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
        for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
            hits.add(IndexedFieldDocumentFactory.toHit(storedFields.document(scoreDoc.doc), -scoreDoc.score));
        }
        return hits;
    }

    /**
     * Builds the Lucene query for a keyword or pattern, or returns {@code null} if nothing searchable remains.
     */
    @Nullable Query buildQuery(final String text) {
        final String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }

        final MultiTermQuery.RewriteMethod rewrite = new MultiTermQuery.TopTermsBlendedFreqScoringRewrite(TOP_TERMS);
        if (containsWildcard(trimmed)) {
            final String body = trimmed.substring(0, trimmed.length() - 1);
            if (trimmed.endsWith("*") && !containsWildcard(body)) {
                final String prefix = contentAnalysis.normalize(body);
                if (prefix.isEmpty()) {
                    return null;
                }
                return new PrefixQuery(new Term(CONTENT, prefix), rewrite);
            }
            final String pattern = normalizeWildcardPattern(trimmed);
            if (pattern == null) {
                return null;
            }
            return new WildcardQuery(new Term(CONTENT, pattern), Operations.DEFAULT_DETERMINIZE_WORK_LIMIT, rewrite);
        }

        final List<String> tokens = contentAnalysis.segment(trimmed);
        if (tokens.isEmpty()) {
            return null;
        }
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        builder.add(termsQuery(CONTENT, tokens), BooleanClause.Occur.SHOULD);
        final List<String> stemmed = stemmedAnalysis.segment(trimmed);
        if (!stemmed.isEmpty()) {
            builder.add(new BoostQuery(termsQuery(CONTENT_STEMMED, stemmed), STEMMED_BOOST), BooleanClause.Occur.SHOULD);
        }
        return builder.build();
    }

    private static Query termsQuery(final String field, final List<String> tokens) {
        if (tokens.size() == 1) {
            return new TermQuery(new Term(field, tokens.get(0)));
        }
        return new PhraseQuery(field, tokens.toArray(new String[0]));
    }

    private static boolean containsWildcard(final String text) {
        return text.indexOf('*') >= 0 || text.indexOf('?') >= 0;
    }

    /**
     * Normalizes the literal parts of a wildcard pattern the same way indexed tokens are normalized.
     *
     * @return the normalized pattern, or {@code null} if the pattern has no literal characters
     */
    private @Nullable String normalizeWildcardPattern(final String pattern) {
        final StringBuilder result = new StringBuilder();
        final StringBuilder literal = new StringBuilder();
        boolean hasLiteral = false;
        for (int i = 0; i < pattern.length(); i++) {
            final char c = pattern.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    result.append(contentAnalysis.normalize(literal.toString()));
                    literal.setLength(0);
                    hasLiteral = true;
                }
                result.append(c);
            } else if (c != '\\') {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            result.append(contentAnalysis.normalize(literal.toString()));
            hasLiteral = true;
        }
        return hasLiteral ? result.toString() : null;
    }

    @Override
    public BackendResult scan(final String literal, final @Nullable FieldKind fieldFilter, final int limit) {
        final String needle = literal.trim().toLowerCase(Locale.ROOT);
        if (needle.isEmpty()) {
            return BackendResult.ok(List.of());
        }
        return execute(BackendKind.LITERAL, searcher -> scanStoredContent(searcher, needle, fieldFilter, limit));
    }

    private static List<IndexHit> scanStoredContent(final IndexSearcher searcher, final String needle,
                                                    final @Nullable FieldKind fieldFilter, final int limit)
            throws IOException {
        final List<IndexHit> hits = new ArrayList<>();
        for (final LeafReaderContext leafReaderContext : searcher.getIndexReader().leaves()) {
            final LeafReader reader = leafReaderContext.reader();
            final Bits liveDocs = reader.getLiveDocs();
            final StoredFields storedFields = reader.storedFields();
            for (int doc = 0; doc < reader.maxDoc(); doc++) {
                if (liveDocs != null && !liveDocs.get(doc)) {
                    continue;
                }
                final Document document = storedFields.document(doc);
                if (fieldFilter != null && !fieldFilter.code().equals(document.get(FIELD_KIND))) {
                    continue;
                }
                final String content = document.get(CONTENT);
                if (content != null && content.toLowerCase(Locale.ROOT).contains(needle)) {
                    hits.add(IndexedFieldDocumentFactory.toHit(document, 0.0));
                    if (hits.size() >= limit) {
                        return hits;
                    }
                }
            }
        }
        return hits;
    }

    @Override
    public void close() throws IOException {
        super.close();
        contentAnalysis.close();
        stemmedAnalysis.close();
    }
}
