package de.mirkosertic.mcp.memoryindex.index;

import de.mirkosertic.mcp.memoryindex.analysis.SegmentingAnalyzer;
import de.mirkosertic.mcp.memoryindex.analysis.TextSegmenter;
import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.FuzzyQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static de.mirkosertic.mcp.memoryindex.index.IndexedFieldDocumentFactory.CONTENT;

/**
 * Ranked retrieval over dictionary segmented tokens.
 *
 * <p>Text is segmented with {@link SegmentingAnalyzer} at index and query time. Every query token must
 * match. With approximate matching enabled, tokens of three or more code points match within one edit,
 * five or more within two edits.</p>
 *
 * <p>Raw ranks are relevance values in (0,1]: each hit's score divided by the best score of the result set.</p>
 */
public class SegmentedTokenIndex extends AbstractLuceneIndex {

    private static final Logger logger = LoggerFactory.getLogger(SegmentedTokenIndex.class);

    private static final int ONE_EDIT_MIN_CODE_POINTS = 3;
    private static final int TWO_EDITS_MIN_CODE_POINTS = 5;

    private final TextSegmenter segmenter = new TextSegmenter(new SegmentingAnalyzer(), CONTENT);

    public SegmentedTokenIndex(final Path indexPath, final long nrtRefreshIntervalMs) {
        super(indexPath, nrtRefreshIntervalMs, new SegmentingAnalyzer());
    }

    @Override
    public BackendKind kind() {
        return BackendKind.SEGMENTED;
    }

    @Override
    protected Document createDocument(final long documentId, final FieldKind kind, final String text) {
        return IndexedFieldDocumentFactory.createSegmentedDocument(documentId, kind, text);
    }

    @Override
    protected List<IndexHit> doSearch(final IndexSearcher searcher, final BackendQuery query) throws IOException {
        final String text = query.text().replace("*", " ").replace("?", " ").trim();
        final Set<String> tokens = new LinkedHashSet<>(segmenter.segment(text));
        if (tokens.isEmpty()) {
            return List.of();
        }

        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (final String token : tokens) {
            builder.add(tokenQuery(token, query.approximate()), BooleanClause.Occur.MUST);
        }
        final Query effective = withFieldFilter(builder.build(), query.fieldFilter());
        logger.debug("Segmented query: {}", effective);

        final TopDocs topDocs = searcher.search(effective, Math.max(1, query.limit()));
        if (topDocs.scoreDocs.length == 0) {
            return List.of();
        }
        final float topScore = topDocs.scoreDocs[0].score;
        final StoredFields storedFields = searcher.storedFields();
        final List<IndexHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
        for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
            final double relevance = topScore > 0 ? scoreDoc.score / topScore : 1.0;
            hits.add(IndexedFieldDocumentFactory.toHit(storedFields.document(scoreDoc.doc), relevance));
        }
        return hits;
    }

    static Query tokenQuery(final String token, final boolean approximate) {
        final Term term = new Term(CONTENT, token);
        final int codePoints = token.codePointCount(0, token.length());
        if (!approximate || codePoints < ONE_EDIT_MIN_CODE_POINTS) {
            return new TermQuery(term);
        }
        return new FuzzyQuery(term, codePoints >= TWO_EDITS_MIN_CODE_POINTS ? 2 : 1);
    }

    /**
     * Tokens the segmenter produces for the given text.
     */
    public List<String> segment(final String text) {
        return segmenter.segment(text);
    }

    @Override
    public void close() throws IOException {
        super.close();
        segmenter.close();
    }
}
