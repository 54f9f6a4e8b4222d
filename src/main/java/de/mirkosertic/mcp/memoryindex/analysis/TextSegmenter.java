package de.mirkosertic.mcp.memoryindex.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.util.BytesRef;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs text through an {@link Analyzer} and returns the resulting terms.
 * Instances are thread-safe because Lucene analyzers reuse token streams per thread.
 */
public class TextSegmenter implements Closeable {

    private final Analyzer analyzer;
    private final String fieldName;

    public TextSegmenter(final Analyzer analyzer, final String fieldName) {
        this.analyzer = analyzer;
        this.fieldName = fieldName;
    }

    public static TextSegmenter forStrategy(final AnalysisStrategy strategy) {
        return new TextSegmenter(strategy.createAnalyzer(), "content");
    }

    /**
     * Tokens of the text in order of appearance.
     */
    public List<String> segment(final String text) {
        final List<String> tokens = new ArrayList<>();
        try (TokenStream stream = analyzer.tokenStream(fieldName, text)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                if (term.length() > 0) {
                    tokens.add(term.toString());
                }
            }
            stream.end();
        } catch (final IOException e) {
            // Analysis of an in-memory string does not perform I/O.
            throw new UncheckedIOException(e);
        }
        return tokens;
    }

    /**
     * Applies only the character-level normalization (case and Unicode folding) without tokenizing.
     * Used for the literal parts of wildcard and prefix patterns.
     */
    public String normalize(final String text) {
        if (text.isEmpty()) {
            return text;
        }
        final BytesRef normalized = analyzer.normalize(fieldName, text);
        return normalized.utf8ToString();
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
