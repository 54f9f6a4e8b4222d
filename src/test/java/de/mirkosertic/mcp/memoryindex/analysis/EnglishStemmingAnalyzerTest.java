package de.mirkosertic.mcp.memoryindex.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies the stems produced for the {@code content_stemmed} field.
 */
@DisplayName("EnglishStemmingAnalyzer")
class EnglishStemmingAnalyzerTest {

    private static List<String> analyzeToTokens(final Analyzer analyzer, final String text) throws IOException {
        final List<String> tokens = new ArrayList<>();
        try (final TokenStream tokenStream = analyzer.tokenStream("content_stemmed", text)) {
            final CharTermAttribute termAttr = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                tokens.add(termAttr.toString());
            }
            tokenStream.end();
        }
        return tokens;
    }

    @Test
    @DisplayName("Plural, possessive and singular forms share a stem")
    void inflectedFormsShareStem() throws IOException {
        try (final Analyzer analyzer = new EnglishStemmingAnalyzer()) {
            final List<String> singular = analyzeToTokens(analyzer, "network");

            assertThat(singular).containsExactly("network");
            assertThat(analyzeToTokens(analyzer, "Networks")).isEqualTo(singular);
            assertThat(analyzeToTokens(analyzer, "network's")).isEqualTo(singular);
        }
    }

    @Test
    @DisplayName("Verb forms share a stem")
    void verbFormsShareStem() throws IOException {
        try (final Analyzer analyzer = new EnglishStemmingAnalyzer()) {
            assertThat(analyzeToTokens(analyzer, "training")).isEqualTo(analyzeToTokens(analyzer, "trained"));
        }
    }

    @Test
    @DisplayName("Diacritics are folded before stemming")
    void foldsBeforeStemming() throws IOException {
        try (final Analyzer analyzer = new EnglishStemmingAnalyzer()) {
            assertThat(analyzeToTokens(analyzer, "cafés")).containsExactly("cafe");
        }
    }
}
