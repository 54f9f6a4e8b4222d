package de.mirkosertic.mcp.memoryindex.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.LowerCaseFilter;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Analyzer for whitespace-delimited scripts.
 *
 * <p>Token chain: {@code StandardTokenizer -> LowerCaseFilter -> ICUFoldingFilter}</p>
 *
 * <p>ICU folding covers case folding, diacritic removal, ligature expansion and full-width to half-width
 * conversion, so "Müller" finds "muller" and a fi-ligature from OCR output matches "fi". The same
 * normalization is applied to wildcard and prefix terms through {@link #normalize(String, TokenStream)}.</p>
 */
public class UnicodeNormalizingAnalyzer extends Analyzer {

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new ICUFoldingFilter(stream);
        return new TokenStreamComponents(tokenizer, stream);
    }

    @Override
    protected TokenStream normalize(final String fieldName, final TokenStream in) {
        return new ICUFoldingFilter(new LowerCaseFilter(in));
    }
}
