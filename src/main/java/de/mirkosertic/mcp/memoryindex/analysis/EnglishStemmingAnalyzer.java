package de.mirkosertic.mcp.memoryindex.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.en.EnglishPossessiveFilter;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.snowball.SnowballFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.tartarus.snowball.ext.EnglishStemmer;

/**
 * Stemming variant of {@link UnicodeNormalizingAnalyzer} for the unstored {@code content_stemmed} field.
 *
 * <p>Token chain: {@code StandardTokenizer -> LowerCaseFilter -> EnglishPossessiveFilter -> ICUFoldingFilter
 * -> SnowballFilter(English)}</p>
 *
 * <p>"networks" and "network's" both reduce to "network". Exact forms still score higher because the
 * unstemmed {@code content} field is queried with full weight.</p>
 */
public class EnglishStemmingAnalyzer extends Analyzer {

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new EnglishPossessiveFilter(stream);
        stream = new ICUFoldingFilter(stream);
        stream = new SnowballFilter(stream, new EnglishStemmer());
        return new TokenStreamComponents(tokenizer, stream);
    }

    @Override
    protected TokenStream normalize(final String fieldName, final TokenStream in) {
        return new ICUFoldingFilter(new LowerCaseFilter(in));
    }
}
