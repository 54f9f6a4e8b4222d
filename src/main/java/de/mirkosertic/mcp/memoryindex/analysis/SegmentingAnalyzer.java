package de.mirkosertic.mcp.memoryindex.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.cn.smart.HMMChineseTokenizer;
import org.apache.lucene.analysis.cn.smart.SmartChineseAnalyzer;
import org.apache.lucene.analysis.core.LowerCaseFilter;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;

/**
 * Analyzer for scripts written without spaces between words.
 *
 * <p>Token chain: {@code HMMChineseTokenizer -> LowerCaseFilter -> ICUFoldingFilter -> StopFilter(punctuation)}</p>
 *
 * <p>The tokenizer breaks sentences and then words using the bundled dictionary and hidden Markov model.
 * Latin words embedded in the text come out as whole tokens. The stop set is the punctuation list shipped
 * with smartcn, so full-width commas and periods never become searchable terms.</p>
 */
public class SegmentingAnalyzer extends Analyzer {

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new HMMChineseTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new ICUFoldingFilter(stream);
        stream = new StopFilter(stream, SmartChineseAnalyzer.getDefaultStopSet());
        return new TokenStreamComponents(tokenizer, stream);
    }

    @Override
    protected TokenStream normalize(final String fieldName, final TokenStream in) {
        return new ICUFoldingFilter(new LowerCaseFilter(in));
    }
}
