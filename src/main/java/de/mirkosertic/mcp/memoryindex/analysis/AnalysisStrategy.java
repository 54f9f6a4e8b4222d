package de.mirkosertic.mcp.memoryindex.analysis;

import org.apache.lucene.analysis.Analyzer;

/**
 * The two interchangeable ways text is broken into searchable tokens.
 */
public enum AnalysisStrategy {

    /**
     * Whitespace and punctuation delimited tokens, for Latin, Cyrillic, Greek and similar scripts.
     */
    EXACT {
        @Override
        public Analyzer createAnalyzer() {
            return new UnicodeNormalizingAnalyzer();
        }
    },

    /**
     * Dictionary segmented tokens, for Han script.
     */
    SEGMENTED {
        @Override
        public Analyzer createAnalyzer() {
            return new SegmentingAnalyzer();
        }
    };

    public abstract Analyzer createAnalyzer();
}
