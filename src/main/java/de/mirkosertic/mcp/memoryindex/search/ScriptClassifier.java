package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.analysis.AnalysisStrategy;

/**
 * Decides which analysis strategy, and therefore which backend, a keyword belongs to.
 */
public final class ScriptClassifier {

    private ScriptClassifier() {
    }

    /**
     * {@link AnalysisStrategy#SEGMENTED} if the keyword contains any Han ideograph, otherwise
     * {@link AnalysisStrategy#EXACT}.
     */
    public static AnalysisStrategy classify(final String keyword) {
        return containsHan(keyword) ? AnalysisStrategy.SEGMENTED : AnalysisStrategy.EXACT;
    }

    public static boolean containsHan(final String text) {
        return text.codePoints().anyMatch(cp -> Character.UnicodeScript.of(cp) == Character.UnicodeScript.HAN);
    }
}
