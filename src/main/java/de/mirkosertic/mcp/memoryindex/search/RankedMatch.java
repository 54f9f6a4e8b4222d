package de.mirkosertic.mcp.memoryindex.search;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A scored candidate before it is joined with its document.
 *
 * @param representative  the hit shown for this candidate, used for field kind, snippet and timeline
 * @param score           final relevance in [0,1]
 * @param matchedKeywords query keywords this candidate matched, in query order
 * @param rawRank         backend native rank, {@code null} for literal matches and combined multi-keyword scores
 */
public record RankedMatch(
        ScoredHit representative,
        double score,
        List<String> matchedKeywords,
        @Nullable Double rawRank
) {

    public RankedMatch {
        matchedKeywords = List.copyOf(matchedKeywords);
    }

    public static RankedMatch single(final ScoredHit hit) {
        return new RankedMatch(hit, hit.score(), List.of(hit.keyword()), hit.rawRankOrNull());
    }

    public long documentId() {
        return representative.documentId();
    }
}
