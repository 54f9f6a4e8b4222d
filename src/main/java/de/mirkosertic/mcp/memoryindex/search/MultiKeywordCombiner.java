package de.mirkosertic.mcp.memoryindex.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges per-keyword results into one score per document.
 * <p>
 * Each document keeps its best hit per keyword. The combined score is
 * {@code avg(best scores) * (0.7 + 0.3 * matched / n)}: average match quality carries 70% of the weight,
 * keyword coverage the remaining 30%. A document matching every keyword with score {@code s} scores exactly
 * {@code s}.
 */
public class MultiKeywordCombiner {

    static final double QUALITY_WEIGHT = 0.7;
    static final double COVERAGE_WEIGHT = 0.3;

    /**
     * @param matchAll drop documents that did not match every keyword
     * @return one candidate per document, ordered by combined score desc and document id asc
     */
    public List<RankedMatch> combine(final List<KeywordResult> keywordResults, final boolean matchAll) {
        final int keywordCount = keywordResults.size();
        final Map<Long, Map<String, ScoredHit>> bestPerDocument = new LinkedHashMap<>();
        for (final KeywordResult keywordResult : keywordResults) {
            for (final ScoredHit hit : keywordResult.hits()) {
                bestPerDocument
                        .computeIfAbsent(hit.documentId(), id -> new HashMap<>())
                        .merge(keywordResult.keyword(), hit, ResultAggregator::better);
            }
        }

        final List<RankedMatch> combined = new ArrayList<>();
        for (final Map<String, ScoredHit> perKeyword : bestPerDocument.values()) {
            if (matchAll && perKeyword.size() < keywordCount) {
                continue;
            }
            final List<String> matchedKeywords = new ArrayList<>(perKeyword.size());
            final List<Double> scores = new ArrayList<>(perKeyword.size());
            ScoredHit representative = null;
            for (final KeywordResult keywordResult : keywordResults) {
                final ScoredHit hit = perKeyword.get(keywordResult.keyword());
                if (hit == null) {
                    continue;
                }
                matchedKeywords.add(keywordResult.keyword());
                scores.add(hit.score());
                representative = representative == null ? hit : ResultAggregator.better(representative, hit);
            }
            combined.add(new RankedMatch(representative,
                    combinedScore(scores, matchedKeywords.size(), keywordCount),
                    matchedKeywords, null));
        }

        combined.sort(Comparator.comparingDouble(RankedMatch::score).reversed()
                .thenComparingLong(RankedMatch::documentId));
        return combined;
    }

    public static double combinedScore(final List<Double> scores, final int matchedCount, final int keywordCount) {
        if (scores.isEmpty() || keywordCount <= 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (final double score : scores) {
            sum += score;
        }
        final double average = sum / scores.size();
        final double coverage = (double) matchedCount / keywordCount;
        return average * (QUALITY_WEIGHT + COVERAGE_WEIGHT * coverage);
    }
}
