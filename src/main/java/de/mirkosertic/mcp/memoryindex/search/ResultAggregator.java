package de.mirkosertic.mcp.memoryindex.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses field level hits into result candidates.
 */
public class ResultAggregator {

    /**
     * Best hit first: higher score, then field kind declaration order, then field key.
     */
    public static final Comparator<ScoredHit> BEST_FIRST = Comparator
            .comparingDouble(ScoredHit::score).reversed()
            .thenComparing(hit -> hit.hit().fieldKind())
            .thenComparing(hit -> hit.hit().fieldKey());

    /**
     * @param aggregate true for one candidate per document holding its best field, false for one candidate
     *                  per matching field
     */
    public List<RankedMatch> aggregate(final List<ScoredHit> hits, final boolean aggregate) {
        final Map<Object, ScoredHit> best = new LinkedHashMap<>();
        for (final ScoredHit hit : hits) {
            final Object key = aggregate ? (Object) hit.documentId() : hit.hit().fieldKey();
            best.merge(key, hit, ResultAggregator::better);
        }
        final List<RankedMatch> result = new ArrayList<>(best.size());
        for (final ScoredHit hit : best.values()) {
            result.add(RankedMatch.single(hit));
        }
        return result;
    }

    static ScoredHit better(final ScoredHit left, final ScoredHit right) {
        return BEST_FIRST.compare(left, right) <= 0 ? left : right;
    }
}
