package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.index.BackendKind;
import de.mirkosertic.mcp.memoryindex.index.IndexHit;

import java.util.List;

/**
 * Maps backend native ranks onto one comparable [0,1] scale.
 * <p>
 * Both token backends are calibrated per result set, so the best hit of a set normalizes to 1 on either side:
 * <ul>
 *   <li>Exact: ranks are negated BM25 scores, so {@code normalized = clamp(raw / best)} where {@code best} is the
 *       most negative rank of the set. Better (more negative) ranks never normalize lower than worse ones.</li>
 *   <li>Segmented: the backend already divides by the top score of its set, ranks are only clamped.</li>
 *   <li>Literal: a substring match carries no rank and normalizes to 1; its variant weight keeps it below
 *       token matches.</li>
 * </ul>
 */
public class ScoreNormalizer {

    public double normalize(final BackendKind backend, final double rawRank, final double bestRawRank) {
        return switch (backend) {
            case EXACT -> bestRawRank < 0 ? clamp(rawRank / bestRawRank) : 0.0;
            case SEGMENTED -> clamp(rawRank);
            case LITERAL -> 1.0;
        };
    }

    /**
     * The rank all other hits of one backend result set are measured against.
     */
    public static double bestRawRank(final BackendKind backend, final List<IndexHit> hits) {
        if (backend != BackendKind.EXACT) {
            return 1.0;
        }
        double best = 0.0;
        for (final IndexHit hit : hits) {
            best = Math.min(best, hit.rawRank());
        }
        return best;
    }

    static double clamp(final double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
