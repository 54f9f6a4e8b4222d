package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.store.StoredDocument;

import java.util.Comparator;

/**
 * Comparators for the supported sort modes.
 * <p>
 * Every mode ends with the same tie-break: score desc, document id asc, field kind, field key. The order is
 * total, so sorting the same candidates always yields the same page regardless of how they were collected.
 */
public final class ResultOrdering {

    static final Comparator<RankedCandidate> TIE_BREAK = Comparator
            .comparingDouble(RankedCandidate::score).reversed()
            .thenComparingLong(candidate -> candidate.document().id())
            .thenComparing(candidate -> candidate.match().representative().hit().fieldKind())
            .thenComparing(candidate -> candidate.match().representative().hit().fieldKey());

    private ResultOrdering() {
    }

    public static Comparator<RankedCandidate> comparator(final SortMode sortMode) {
        return switch (sortMode) {
            case RELEVANCE -> TIE_BREAK;
            case DATE -> Comparator.comparing((RankedCandidate candidate) -> candidate.document().createdAt())
                    .reversed()
                    .thenComparing(TIE_BREAK);
            case DURATION -> Comparator.comparing(
                            (RankedCandidate candidate) -> candidate.document().durationSeconds(),
                            Comparator.nullsLast(Comparator.<Integer>reverseOrder()))
                    .thenComparing(TIE_BREAK);
            case TITLE -> Comparator.comparing((RankedCandidate candidate) -> titleOf(candidate.document()),
                            String.CASE_INSENSITIVE_ORDER)
                    .thenComparing(TIE_BREAK);
        };
    }

    private static String titleOf(final StoredDocument document) {
        return document.title() == null ? "" : document.title();
    }
}
