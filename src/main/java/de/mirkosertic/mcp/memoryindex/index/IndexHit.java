package de.mirkosertic.mcp.memoryindex.index;

import de.mirkosertic.mcp.memoryindex.store.FieldKind;

/**
 * One matching field returned by a backend.
 *
 * @param rawRank     backend native rank. Exact: negated BM25 score, more negative is better.
 *                    Segmented: relevance in (0,1]. Literal: always 0.
 * @param matchedText the full stored text of the matching field
 * @param fieldKey    unique key of the field row, {@code documentId:kind:sha256}
 */
public record IndexHit(
        long documentId,
        FieldKind fieldKind,
        double rawRank,
        String matchedText,
        String fieldKey
) {
}
