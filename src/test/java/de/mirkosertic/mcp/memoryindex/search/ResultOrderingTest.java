package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.store.StoredDocument;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static de.mirkosertic.mcp.memoryindex.search.HitFactory.candidate;
import static de.mirkosertic.mcp.memoryindex.search.HitFactory.document;
import static org.assertj.core.api.Assertions.assertThat;

class ResultOrderingTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final StoredDocument older = document(1, "beta talk", 600, T0);
    private final StoredDocument newer = document(2, "Alpha talk", null, T0.plusSeconds(3600));
    private final StoredDocument longest = document(3, "gamma talk", 3600, T0.plusSeconds(60));

    private static List<Long> sorted(final List<RankedCandidate> candidates, final SortMode mode) {
        final List<RankedCandidate> copy = new ArrayList<>(candidates);
        copy.sort(ResultOrdering.comparator(mode));
        return copy.stream().map(candidate -> candidate.document().id()).toList();
    }

    @Test
    void relevanceShouldSortByScoreThenDocumentId() {
        final List<RankedCandidate> candidates = List.of(
                candidate(longest, 0.5), candidate(older, 0.5), candidate(newer, 0.9));

        assertThat(sorted(candidates, SortMode.RELEVANCE)).containsExactly(2L, 1L, 3L);
    }

    @Test
    void dateShouldSortNewestFirst() {
        final List<RankedCandidate> candidates = List.of(
                candidate(older, 0.9), candidate(newer, 0.1), candidate(longest, 0.5));

        assertThat(sorted(candidates, SortMode.DATE)).containsExactly(2L, 3L, 1L);
    }

    @Test
    void durationShouldSortLongestFirstWithUnknownLast() {
        final List<RankedCandidate> candidates = List.of(
                candidate(newer, 0.9), candidate(older, 0.1), candidate(longest, 0.5));

        assertThat(sorted(candidates, SortMode.DURATION)).containsExactly(3L, 1L, 2L);
    }

    @Test
    void titleShouldSortCaseInsensitively() {
        final List<RankedCandidate> candidates = List.of(
                candidate(longest, 0.9), candidate(older, 0.1), candidate(newer, 0.5));

        assertThat(sorted(candidates, SortMode.TITLE)).containsExactly(2L, 1L, 3L);
    }

    @Test
    void orderShouldNotDependOnInputOrder() {
        final List<RankedCandidate> candidates = new ArrayList<>(List.of(
                candidate(older, 0.5), candidate(newer, 0.5), candidate(longest, 0.5)));
        final List<Long> first = sorted(candidates, SortMode.RELEVANCE);
        Collections.reverse(candidates);

        assertThat(sorted(candidates, SortMode.RELEVANCE)).isEqualTo(first).containsExactly(1L, 2L, 3L);
    }

    @Test
    void shouldParseSortModes() {
        assertThat(SortMode.fromString(null)).isEqualTo(SortMode.RELEVANCE);
        assertThat(SortMode.fromString(" Date ")).isEqualTo(SortMode.DATE);
    }
}
