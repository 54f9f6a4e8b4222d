package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.index.BackendFailure;
import de.mirkosertic.mcp.memoryindex.index.BackendKind;
import de.mirkosertic.mcp.memoryindex.index.BackendQuery;
import de.mirkosertic.mcp.memoryindex.index.BackendResult;
import de.mirkosertic.mcp.memoryindex.index.IndexBackend;
import de.mirkosertic.mcp.memoryindex.index.IndexHit;
import de.mirkosertic.mcp.memoryindex.index.LiteralScanner;
import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Single-keyword query planning")
class QueryPlannerTest {

    private IndexBackend exact;
    private IndexBackend segmented;
    private LiteralScanner literal;
    private QueryPlanner planner;

    @BeforeEach
    void setUp() {
        exact = mock(IndexBackend.class);
        segmented = mock(IndexBackend.class);
        literal = mock(LiteralScanner.class);
        when(exact.search(any())).thenReturn(BackendResult.ok(List.of()));
        when(segmented.search(any())).thenReturn(BackendResult.ok(List.of()));
        when(literal.scan(anyString(), any(), anyInt())).thenReturn(BackendResult.ok(List.of()));
        planner = new QueryPlanner(exact, segmented, literal,
                new FuzzyVariantGenerator(3, 8, Map.of()), new ScoreNormalizer(), 10_000);
    }

    private static IndexHit indexHit(final long documentId, final double rawRank) {
        return new IndexHit(documentId, FieldKind.REPORT, rawRank, "text " + documentId, documentId + ":report:x");
    }

    private static BackendResult hits(final IndexHit... hits) {
        return BackendResult.ok(List.of(hits));
    }

    private static BackendQuery withText(final String text) {
        return argThat(query -> query != null && query.text().equals(text));
    }

    @Nested
    @DisplayName("Keyword splitting")
    class Keywords {

        @Test
        void shouldSplitOnWhitespaceAndDropDuplicates() {
            assertThat(QueryPlanner.keywords("  neural\tnetwork  neural ")).containsExactly("neural", "network");
        }

        @Test
        void blankQueryShouldHaveNoKeywords() {
            assertThat(QueryPlanner.keywords(null)).isEmpty();
            assertThat(QueryPlanner.keywords("   ")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Exact route")
    class ExactRoute {

        @Test
        void shouldNormalizeAndWeightScores() {
            when(exact.search(withText("neural*"))).thenReturn(hits(indexHit(1, -25.0)));
            when(exact.search(withText("neura*l"))).thenReturn(hits(indexHit(2, -25.0)));

            final KeywordResult result = planner.retrieve("neural", null, 10, true);

            assertThat(result.hits()).hasSize(2);
            assertThat(result.hits().get(0).score()).isCloseTo(1.0, within(1e-9));
            assertThat(result.hits().get(0).variant().kind()).isEqualTo(VariantKind.PREFIX);
            assertThat(result.hits().get(1).score()).isCloseTo(0.8, within(1e-9));
            assertThat(result.hits().get(1).variant().kind()).isEqualTo(VariantKind.INSERTION);
            assertThat(result.routes()).containsExactly(BackendKind.EXACT);
            assertThat(result.failed()).isFalse();
        }

        @Test
        @DisplayName("Exact scores are relative to the best hit of the same variant")
        void shouldNormalizeAgainstBestHitOfVariant() {
            when(exact.search(withText("neural"))).thenReturn(hits(indexHit(1, -0.8), indexHit(2, -0.2)));

            final KeywordResult result = planner.retrieve("neural", null, 10, false);

            assertThat(result.hits()).hasSize(2);
            assertThat(result.hits().get(0).score()).isEqualTo(1.0);
            assertThat(result.hits().get(1).score()).isCloseTo(0.25, within(1e-9));
        }

        @Test
        @DisplayName("Documents found by a higher priority variant are not credited again")
        void shouldSkipDocumentsFoundByEarlierVariants() {
            when(exact.search(withText("neural*"))).thenReturn(hits(indexHit(1, -40.0)));
            when(exact.search(withText("neura*l"))).thenReturn(hits(indexHit(1, -45.0), indexHit(2, -10.0)));

            final KeywordResult result = planner.retrieve("neural", null, 10, true);

            assertThat(result.hits()).extracting(ScoredHit::documentId).containsExactly(1L, 2L);
            assertThat(result.hits().get(0).variant().pattern()).isEqualTo("neural*");
        }

        @Test
        void shouldStopOnceEnoughDocumentsWereFound() {
            when(exact.search(withText("neural*"))).thenReturn(hits(indexHit(1, -5.0), indexHit(2, -4.0)));

            planner.retrieve("neural", null, 2, true);

            verify(exact, times(1)).search(any());
        }

        @Test
        void shouldQueryKeywordAsTypedWithoutFuzzy() {
            planner.retrieve("neural", FieldKind.TRANSCRIPT, 5, false);

            final ArgumentCaptor<BackendQuery> captor = ArgumentCaptor.forClass(BackendQuery.class);
            verify(exact).search(captor.capture());
            assertThat(captor.getValue().text()).isEqualTo("neural");
            assertThat(captor.getValue().fieldFilter()).isEqualTo(FieldKind.TRANSCRIPT);
            assertThat(captor.getValue().limit()).isEqualTo(20);
            verify(segmented, never()).search(any());
        }

        @Test
        void shouldFallBackToLiteralScanWhenNothingMatches() {
            when(literal.scan(eq("eural"), any(), anyInt())).thenReturn(hits(indexHit(3, 0.0)));

            final KeywordResult result = planner.retrieve("eural", null, 10, true);

            assertThat(result.hits()).hasSize(1);
            assertThat(result.hits().get(0).backend()).isEqualTo(BackendKind.LITERAL);
            assertThat(result.hits().get(0).score()).isEqualTo(VariantKind.LITERAL.weight());
            assertThat(result.hits().get(0).rawRankOrNull()).isNull();
            assertThat(result.routes()).containsExactlyInAnyOrder(BackendKind.EXACT, BackendKind.LITERAL);
        }

        @Test
        @DisplayName("Substring matches of documents the tokens missed are merged below the token hits")
        void shouldMergeLiteralHitsForDocumentsMissedByTokens() {
            when(exact.search(withText("network"))).thenReturn(hits(indexHit(2, -4.0), indexHit(3, -1.0)));
            when(literal.scan(eq("network"), any(), anyInt())).thenReturn(hits(indexHit(1, 0.0), indexHit(2, 0.0)));

            final KeywordResult result = planner.retrieve("network", null, 10, false);

            assertThat(result.hits()).extracting(ScoredHit::documentId).containsExactly(2L, 3L, 1L);
            final ScoredHit literalHit = result.hits().get(2);
            assertThat(literalHit.backend()).isEqualTo(BackendKind.LITERAL);
            assertThat(literalHit.score()).isCloseTo(0.25, within(1e-9));
            assertThat(result.hits().get(0).backend()).isEqualTo(BackendKind.EXACT);
            assertThat(result.routes()).containsExactlyInAnyOrder(BackendKind.EXACT, BackendKind.LITERAL);
        }

        @Test
        void literalScanShouldRunEvenWhenTokensMatched() {
            when(exact.search(any())).thenReturn(hits(indexHit(1, -5.0)));

            planner.retrieve("neural", FieldKind.OCR, 10, false);

            verify(literal).scan("neural", FieldKind.OCR, 10_000);
        }

        @Test
        void failingBackendShouldFallBackToLiteralScan() {
            when(exact.search(any())).thenReturn(
                    BackendResult.failed(BackendFailure.unavailable(BackendKind.EXACT, "closed")));
            when(literal.scan(anyString(), any(), anyInt())).thenReturn(hits(indexHit(4, 0.0)));

            final KeywordResult result = planner.retrieve("neural", null, 10, true);

            verify(exact, times(1)).search(any());
            assertThat(result.failed()).isFalse();
            assertThat(result.failures()).hasSize(1);
            assertThat(result.routes()).containsExactly(BackendKind.LITERAL);
            assertThat(result.hits()).extracting(ScoredHit::documentId).containsExactly(4L);
        }
    }

    @Nested
    @DisplayName("Segmented route")
    class SegmentedRoute {

        @Test
        void hanKeywordsShouldUseSegmentedBackend() {
            when(segmented.search(any())).thenReturn(hits(indexHit(5, 0.75)));

            final KeywordResult result = planner.retrieve("神经网络", null, 10, true);

            verify(exact, never()).search(any());
            assertThat(result.routes()).containsExactly(BackendKind.SEGMENTED);
            assertThat(result.hits().get(0).score()).isEqualTo(0.75);
            assertThat(result.hits().get(0).variant().kind()).isEqualTo(VariantKind.APPROXIMATE);

            final ArgumentCaptor<BackendQuery> captor = ArgumentCaptor.forClass(BackendQuery.class);
            verify(segmented).search(captor.capture());
            assertThat(captor.getValue().approximate()).isTrue();
        }

        @Test
        void segmentedFailureShouldFallBackToLiteralScan() {
            when(segmented.search(any())).thenReturn(
                    BackendResult.failed(BackendFailure.corruption(BackendKind.SEGMENTED, "bad segment")));
            when(literal.scan(eq("神经网络"), any(), anyInt())).thenReturn(hits(indexHit(6, 0.0)));

            final KeywordResult result = planner.retrieve("神经网络", null, 10, true);

            assertThat(result.failed()).isFalse();
            assertThat(result.failures()).extracting(BackendFailure::reason)
                    .containsExactly(BackendFailure.Reason.CORRUPTION);
            assertThat(result.hits()).extracting(ScoredHit::documentId).containsExactly(6L);
        }

        @Test
        void keywordShouldFailWhenNoRouteAnswers() {
            when(segmented.search(any())).thenReturn(
                    BackendResult.failed(BackendFailure.unavailable(BackendKind.SEGMENTED, "closed")));
            when(literal.scan(anyString(), any(), anyInt())).thenReturn(
                    BackendResult.failed(BackendFailure.unavailable(BackendKind.LITERAL, "closed")));

            final KeywordResult result = planner.retrieve("神经网络", null, 10, true);

            assertThat(result.failed()).isTrue();
            assertThat(result.hits()).isEmpty();
            assertThat(result.failures()).hasSize(2);
        }
    }
}
