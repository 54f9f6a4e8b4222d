package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static de.mirkosertic.mcp.memoryindex.search.HitFactory.hit;
import static org.assertj.core.api.Assertions.assertThat;

class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();

    @Test
    void shouldKeepBestFieldPerDocument() {
        final List<RankedMatch> matches = aggregator.aggregate(List.of(
                hit(1, FieldKind.REPORT, "neural", 0.3),
                hit(1, FieldKind.TRANSCRIPT, "neural", 0.7),
                hit(2, FieldKind.OCR, "neural", 0.5)), true);

        assertThat(matches).hasSize(2);
        assertThat(matches.get(0).documentId()).isEqualTo(1L);
        assertThat(matches.get(0).score()).isEqualTo(0.7);
        assertThat(matches.get(0).representative().hit().fieldKind()).isEqualTo(FieldKind.TRANSCRIPT);
    }

    @Test
    void shouldEmitOneMatchPerFieldWithoutAggregation() {
        final List<RankedMatch> matches = aggregator.aggregate(List.of(
                hit(1, FieldKind.REPORT, "neural", 0.3),
                hit(1, FieldKind.TRANSCRIPT, "neural", 0.7),
                hit(1, FieldKind.REPORT, "neural", 0.1)), false);

        assertThat(matches).hasSize(2);
        assertThat(matches).extracting(RankedMatch::score).containsExactly(0.3, 0.7);
    }

    @Test
    void equalScoresShouldPreferEarlierFieldKind() {
        final ScoredHit report = hit(1, FieldKind.REPORT, "neural", 0.5);
        final ScoredHit topic = hit(1, FieldKind.TOPIC, "neural", 0.5);

        assertThat(ResultAggregator.better(topic, report)).isSameAs(report);
        assertThat(ResultAggregator.better(report, topic)).isSameAs(report);
    }

    @Test
    void singleMatchShouldCarryKeywordAndRawRank() {
        final RankedMatch match = aggregator.aggregate(List.of(hit(4, "neural", 0.5)), true).get(0);

        assertThat(match.matchedKeywords()).containsExactly("neural");
        assertThat(match.rawRank()).isEqualTo(-25.0);
    }
}
