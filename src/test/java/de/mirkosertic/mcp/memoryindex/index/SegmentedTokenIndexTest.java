package de.mirkosertic.mcp.memoryindex.index;

import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.apache.lucene.search.FuzzyQuery;
import org.apache.lucene.search.TermQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Segmented token index")
class SegmentedTokenIndexTest {

    @TempDir
    Path tempDir;

    private SegmentedTokenIndex index;

    @BeforeEach
    void setUp() throws IOException {
        index = new SegmentedTokenIndex(tempDir.resolve("segmented"), 100);
        index.init();
    }

    @AfterEach
    void tearDown() throws IOException {
        index.close();
    }

    @Test
    void shouldFindHanText() throws IOException {
        index.index(1, FieldKind.TRANSCRIPT, "神经网络");
        index.index(2, FieldKind.TRANSCRIPT, "今天天气很好");
        index.commit();

        final BackendResult result = index.search(new BackendQuery("神经网络", null, 10, false));

        assertThat(result.isOk()).isTrue();
        assertThat(result.hits()).extracting(IndexHit::documentId).containsExactly(1L);
        assertThat(result.hits().get(0).rawRank()).isEqualTo(1.0);
    }

    @Test
    void relevanceShouldBeRelativeToBestHit() throws IOException {
        index.index(1, FieldKind.REPORT, "network");
        index.index(2, FieldKind.REPORT, "network appears in a much longer text with plenty of other words");
        index.commit();

        final List<IndexHit> hits = index.search(new BackendQuery("network", null, 10, false)).hits();

        assertThat(hits).hasSize(2);
        assertThat(hits.get(0).rawRank()).isEqualTo(1.0);
        assertThat(hits.get(1).rawRank()).isGreaterThan(0.0).isLessThan(1.0);
    }

    @Test
    void approximateMatchingShouldTolerateTypos() throws IOException {
        index.index(1, FieldKind.REPORT, "network");
        index.commit();

        assertThat(index.search(new BackendQuery("netwrk", null, 10, true)).hits()).hasSize(1);
        assertThat(index.search(new BackendQuery("netwrk", null, 10, false)).hits()).isEmpty();
    }

    @Test
    void shouldApplyFieldFilter() throws IOException {
        index.index(1, FieldKind.REPORT, "神经网络");
        index.index(2, FieldKind.OCR, "神经网络");
        index.commit();

        final BackendResult result = index.search(new BackendQuery("神经网络", FieldKind.OCR, 10, false));

        assertThat(result.hits()).extracting(IndexHit::documentId).containsExactly(2L);
    }

    @Test
    void wildcardsAndPunctuationAloneShouldMatchNothing() {
        assertThat(index.search(new BackendQuery("*?", null, 10, true)).hits()).isEmpty();
        assertThat(index.search(new BackendQuery("，。", null, 10, true)).hits()).isEmpty();
    }

    @Test
    void tokenQueryShouldScaleEditDistanceWithLength() {
        assertThat(SegmentedTokenIndex.tokenQuery("ab", true)).isInstanceOf(TermQuery.class);
        assertThat(SegmentedTokenIndex.tokenQuery("神经", true)).isInstanceOf(TermQuery.class);
        assertThat(SegmentedTokenIndex.tokenQuery("abcde", false)).isInstanceOf(TermQuery.class);
        assertThat(((FuzzyQuery) SegmentedTokenIndex.tokenQuery("abc", true)).getMaxEdits()).isEqualTo(1);
        assertThat(((FuzzyQuery) SegmentedTokenIndex.tokenQuery("abcde", true)).getMaxEdits()).isEqualTo(2);
    }

    @Test
    void segmentShouldSplitHanText() {
        final List<String> tokens = index.segment("我们研究神经网络");

        assertThat(tokens).isNotEmpty();
        assertThat(String.join("", tokens)).isEqualTo("我们研究神经网络");
    }

    @Test
    void removeShouldDeleteRows() throws IOException {
        index.index(3, FieldKind.REPORT, "神经网络");
        index.commit();
        index.remove(3);
        index.commit();

        assertThat(index.fieldCount()).isZero();
        assertThat(index.kind()).isEqualTo(BackendKind.SEGMENTED);
    }
}
