package de.mirkosertic.mcp.memoryindex.search;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReportSummaryExtractorTest {

    private final ReportSummaryExtractor extractor = new ReportSummaryExtractor(50);

    @Test
    void shouldUseSummarySection() {
        final String report = "# Neural Networks\n\n## Summary\nThis video explains **neural** networks.\n\n## Details\nMore";

        assertThat(extractor.extract(report)).contains("This video explains neural networks.");
    }

    @Test
    void shouldUseSummaryLabel() {
        final String report = "Intro line\nSummary: A short overview of `transformers`\n\nRest of the report";

        assertThat(extractor.extract(report)).contains("A short overview of transformers");
    }

    @Test
    void shouldUseChineseSummarySection() {
        final String report = "# 标题\n\n## 摘要\n这是一个关于机器学习的视频\n\n## 细节\n内容";

        assertThat(extractor.extract(report)).contains("这是一个关于机器学习的视频");
    }

    @Test
    void shouldFallBackToFirstProseLine() {
        final String report = "# Heading\n- a bullet item that is long\n* another bullet item\nshort\n"
                + "This is the first real line of [text](http://example.com).\n";

        assertThat(extractor.extract(report)).contains("This is the first real line of text.");
    }

    @Test
    void shouldTruncateLongSummaries() {
        final ReportSummaryExtractor narrow = new ReportSummaryExtractor(10);

        assertThat(narrow.extract("Summary: abcdefghijklmnopqrstuvwxyz")).contains("abcdefghij...");
    }

    @Test
    void shouldReturnEmptyForMissingReport() {
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("  ")).isEmpty();
        assertThat(extractor.extract("# Only a heading\n- item")).isEmpty();
    }
}
