package de.mirkosertic.mcp.memoryindex.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TextSegmenter")
class TextSegmenterTest {

    @Test
    @DisplayName("Exact strategy splits on whitespace and punctuation and lower-cases")
    void exactStrategySplitsWords() {
        try (TextSegmenter segmenter = TextSegmenter.forStrategy(AnalysisStrategy.EXACT)) {
            assertThat(segmenter.segment("Hello, World!")).containsExactly("hello", "world");
        }
    }

    @Test
    @DisplayName("Exact strategy folds diacritics and ligatures")
    void exactStrategyFoldsDiacritics() {
        try (TextSegmenter segmenter = TextSegmenter.forStrategy(AnalysisStrategy.EXACT)) {
            assertThat(segmenter.segment("Müller")).containsExactly("muller");
            assertThat(segmenter.segment("ﬁle")).containsExactly("file");
        }
    }

    @Test
    @DisplayName("normalize applies folding without tokenizing")
    void normalizeKeepsPatternCharacters() {
        try (TextSegmenter segmenter = TextSegmenter.forStrategy(AnalysisStrategy.EXACT)) {
            assertThat(segmenter.normalize("Müller")).isEqualTo("muller");
            assertThat(segmenter.normalize("")).isEmpty();
        }
    }

    @Test
    @DisplayName("Segmented strategy splits Han text into dictionary words")
    void segmentedStrategySplitsHanText() {
        try (TextSegmenter segmenter = TextSegmenter.forStrategy(AnalysisStrategy.SEGMENTED)) {
            assertThat(segmenter.segment("神经网络")).isNotEmpty()
                    .allSatisfy(token -> assertThat("神经网络").contains(token));
        }
    }

    @Test
    @DisplayName("Segmented strategy drops punctuation")
    void segmentedStrategyDropsPunctuation() {
        try (TextSegmenter segmenter = TextSegmenter.forStrategy(AnalysisStrategy.SEGMENTED)) {
            assertThat(segmenter.segment("你好，世界。")).noneMatch(token -> token.equals("，")
                    || token.equals("。") || token.equals(","));
        }
    }

    @Test
    @DisplayName("Blank text yields no tokens")
    void blankTextYieldsNoTokens() {
        try (TextSegmenter segmenter = TextSegmenter.forStrategy(AnalysisStrategy.EXACT)) {
            assertThat(segmenter.segment("   ")).isEmpty();
        }
    }
}
