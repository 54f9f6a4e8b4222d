package de.mirkosertic.mcp.memoryindex.search;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SnippetExtractorTest {

    private static final String TEXT = "The quick brown fox jumps over the lazy dog";

    private final SnippetExtractor extractor = new SnippetExtractor(10, 20);

    @Test
    void shouldCutWindowAroundFirstMatch() {
        assertThat(extractor.extract(TEXT, List.of("fox"))).isEqualTo("...ick brown fox jumps ove...");
    }

    @Test
    void shouldMatchCaseInsensitively() {
        assertThat(extractor.extract(TEXT, List.of("FOX"))).isEqualTo("...ick brown fox jumps ove...");
    }

    @Test
    void shouldOmitLeadingEllipsisAtTextStart() {
        assertThat(extractor.extract(TEXT, List.of("quick"))).isEqualTo("The quick brown fox...");
    }

    @Test
    void shouldTryTermsInOrder() {
        assertThat(extractor.extract(TEXT, List.of("cat", "", "lazy")))
                .isEqualTo("... over the lazy dog");
    }

    @Test
    void shouldFallBackToLeadingText() {
        assertThat(extractor.extract(TEXT, List.of("elephant"))).isEqualTo("The quick brown fox ...");
    }

    @Test
    void shouldReturnShortTextUnchanged() {
        assertThat(extractor.extract("tiny text", List.of("missing"))).isEqualTo("tiny text");
    }

    @Test
    void shouldNotSplitSurrogatePairs() {
        final String emoji = new String(Character.toChars(0x1F600));
        final SnippetExtractor narrow = new SnippetExtractor(1, 20);

        final String snippet = narrow.extract("ab" + emoji + "fox", List.of("fox"));

        assertThat(snippet).isEqualTo("..." + emoji + "fox");
    }

    @Test
    void shouldFindTermPositions() {
        assertThat(SnippetExtractor.indexOfIgnoreCase("Hello World", "WORLD")).isEqualTo(6);
        assertThat(SnippetExtractor.indexOfIgnoreCase("Hello", "Hello World")).isEqualTo(-1);
    }
}
