package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.store.ContentStore;
import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TimelineResolverTest {

    private ContentStore contentStore;
    private TimelineResolver resolver;

    @BeforeEach
    void setUp() {
        contentStore = mock(ContentStore.class);
        resolver = new TimelineResolver(contentStore, 50, 5.0);
    }

    @Test
    void shouldResolveTranscriptSnippet() {
        when(contentStore.findTimelineTimestamp(7L, FieldKind.TRANSCRIPT, "we discuss the budget"))
                .thenReturn(Optional.of(12.0));

        assertThat(resolver.resolve(7L, FieldKind.TRANSCRIPT, "...we discuss the budget..."))
                .contains(new TimeRange(12.0, 17.0));
    }

    @Test
    void shouldIgnoreKindsWithoutTimeline() {
        assertThat(resolver.resolve(7L, FieldKind.REPORT, "some report text")).isEmpty();
        assertThat(resolver.resolve(7L, FieldKind.TOPIC, "some topic")).isEmpty();
        verifyNoInteractions(contentStore);
    }

    @Test
    void shouldReturnEmptyWithoutMatchingEntry() {
        when(contentStore.findTimelineTimestamp(anyLong(), any(), anyString())).thenReturn(Optional.empty());

        assertThat(resolver.resolve(7L, FieldKind.OCR, "slide text")).isEmpty();
    }

    @Test
    void storeFailuresShouldNotFailTheResult() {
        when(contentStore.findTimelineTimestamp(anyLong(), any(), anyString()))
                .thenThrow(new DataAccessResourceFailureException("database gone"));

        assertThat(resolver.resolve(7L, FieldKind.TRANSCRIPT, "slide text")).isEmpty();
    }

    @Test
    void probeShouldStripEllipsesAndLimitLength() {
        final String long60 = "a".repeat(60);

        assertThat(resolver.probe("...  hello world  ...")).isEqualTo("hello world");
        assertThat(resolver.probe(long60)).hasSize(50);
        assertThat(resolver.probe("...")).isEmpty();
    }

    @Test
    void blankSnippetShouldNotQueryTheStore() {
        assertThat(resolver.resolve(7L, FieldKind.TRANSCRIPT, "...")).isEmpty();
        verifyNoInteractions(contentStore);
    }
}
