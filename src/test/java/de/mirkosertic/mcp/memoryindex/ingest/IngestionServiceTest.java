package de.mirkosertic.mcp.memoryindex.ingest;

import de.mirkosertic.mcp.memoryindex.MemoryIndexFixture;
import de.mirkosertic.mcp.memoryindex.index.BackendQuery;
import de.mirkosertic.mcp.memoryindex.index.IndexHit;
import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import de.mirkosertic.mcp.memoryindex.store.IndexedField;
import de.mirkosertic.mcp.memoryindex.store.TagProvenance;
import de.mirkosertic.mcp.memoryindex.store.TimelineEntry;
import de.mirkosertic.mcp.memoryindex.store.Topic;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IngestionService")
class IngestionServiceTest {

    @TempDir
    Path tempDir;

    private MemoryIndexFixture fixture;
    private IngestionService ingestion;

    @BeforeEach
    void setUp() throws IOException {
        fixture = MemoryIndexFixture.create(tempDir);
        ingestion = fixture.ingestionService();
    }

    @AfterEach
    void tearDown() throws IOException {
        fixture.close();
    }

    private List<IndexHit> exactHits(final String keyword) {
        return fixture.exactIndex().search(new BackendQuery(keyword, null, 10, false)).hits();
    }

    @Test
    @DisplayName("An added field is searchable as soon as the call returns")
    void addedFieldIsSearchable() throws IOException {
        ingestion.upsertDocument(MemoryIndexFixture.document(1, "Lecture"));

        final Optional<IndexedField> field = ingestion.addIndexedField(1, FieldKind.TRANSCRIPT, "  gradient descent  ");

        assertThat(field).map(IndexedField::text).contains("gradient descent");
        assertThat(exactHits("gradient")).extracting(IndexHit::documentId).containsExactly(1L);
        assertThat(fixture.segmentedIndex().fieldCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Blank text is ignored")
    void blankTextIsIgnored() throws IOException {
        ingestion.upsertDocument(MemoryIndexFixture.document(1, "Lecture"));

        assertThat(ingestion.addIndexedField(1, FieldKind.REPORT, "   ")).isEmpty();
        assertThat(ingestion.addIndexedField(1, FieldKind.REPORT, null)).isEmpty();
        assertThat(fixture.exactIndex().fieldCount()).isZero();
        assertThat(fixture.contentStore().fieldsForDocument(1)).isEmpty();
    }

    @Test
    @DisplayName("Invisible characters are removed before storing")
    void invisibleCharactersAreRemoved() throws IOException {
        ingestion.upsertDocument(MemoryIndexFixture.document(1, "Lecture"));
        final String zeroWidthSpace = String.valueOf((char) 0x200B);

        ingestion.addIndexedField(1, FieldKind.OCR, "back" + zeroWidthSpace + "propagation");

        assertThat(fixture.contentStore().latestFieldText(1, FieldKind.OCR)).contains("backpropagation");
        assertThat(exactHits("backpropagation")).hasSize(1);
    }

    @Test
    @DisplayName("Fields of unknown documents are rejected and nothing is indexed")
    void unknownDocumentIsRejected() {
        assertThatThrownBy(() -> ingestion.addIndexedField(7, FieldKind.REPORT, "orphan text"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(fixture.exactIndex().fieldCount()).isZero();
    }

    @Test
    @DisplayName("Topics are stored and indexed as topic fields")
    void topicsAreIndexed() throws IOException {
        ingestion.upsertDocument(MemoryIndexFixture.document(1, "Lecture"));

        ingestion.addTopics(1, List.of(
                new Topic("Convolution", "Kernels slide over images", 0.0, 30.0, List.of("cnn"), 0),
                new Topic("Pooling", null, 30.0, 60.0, List.of(), 1)));

        assertThat(fixture.contentStore().topicsForDocument(1)).hasSize(2);
        assertThat(exactHits("kernels")).extracting(IndexHit::fieldKind).containsExactly(FieldKind.TOPIC);
        assertThat(exactHits("pooling")).hasSize(1);
    }

    @Test
    @DisplayName("Tags and timeline entries go to the content store")
    void tagsAndTimeline() {
        ingestion.upsertDocument(MemoryIndexFixture.document(1, "Lecture"));

        assertThat(ingestion.addTags(1, List.of("ml", "ML", "vision"), TagProvenance.AUTO, 0.8, null)).isEqualTo(2);
        ingestion.addTimelineEntries(1, List.of(new TimelineEntry(5.0, 150, "welcome", null, true)));

        assertThat(fixture.contentStore().timelineForDocument(1)).hasSize(1);
        assertThat(fixture.contentStore().tagsFor(List.of(1L)).get(1L)).containsExactly("ml", "vision");
    }

    @Test
    @DisplayName("Delete removes the document from store and both indexes")
    void deleteRemovesEverywhere() throws IOException {
        fixture.add(1, "Lecture", FieldKind.TRANSCRIPT, "attention is all you need");

        assertThat(ingestion.deleteDocument(1)).isTrue();

        assertThat(fixture.contentStore().findDocument(1)).isEmpty();
        assertThat(fixture.exactIndex().fieldCount()).isZero();
        assertThat(fixture.segmentedIndex().fieldCount()).isZero();
        assertThat(ingestion.deleteDocument(1)).isFalse();
    }

    @Test
    @DisplayName("Rebuild restores both indexes from the content store")
    void rebuildRestoresIndexes() throws IOException {
        fixture.add(1, "Lecture", FieldKind.TRANSCRIPT, "attention is all you need");
        fixture.add(2, "Notes", FieldKind.REPORT, "transformers replace recurrence");
        fixture.exactIndex().clear();
        fixture.exactIndex().commit();
        assertThat(exactHits("attention")).isEmpty();

        final RebuildResult result = ingestion.rebuildIndexes();

        assertThat(result.fieldsIndexed()).isEqualTo(2);
        assertThat(exactHits("attention")).extracting(IndexHit::documentId).containsExactly(1L);
        assertThat(fixture.segmentedIndex().fieldCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("rebuildIfRequired only runs when a backend is flagged")
    void rebuildIfRequired() throws IOException {
        fixture.add(1, "Lecture", FieldKind.TRANSCRIPT, "attention is all you need");

        assertThat(ingestion.rebuildIfRequired()).isEmpty();

        fixture.segmentedIndex().markRebuildRequired("test corruption");
        final Optional<RebuildResult> result = ingestion.rebuildIfRequired();

        assertThat(result).map(RebuildResult::fieldsIndexed).contains(1L);
        assertThat(fixture.segmentedIndex().isRebuildRequired()).isFalse();
        assertThat(ingestion.rebuildIfRequired()).isEmpty();
    }
}
