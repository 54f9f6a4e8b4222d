package de.mirkosertic.mcp.memoryindex.index;

import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.PrefixQuery;
import org.apache.lucene.search.WildcardQuery;
import org.apache.lucene.store.FSDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Exact token index")
class ExactTokenIndexTest {

    @TempDir
    Path tempDir;

    private ExactTokenIndex index;

    @BeforeEach
    void setUp() throws IOException {
        index = new ExactTokenIndex(tempDir.resolve("exact"), 100);
        index.init();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (index != null) {
            index.close();
        }
    }

    private List<IndexHit> search(final String text) {
        final BackendResult result = index.search(new BackendQuery(text, null, 10, false));
        assertThat(result.isOk()).isTrue();
        return result.hits();
    }

    @Nested
    @DisplayName("Indexing and retrieval")
    class Retrieval {

        @Test
        void shouldFindCommittedFields() throws IOException {
            index.index(1, FieldKind.REPORT, "Apple pie recipe");
            index.commit();

            final List<IndexHit> hits = search("apple");

            assertThat(hits).hasSize(1);
            assertThat(hits.get(0).documentId()).isEqualTo(1L);
            assertThat(hits.get(0).fieldKind()).isEqualTo(FieldKind.REPORT);
            assertThat(hits.get(0).matchedText()).isEqualTo("Apple pie recipe");
            assertThat(hits.get(0).rawRank()).isNegative();
        }

        @Test
        void betterMatchesShouldHaveMoreNegativeRank() throws IOException {
            index.index(1, FieldKind.REPORT, "apple");
            index.index(2, FieldKind.REPORT, "an apple among many other words in a rather long sentence");
            index.commit();

            final List<IndexHit> hits = search("apple");

            assertThat(hits).extracting(IndexHit::documentId).containsExactly(1L, 2L);
            assertThat(hits.get(0).rawRank()).isLessThan(hits.get(1).rawRank());
        }

        @Test
        void shouldFoldCaseAndDiacritics() throws IOException {
            index.index(1, FieldKind.REPORT, "Interview mit Herrn Müller");
            index.commit();

            assertThat(search("MULLER")).hasSize(1);
        }

        @Test
        void shouldMatchStemmedForms() throws IOException {
            index.index(1, FieldKind.REPORT, "Neural networks in practice");
            index.commit();

            assertThat(search("network")).hasSize(1);
        }

        @Test
        void shouldSupportPrefixAndWildcardPatterns() throws IOException {
            index.index(1, FieldKind.REPORT, "distributed consensus algorithms");
            index.commit();

            assertThat(search("consen*")).hasSize(1);
            assertThat(search("cons*sus")).hasSize(1);
            assertThat(search("al?orithms")).hasSize(1);
            assertThat(search("zebra*")).isEmpty();
        }

        @Test
        void shouldApplyFieldFilter() throws IOException {
            index.index(1, FieldKind.REPORT, "orbital mechanics");
            index.index(1, FieldKind.OCR, "orbital mechanics slide");
            index.commit();

            final BackendResult result = index.search(new BackendQuery("orbital", FieldKind.OCR, 10, false));

            assertThat(result.hits()).extracting(IndexHit::fieldKind).containsExactly(FieldKind.OCR);
        }

        @Test
        void uncommittedChangesShouldNotBeVisible() throws IOException {
            index.index(1, FieldKind.REPORT, "pending change");

            assertThat(search("pending")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class Maintenance {

        @Test
        void reindexingSameContentShouldKeepOneRow() throws IOException {
            index.index(1, FieldKind.REPORT, "idempotent content");
            index.commit();
            index.index(1, FieldKind.REPORT, "idempotent content");
            index.commit();

            assertThat(index.fieldCount()).isEqualTo(1L);
            assertThat(search("idempotent")).hasSize(1);
        }

        @Test
        void differentContentShouldAddRows() throws IOException {
            index.index(1, FieldKind.REPORT, "first version");
            index.index(1, FieldKind.REPORT, "second version");
            index.commit();

            assertThat(index.fieldCount()).isEqualTo(2L);
        }

        @Test
        void removeShouldDropAllRowsOfDocument() throws IOException {
            index.index(1, FieldKind.REPORT, "to be removed");
            index.index(1, FieldKind.TRANSCRIPT, "also removed");
            index.index(2, FieldKind.REPORT, "kept around");
            index.commit();

            index.remove(1);
            index.commit();

            assertThat(index.fieldCount()).isEqualTo(1L);
            assertThat(search("removed")).isEmpty();
        }

        @Test
        void clearShouldEmptyIndex() throws IOException {
            index.index(1, FieldKind.REPORT, "something");
            index.commit();

            index.clear();
            index.commit();

            assertThat(index.fieldCount()).isZero();
        }

        @Test
        void closedIndexShouldReportUnavailable() throws IOException {
            index.close();

            final BackendResult result = index.search(new BackendQuery("anything", null, 10, false));

            assertThat(result.isOk()).isFalse();
            assertThat(result.failure().reason()).isEqualTo(BackendFailure.Reason.UNAVAILABLE);
            index = null;
        }
    }

    @Nested
    @DisplayName("Literal scan")
    class LiteralScan {

        @Test
        void shouldFindSubstringsCaseInsensitively() throws IOException {
            index.index(1, FieldKind.REPORT, "The Xylophonist performed");
            index.index(2, FieldKind.REPORT, "Nothing to see");
            index.commit();

            final BackendResult result = index.scan("XYLOPHON", null, 10);

            assertThat(result.isOk()).isTrue();
            assertThat(result.hits()).extracting(IndexHit::documentId).containsExactly(1L);
            assertThat(result.hits().get(0).rawRank()).isEqualTo(0.0);
        }

        @Test
        void shouldHonorFilterAndLimit() throws IOException {
            index.index(1, FieldKind.REPORT, "common text");
            index.index(2, FieldKind.OCR, "common text on a slide");
            index.index(3, FieldKind.OCR, "more common text");
            index.commit();

            assertThat(index.scan("common", FieldKind.OCR, 10).hits()).hasSize(2);
            assertThat(index.scan("common", null, 1).hits()).hasSize(1);
            assertThat(index.scan("   ", null, 10).hits()).isEmpty();
        }

        @Test
        void scanShouldSkipRemovedRows() throws IOException {
            index.index(1, FieldKind.REPORT, "ephemeral words");
            index.commit();
            index.remove(1);
            index.commit();

            assertThat(index.scan("ephemeral", null, 10).hits()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Query building")
    class QueryBuilding {

        @Test
        void shouldBuildQueryTypesByPattern() {
            assertThat(index.buildQuery("apple")).isInstanceOf(BooleanQuery.class);
            assertThat(index.buildQuery("app*")).isInstanceOf(PrefixQuery.class);
            assertThat(index.buildQuery("a*ple")).isInstanceOf(WildcardQuery.class);
        }

        @Test
        void shouldReturnNullWhenNothingSearchableRemains() {
            assertThat(index.buildQuery("   ")).isNull();
            assertThat(index.buildQuery("*")).isNull();
            assertThat(index.buildQuery("...")).isNull();
        }
    }

    @Nested
    @DisplayName("Schema version")
    class SchemaVersion {

        @Test
        void freshIndexShouldNotRequireRebuild() throws IOException {
            assertThat(index.isRebuildRequired()).isFalse();

            index.index(1, FieldKind.REPORT, "persisted");
            index.commit();
            index.close();

            index = new ExactTokenIndex(tempDir.resolve("exact"), 100);
            index.init();

            assertThat(index.isRebuildRequired()).isFalse();
            assertThat(search("persisted")).hasSize(1);
        }

        @Test
        void outdatedSchemaShouldRequireRebuild() throws IOException {
            final Path legacyPath = tempDir.resolve("legacy");
            try (FSDirectory directory = FSDirectory.open(legacyPath);
                 IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig(new StandardAnalyzer()))) {
                final Document document = new Document();
                document.add(new StringField("content", "old", Field.Store.YES));
                writer.addDocument(document);
                writer.setLiveCommitData(Map.of(AbstractLuceneIndex.SCHEMA_VERSION_KEY, "0").entrySet());
                writer.commit();
            }

            try (ExactTokenIndex legacy = new ExactTokenIndex(legacyPath, 100)) {
                legacy.init();

                assertThat(legacy.isRebuildRequired()).isTrue();
                assertThat(legacy.getRebuildReason()).contains("schema version");

                legacy.clear();
                legacy.rebuildCompleted();

                assertThat(legacy.isRebuildRequired()).isFalse();
                assertThat(legacy.getRebuildReason()).isNull();
            }
        }

        @Test
        void markedIndexShouldRequireRebuild() {
            index.markRebuildRequired("manual");

            assertThat(index.isRebuildRequired()).isTrue();
            assertThat(index.getRebuildReason()).isEqualTo("manual");
        }
    }
}
