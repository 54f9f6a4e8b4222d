package de.mirkosertic.mcp.memoryindex.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.Resources;
import org.h2.jdbcx.JdbcConnectionPool;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Relational store for documents, their indexed fields, tags, topics and timeline entries.
 * <p>
 * This is the source of truth. Both full-text indexes are derived from the {@code indexed_fields}
 * table and can be rebuilt from it at any time.
 */
public class ContentStore implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ContentStore.class);

    private static final String SCHEMA_SCRIPT = "schema.sql";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private static final String DOCUMENT_COLUMNS =
            "d.id, d.title, d.source_category, d.duration_seconds, d.file_ref, d.created_at";

    private static final RowMapper<StoredDocument> DOCUMENT_ROW_MAPPER = (rs, rowNum) -> mapDocument(rs);

    private static final RowMapper<IndexedField> FIELD_ROW_MAPPER = (rs, rowNum) -> new IndexedField(
            rs.getLong("id"),
            rs.getLong("document_id"),
            FieldKind.fromCode(rs.getString("field_kind")),
            rs.getString("content"),
            rs.getString("content_hash"));

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ContentStore(final DataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    /**
     * Opens a pooled embedded H2 database at the given JDBC URL.
     */
    public static ContentStore open(final String jdbcUrl) {
        return new ContentStore(JdbcConnectionPool.create(jdbcUrl, "sa", ""));
    }

    /**
     * Creates all tables that do not exist yet.
     */
    public void init() throws IOException {
        final String script = Resources.toString(Resources.getResource(SCHEMA_SCRIPT), StandardCharsets.UTF_8);
        int statements = 0;
        for (final String statement : script.split(";")) {
            if (!statement.isBlank()) {
                jdbcTemplate.execute(statement.trim());
                statements++;
            }
        }
        logger.info("Content store initialized ({} schema statements)", statements);
    }

    @Override
    public void close() {
        if (dataSource instanceof JdbcConnectionPool pool) {
            pool.dispose();
        }
        logger.info("Content store closed");
    }

    // ------------------------------------------------------------------
    // Documents
    // ------------------------------------------------------------------

    public void upsertDocument(final StoredDocument document) {
        jdbcTemplate.update("""
                        MERGE INTO documents (id, title, source_category, duration_seconds, file_ref, created_at)
                        KEY (id) VALUES (?, ?, ?, ?, ?, ?)""",
                document.id(),
                document.title(),
                document.sourceCategory().code(),
                document.durationSeconds(),
                document.fileRef(),
                OffsetDateTime.ofInstant(document.createdAt(), ZoneOffset.UTC));
    }

    public Optional<StoredDocument> findDocument(final long documentId) {
        final List<StoredDocument> documents = jdbcTemplate.query(
                "SELECT " + DOCUMENT_COLUMNS + " FROM documents d WHERE d.id = ?",
                DOCUMENT_ROW_MAPPER, documentId);
        return documents.stream().findFirst();
    }

    public boolean documentExists(final long documentId) {
        final Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM documents WHERE id = ?", Integer.class, documentId);
        return count != null && count > 0;
    }

    /**
     * Loads the given documents. Ids without a stored document are absent from the result.
     */
    public Map<Long, StoredDocument> findDocuments(final Collection<Long> documentIds) {
        if (documentIds.isEmpty()) {
            return Map.of();
        }
        final Map<Long, StoredDocument> result = new HashMap<>();
        namedJdbcTemplate.query(
                "SELECT " + DOCUMENT_COLUMNS + " FROM documents d WHERE d.id IN (:ids)",
                new MapSqlParameterSource("ids", documentIds),
                rs -> {
                    final StoredDocument document = mapDocument(rs);
                    result.put(document.id(), document);
                });
        return result;
    }

    /**
     * Lists documents newest first, optionally restricted to one source category.
     */
    public List<StoredDocument> listDocuments(final @Nullable SourceCategory category, final int limit, final int offset) {
        if (category == null) {
            return jdbcTemplate.query(
                    "SELECT " + DOCUMENT_COLUMNS + " FROM documents d ORDER BY d.created_at DESC, d.id ASC LIMIT ? OFFSET ?",
                    DOCUMENT_ROW_MAPPER, limit, offset);
        }
        return jdbcTemplate.query(
                "SELECT " + DOCUMENT_COLUMNS + " FROM documents d WHERE d.source_category = ? "
                        + "ORDER BY d.created_at DESC, d.id ASC LIMIT ? OFFSET ?",
                DOCUMENT_ROW_MAPPER, category.code(), limit, offset);
    }

    /**
     * Removes a document and everything that belongs to it in one transaction.
     *
     * @return false if no such document existed
     */
    public boolean deleteDocument(final long documentId) {
        final Boolean deleted = transactionTemplate.execute(status -> {
            if (!documentExists(documentId)) {
                return false;
            }
            jdbcTemplate.update("""
                    UPDATE tags SET usage_count = GREATEST(usage_count - 1, 0)
                    WHERE id IN (SELECT tag_id FROM document_tags WHERE document_id = ?)""", documentId);
            jdbcTemplate.update("DELETE FROM document_tags WHERE document_id = ?", documentId);
            jdbcTemplate.update("DELETE FROM topics WHERE document_id = ?", documentId);
            jdbcTemplate.update("DELETE FROM timeline_entries WHERE document_id = ?", documentId);
            jdbcTemplate.update("DELETE FROM indexed_fields WHERE document_id = ?", documentId);
            jdbcTemplate.update("DELETE FROM documents WHERE id = ?", documentId);
            return true;
        });
        return Boolean.TRUE.equals(deleted);
    }

    // ------------------------------------------------------------------
    // Indexed fields
    // ------------------------------------------------------------------

    /**
     * Stores a field unless the same text was already stored for this document and kind.
     *
     * @return the stored field, either newly created or the existing identical one
     * @throws IllegalArgumentException if the document does not exist
     */
    public IndexedField addIndexedField(final long documentId, final FieldKind kind, final String text) {
        final String contentHash = contentHash(text);
        final IndexedField field = transactionTemplate.execute(status -> {
            if (!documentExists(documentId)) {
                throw new IllegalArgumentException("Unknown document: " + documentId);
            }
            final List<IndexedField> existing = jdbcTemplate.query("""
                            SELECT id, document_id, field_kind, content, content_hash FROM indexed_fields
                            WHERE document_id = ? AND field_kind = ? AND content_hash = ?""",
                    FIELD_ROW_MAPPER, documentId, kind.code(), contentHash);
            if (!existing.isEmpty()) {
                return existing.get(0);
            }
            final long id = insertReturningId(
                    "INSERT INTO indexed_fields (document_id, field_kind, content, content_hash) VALUES (?, ?, ?, ?)",
                    documentId, kind.code(), text, contentHash);
            return new IndexedField(id, documentId, kind, text, contentHash);
        });
        if (field == null) {
            throw new IllegalStateException("Indexed field could not be stored for document " + documentId);
        }
        return field;
    }

    public List<IndexedField> fieldsForDocument(final long documentId) {
        return jdbcTemplate.query("""
                        SELECT id, document_id, field_kind, content, content_hash FROM indexed_fields
                        WHERE document_id = ? ORDER BY id""",
                FIELD_ROW_MAPPER, documentId);
    }

    /**
     * Text of the most recently stored field of the given kind.
     */
    public Optional<String> latestFieldText(final long documentId, final FieldKind kind) {
        final List<String> texts = jdbcTemplate.query("""
                        SELECT content FROM indexed_fields WHERE document_id = ? AND field_kind = ?
                        ORDER BY id DESC LIMIT 1""",
                (rs, rowNum) -> rs.getString("content"), documentId, kind.code());
        return texts.stream().findFirst();
    }

    /**
     * Streams every stored field in insertion order.
     *
     * @return number of fields visited
     */
    public long forEachIndexedField(final Consumer<IndexedField> consumer) {
        final long[] visited = {0};
        jdbcTemplate.query(
                "SELECT id, document_id, field_kind, content, content_hash FROM indexed_fields ORDER BY id",
                rs -> {
                    consumer.accept(FIELD_ROW_MAPPER.mapRow(rs, (int) visited[0]));
                    visited[0]++;
                });
        return visited[0];
    }

    // ------------------------------------------------------------------
    // Tags
    // ------------------------------------------------------------------

    /**
     * Links tags to a document, creating unknown tags on the fly. Tag names are matched case-insensitively
     * and an already existing link is left untouched.
     *
     * @return number of newly created links
     */
    public int addTags(final long documentId, final List<String> tagNames, final TagProvenance provenance,
                       final double confidence, final @Nullable String category) {
        final double clampedConfidence = Math.max(0.0, Math.min(1.0, confidence));
        final Integer created = transactionTemplate.execute(status -> {
            if (!documentExists(documentId)) {
                throw new IllegalArgumentException("Unknown document: " + documentId);
            }
            int links = 0;
            for (final String name : normalizeTagNames(tagNames)) {
                final long tagId = findOrCreateTag(name, category);
                final Integer linked = jdbcTemplate.queryForObject(
                        "SELECT COUNT(*) FROM document_tags WHERE document_id = ? AND tag_id = ?",
                        Integer.class, documentId, tagId);
                if (linked != null && linked > 0) {
                    continue;
                }
                jdbcTemplate.update(
                        "INSERT INTO document_tags (document_id, tag_id, provenance, confidence) VALUES (?, ?, ?, ?)",
                        documentId, tagId, provenance.code(), clampedConfidence);
                jdbcTemplate.update("UPDATE tags SET usage_count = usage_count + 1 WHERE id = ?", tagId);
                links++;
            }
            return links;
        });
        return created == null ? 0 : created;
    }

    private long findOrCreateTag(final String name, final @Nullable String category) {
        final List<Long> ids = jdbcTemplate.query(
                "SELECT id FROM tags WHERE LOWER(name) = ?",
                (rs, rowNum) -> rs.getLong("id"), name.toLowerCase(Locale.ROOT));
        if (!ids.isEmpty()) {
            return ids.get(0);
        }
        return insertReturningId("INSERT INTO tags (name, category, usage_count) VALUES (?, ?, 0)", name, category);
    }

    /**
     * Tags of each given document, sorted by name.
     */
    public Map<Long, List<String>> tagsFor(final Collection<Long> documentIds) {
        if (documentIds.isEmpty()) {
            return Map.of();
        }
        final Map<Long, List<String>> result = new HashMap<>();
        namedJdbcTemplate.query("""
                        SELECT dt.document_id, t.name FROM document_tags dt JOIN tags t ON t.id = dt.tag_id
                        WHERE dt.document_id IN (:ids) ORDER BY dt.document_id, LOWER(t.name)""",
                new MapSqlParameterSource("ids", documentIds),
                rs -> {
                    result.computeIfAbsent(rs.getLong("document_id"), k -> new ArrayList<>()).add(rs.getString("name"));
                });
        return result;
    }

    /**
     * Ids of documents carrying every one of the given tags.
     */
    public Set<Long> documentIdsWithAllTags(final List<String> tagNames) {
        final Set<String> names = lowerCaseTagNames(tagNames);
        if (names.isEmpty()) {
            return Set.of();
        }
        return new LinkedHashSet<>(namedJdbcTemplate.query("""
                        SELECT dt.document_id FROM document_tags dt JOIN tags t ON t.id = dt.tag_id
                        WHERE LOWER(t.name) IN (:names)
                        GROUP BY dt.document_id HAVING COUNT(DISTINCT t.id) = :count""",
                new MapSqlParameterSource("names", names).addValue("count", names.size()),
                (rs, rowNum) -> rs.getLong("document_id")));
    }

    /**
     * Ids of documents carrying at least one of the given tags.
     */
    public Set<Long> documentIdsWithAnyTag(final List<String> tagNames) {
        final Set<String> names = lowerCaseTagNames(tagNames);
        if (names.isEmpty()) {
            return Set.of();
        }
        return new LinkedHashSet<>(namedJdbcTemplate.query("""
                        SELECT DISTINCT dt.document_id FROM document_tags dt JOIN tags t ON t.id = dt.tag_id
                        WHERE LOWER(t.name) IN (:names)""",
                new MapSqlParameterSource("names", names),
                (rs, rowNum) -> rs.getLong("document_id")));
    }

    /**
     * Documents by tag. AND mode returns documents carrying every tag, newest first. OR mode returns documents
     * carrying any tag, ranked by the number of matched tags and then by recency. An empty tag list applies no
     * filter and returns the newest documents with a matched count of 0.
     */
    public List<TaggedDocument> searchByTags(final List<String> tagNames, final boolean matchAll,
                                             final int limit, final int offset) {
        final Set<String> names = lowerCaseTagNames(tagNames);
        if (names.isEmpty()) {
            final List<StoredDocument> newest = listDocuments(null, limit, offset);
            final Map<Long, List<String>> tags = tagsFor(newest.stream().map(StoredDocument::id).toList());
            return newest.stream()
                    .map(document -> new TaggedDocument(document, tags.getOrDefault(document.id(), List.of()), 0))
                    .toList();
        }
        final String sql = "SELECT " + DOCUMENT_COLUMNS + ", m.matched FROM documents d JOIN ("
                + " SELECT dt.document_id, COUNT(DISTINCT t.id) AS matched FROM document_tags dt"
                + " JOIN tags t ON t.id = dt.tag_id WHERE LOWER(t.name) IN (:names) GROUP BY dt.document_id"
                + (matchAll ? " HAVING COUNT(DISTINCT t.id) = :count" : "")
                + ") m ON m.document_id = d.id"
                + (matchAll
                ? " ORDER BY d.created_at DESC, d.id ASC"
                : " ORDER BY m.matched DESC, d.created_at DESC, d.id ASC")
                + " LIMIT :limit OFFSET :offset";
        final MapSqlParameterSource params = new MapSqlParameterSource("names", names)
                .addValue("count", names.size())
                .addValue("limit", limit)
                .addValue("offset", offset);

        final Map<Long, Integer> matchedCounts = new LinkedHashMap<>();
        final List<StoredDocument> documents = namedJdbcTemplate.query(sql, params, (rs, rowNum) -> {
            final StoredDocument document = mapDocument(rs);
            matchedCounts.put(document.id(), rs.getInt("matched"));
            return document;
        });

        final Map<Long, List<String>> tags = tagsFor(matchedCounts.keySet());
        final List<TaggedDocument> result = new ArrayList<>(documents.size());
        for (final StoredDocument document : documents) {
            result.add(new TaggedDocument(document,
                    tags.getOrDefault(document.id(), List.of()),
                    matchedCounts.getOrDefault(document.id(), 0)));
        }
        return result;
    }

    /**
     * Tags attached to at least one document, most used first.
     */
    public List<TagUsage> popularTags(final int limit) {
        return jdbcTemplate.query("""
                        SELECT t.name, t.category, t.usage_count, COUNT(dt.document_id) AS document_count
                        FROM tags t LEFT JOIN document_tags dt ON dt.tag_id = t.id
                        GROUP BY t.id, t.name, t.category, t.usage_count
                        HAVING COUNT(dt.document_id) > 0
                        ORDER BY t.usage_count DESC, document_count DESC, LOWER(t.name) ASC
                        LIMIT ?""",
                (rs, rowNum) -> new TagUsage(
                        rs.getString("name"),
                        rs.getString("category"),
                        rs.getInt("usage_count"),
                        rs.getInt("document_count")),
                limit);
    }

    /**
     * Tag names starting with the given prefix, most used first.
     */
    public List<String> suggestTags(final String prefix, final int limit) {
        return jdbcTemplate.query("""
                        SELECT name FROM tags WHERE LOWER(name) LIKE ? ESCAPE '\\'
                        ORDER BY usage_count DESC, LOWER(name) ASC LIMIT ?""",
                (rs, rowNum) -> rs.getString("name"),
                escapeLike(prefix.trim().toLowerCase(Locale.ROOT)) + "%", limit);
    }

    // ------------------------------------------------------------------
    // Topics
    // ------------------------------------------------------------------

    public void addTopics(final long documentId, final List<Topic> topics) {
        transactionTemplate.executeWithoutResult(status -> {
            if (!documentExists(documentId)) {
                throw new IllegalArgumentException("Unknown document: " + documentId);
            }
            for (final Topic topic : topics) {
                jdbcTemplate.update("""
                                INSERT INTO topics (document_id, title, summary, start_seconds, end_seconds, keywords, sequence_no)
                                VALUES (?, ?, ?, ?, ?, ?, ?)""",
                        documentId, topic.title(), topic.summary(), topic.startSeconds(), topic.endSeconds(),
                        toJson(topic.keywords()), topic.sequence());
            }
        });
    }

    public List<Topic> topicsForDocument(final long documentId) {
        return jdbcTemplate.query(
                "SELECT * FROM topics WHERE document_id = ? ORDER BY sequence_no, id",
                (rs, rowNum) -> mapTopic(rs), documentId);
    }

    /**
     * Topics whose title or summary contains the query, case-insensitively.
     */
    public List<TopicHit> searchTopics(final String query, final int limit, final int offset) {
        final String pattern = "%" + escapeLike(query.trim().toLowerCase(Locale.ROOT)) + "%";
        return jdbcTemplate.query("""
                        SELECT tp.*, d.title AS document_title, d.source_category AS document_category
                        FROM topics tp JOIN documents d ON d.id = tp.document_id
                        WHERE LOWER(tp.title) LIKE ? ESCAPE '\\' OR LOWER(tp.summary) LIKE ? ESCAPE '\\'
                        ORDER BY tp.document_id, tp.sequence_no, tp.id
                        LIMIT ? OFFSET ?""",
                (rs, rowNum) -> new TopicHit(
                        rs.getLong("document_id"),
                        rs.getString("document_title"),
                        SourceCategory.fromCode(rs.getString("document_category")),
                        mapTopic(rs)),
                pattern, pattern, limit, offset);
    }

    // ------------------------------------------------------------------
    // Timeline
    // ------------------------------------------------------------------

    public void addTimelineEntries(final long documentId, final List<TimelineEntry> entries) {
        transactionTemplate.executeWithoutResult(status -> {
            if (!documentExists(documentId)) {
                throw new IllegalArgumentException("Unknown document: " + documentId);
            }
            jdbcTemplate.batchUpdate("""
                            INSERT INTO timeline_entries (document_id, timestamp_seconds, frame_number, transcript_text, ocr_text, key_frame)
                            VALUES (?, ?, ?, ?, ?, ?)""",
                    entries.stream()
                            .map(entry -> new Object[]{documentId, entry.timestampSeconds(), entry.frameNumber(),
                                    entry.transcriptText(), entry.ocrText(), entry.keyFrame()})
                            .toList());
        });
    }

    /**
     * Earliest timestamp whose transcript or OCR text (depending on the kind) contains the probe text.
     */
    public Optional<Double> findTimelineTimestamp(final long documentId, final FieldKind kind, final String probe) {
        final String column;
        if (kind == FieldKind.TRANSCRIPT) {
            column = "transcript_text";
        } else if (kind == FieldKind.OCR) {
            column = "ocr_text";
        } else {
            return Optional.empty();
        }
        final List<Double> timestamps = jdbcTemplate.query(
                "SELECT timestamp_seconds FROM timeline_entries WHERE document_id = ? AND LOWER(" + column
                        + ") LIKE ? ESCAPE '\\' ORDER BY timestamp_seconds LIMIT 1",
                (rs, rowNum) -> rs.getDouble("timestamp_seconds"),
                documentId, "%" + escapeLike(probe.toLowerCase(Locale.ROOT)) + "%");
        return timestamps.stream().findFirst();
    }

    public List<TimelineEntry> timelineForDocument(final long documentId) {
        return jdbcTemplate.query(
                "SELECT * FROM timeline_entries WHERE document_id = ? ORDER BY timestamp_seconds, id",
                (rs, rowNum) -> new TimelineEntry(
                        rs.getDouble("timestamp_seconds"),
                        rs.getObject("frame_number", Integer.class),
                        rs.getString("transcript_text"),
                        rs.getString("ocr_text"),
                        rs.getBoolean("key_frame")),
                documentId);
    }

    // ------------------------------------------------------------------
    // Statistics
    // ------------------------------------------------------------------

    public StoreStatistics statistics() {
        final Map<String, Long> byCategory = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT source_category, COUNT(*) AS cnt FROM documents GROUP BY source_category ORDER BY source_category",
                rs -> {
                    byCategory.put(rs.getString("source_category"), rs.getLong("cnt"));
                });
        final Map<String, Long> byKind = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT field_kind, COUNT(*) AS cnt FROM indexed_fields GROUP BY field_kind ORDER BY field_kind",
                rs -> {
                    byKind.put(rs.getString("field_kind"), rs.getLong("cnt"));
                });
        return new StoreStatistics(
                count("documents"),
                count("indexed_fields"),
                count("tags"),
                count("topics"),
                count("timeline_entries"),
                byCategory,
                byKind);
    }

    private long count(final String table) {
        final Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0 : count;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private long insertReturningId(final String sql, final Object... args) {
        final KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            final PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            for (int i = 0; i < args.length; i++) {
                ps.setObject(i + 1, args[i]);
            }
            return ps;
        }, keyHolder);
        final Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No generated key returned for: " + sql);
        }
        return key.longValue();
    }

    private static StoredDocument mapDocument(final ResultSet rs) throws SQLException {
        final OffsetDateTime createdAt = rs.getObject("created_at", OffsetDateTime.class);
        return new StoredDocument(
                rs.getLong("id"),
                rs.getString("title"),
                SourceCategory.fromCode(rs.getString("source_category")),
                rs.getObject("duration_seconds", Integer.class),
                rs.getString("file_ref"),
                createdAt != null ? createdAt.toInstant() : Instant.EPOCH);
    }

    private Topic mapTopic(final ResultSet rs) throws SQLException {
        return new Topic(
                rs.getString("title"),
                rs.getString("summary"),
                rs.getObject("start_seconds", Double.class),
                rs.getObject("end_seconds", Double.class),
                fromJson(rs.getString("keywords")),
                rs.getInt("sequence_no"));
    }

    private String toJson(final List<String> keywords) {
        try {
            return objectMapper.writeValueAsString(keywords);
        } catch (final JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private List<String> fromJson(final @Nullable String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (final JsonProcessingException e) {
            logger.warn("Ignoring malformed topic keywords: {}", json, e);
            return List.of();
        }
    }

    private static List<String> normalizeTagNames(final List<String> tagNames) {
        final Map<String, String> unique = new LinkedHashMap<>();
        for (final String name : tagNames) {
            if (name == null || name.isBlank()) {
                continue;
            }
            final String trimmed = name.trim();
            unique.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
        }
        return new ArrayList<>(unique.values());
    }

    private static Set<String> lowerCaseTagNames(final List<String> tagNames) {
        final Set<String> names = new LinkedHashSet<>();
        for (final String name : normalizeTagNames(tagNames)) {
            names.add(name.toLowerCase(Locale.ROOT));
        }
        return names;
    }

    static String escapeLike(final String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    /**
     * SHA-256 of the text, hex encoded.
     */
    public static String contentHash(final String text) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            final byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            final StringBuilder hexString = new StringBuilder();
            for (final byte b : hash) {
                final String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
