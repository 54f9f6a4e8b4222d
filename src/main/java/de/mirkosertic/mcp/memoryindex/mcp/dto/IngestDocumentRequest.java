package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;
import de.mirkosertic.mcp.memoryindex.store.SourceCategory;
import de.mirkosertic.mcp.memoryindex.store.StoredDocument;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Request DTO for the ingestDocument tool. Creates the document or replaces its metadata.
 */
public record IngestDocumentRequest(
        @Description("Id assigned by the content pipeline.")
        long id,

        @Description("Document title.")
        String title,

        @Nullable
        @Description("Source category, e.g. video, youtube, bilibili, web_archive. Unknown values are stored as unknown.")
        String sourceCategory,

        @Nullable
        @Description("Duration in seconds for audio and video content.")
        Integer durationSeconds,

        @Nullable
        @Description("Path or URL of the original content.")
        String fileRef,

        @Nullable
        @Description("Creation time as ISO-8601 timestamp, e.g. 2024-05-01T10:15:30Z. Defaults to now.")
        String createdAt
) {

    public static IngestDocumentRequest fromMap(final Map<String, Object> args) {
        return new IngestDocumentRequest(
                Arguments.requireLong(args, "id"),
                Arguments.requireString(args, "title"),
                Arguments.string(args, "sourceCategory"),
                Arguments.integer(args, "durationSeconds"),
                Arguments.string(args, "fileRef"),
                Arguments.string(args, "createdAt"));
    }

    /**
     * @throws IllegalArgumentException if {@code createdAt} is not an ISO-8601 timestamp
     */
    public StoredDocument toDocument() {
        return new StoredDocument(id, title, SourceCategory.fromCode(sourceCategory), durationSeconds, fileRef,
                parseCreatedAt());
    }

    private Instant parseCreatedAt() {
        if (createdAt == null || createdAt.isBlank()) {
            return Instant.now();
        }
        try {
            return OffsetDateTime.parse(createdAt.trim()).toInstant();
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid createdAt timestamp: " + createdAt, e);
        }
    }
}
