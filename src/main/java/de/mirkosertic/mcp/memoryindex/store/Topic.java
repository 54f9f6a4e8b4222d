package de.mirkosertic.mcp.memoryindex.store;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A chapter or section of a document.
 */
public record Topic(
        String title,
        @Nullable String summary,
        @Nullable Double startSeconds,
        @Nullable Double endSeconds,
        List<String> keywords,
        int sequence
) {

    public Topic {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    /**
     * Text fed into the full-text indexes for this topic.
     */
    public String searchableText() {
        if (summary == null || summary.isBlank()) {
            return title;
        }
        return title + "\n" + summary;
    }
}
