package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;
import de.mirkosertic.mcp.memoryindex.store.Topic;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * A topic as sent by and returned to clients.
 */
public record TopicEntry(
        @Description("Topic title.")
        String title,

        @Nullable
        @Description("Short summary of the topic.")
        String summary,

        @Nullable
        @Description("Start of the topic in seconds.")
        Double startSeconds,

        @Nullable
        @Description("End of the topic in seconds.")
        Double endSeconds,

        @Nullable
        @Description("Keywords of the topic.")
        List<String> keywords,

        @Nullable
        @Description("Position of the topic within the document. Defaults to the list position.")
        Integer sequence
) {

    public static TopicEntry fromMap(final Map<String, Object> args) {
        return new TopicEntry(
                Arguments.requireString(args, "title"),
                Arguments.string(args, "summary"),
                Arguments.decimal(args, "startSeconds"),
                Arguments.decimal(args, "endSeconds"),
                Arguments.stringList(args, "keywords"),
                Arguments.integer(args, "sequence"));
    }

    public static TopicEntry fromTopic(final Topic topic) {
        return new TopicEntry(topic.title(), topic.summary(), topic.startSeconds(), topic.endSeconds(),
                topic.keywords(), topic.sequence());
    }

    public Topic toTopic(final int position) {
        return new Topic(title, summary, startSeconds, endSeconds, keywords,
                sequence == null ? position : sequence);
    }
}
