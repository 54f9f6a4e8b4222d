package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;
import de.mirkosertic.mcp.memoryindex.store.Topic;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record AddTopicsRequest(
        @Description("Id of an existing document.")
        long documentId,

        @Description("Topics (chapters) of the document. Titles and summaries also become searchable.")
        List<TopicEntry> topics
) {

    public static AddTopicsRequest fromMap(final Map<String, Object> args) {
        final List<TopicEntry> topics = new ArrayList<>();
        for (final Map<String, Object> topic : Arguments.objectList(args, "topics")) {
            topics.add(TopicEntry.fromMap(topic));
        }
        return new AddTopicsRequest(Arguments.requireLong(args, "documentId"), topics);
    }

    public List<Topic> toTopics() {
        final List<Topic> result = new ArrayList<>(topics.size());
        for (int i = 0; i < topics.size(); i++) {
            result.add(topics.get(i).toTopic(i));
        }
        return result;
    }
}
