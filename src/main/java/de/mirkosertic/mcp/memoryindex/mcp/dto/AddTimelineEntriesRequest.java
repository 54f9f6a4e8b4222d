package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;
import de.mirkosertic.mcp.memoryindex.store.TimelineEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record AddTimelineEntriesRequest(
        @Description("Id of an existing document.")
        long documentId,

        @Description("Timeline entries used to position transcript and OCR matches in time.")
        List<TimelineEntryInput> entries
) {

    public static AddTimelineEntriesRequest fromMap(final Map<String, Object> args) {
        final List<TimelineEntryInput> entries = new ArrayList<>();
        for (final Map<String, Object> entry : Arguments.objectList(args, "entries")) {
            entries.add(TimelineEntryInput.fromMap(entry));
        }
        return new AddTimelineEntriesRequest(Arguments.requireLong(args, "documentId"), entries);
    }

    public List<TimelineEntry> toEntries() {
        return entries.stream().map(TimelineEntryInput::toEntry).toList();
    }
}
