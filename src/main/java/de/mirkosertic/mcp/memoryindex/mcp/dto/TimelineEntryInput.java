package de.mirkosertic.mcp.memoryindex.mcp.dto;

import de.mirkosertic.mcp.memoryindex.mcp.Description;
import de.mirkosertic.mcp.memoryindex.store.TimelineEntry;
import org.jspecify.annotations.Nullable;

import java.util.Map;

public record TimelineEntryInput(
        @Description("Position in seconds.")
        double timestampSeconds,

        @Nullable
        @Description("Video frame number.")
        Integer frameNumber,

        @Nullable
        @Description("Speech transcribed at this position.")
        String transcriptText,

        @Nullable
        @Description("On-screen text recognized at this position.")
        String ocrText,

        @Nullable
        @Description("Whether the frame is a key frame. Default is false.")
        Boolean keyFrame
) {

    public static TimelineEntryInput fromMap(final Map<String, Object> args) {
        final Double timestamp = Arguments.decimal(args, "timestampSeconds");
        if (timestamp == null) {
            throw new IllegalArgumentException("timestampSeconds is required");
        }
        return new TimelineEntryInput(
                timestamp,
                Arguments.integer(args, "frameNumber"),
                Arguments.string(args, "transcriptText"),
                Arguments.string(args, "ocrText"),
                Arguments.bool(args, "keyFrame"));
    }

    public TimelineEntry toEntry() {
        return new TimelineEntry(timestampSeconds, frameNumber, transcriptText, ocrText,
                keyFrame != null && keyFrame);
    }
}
