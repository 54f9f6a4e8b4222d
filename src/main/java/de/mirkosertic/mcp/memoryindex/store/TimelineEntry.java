package de.mirkosertic.mcp.memoryindex.store;

import org.jspecify.annotations.Nullable;

/**
 * Text observed at a point in time of a time-bearing document.
 */
public record TimelineEntry(
        double timestampSeconds,
        @Nullable Integer frameNumber,
        @Nullable String transcriptText,
        @Nullable String ocrText,
        boolean keyFrame
) {
}
