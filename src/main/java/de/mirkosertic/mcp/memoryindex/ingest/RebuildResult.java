package de.mirkosertic.mcp.memoryindex.ingest;

/**
 * Outcome of a full index rebuild.
 *
 * @param fieldsIndexed number of stored fields fed into each backend
 * @param durationMs    wall clock time of the rebuild
 */
public record RebuildResult(long fieldsIndexed, long durationMs) {
}
