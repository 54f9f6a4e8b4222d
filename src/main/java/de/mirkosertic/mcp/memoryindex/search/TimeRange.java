package de.mirkosertic.mcp.memoryindex.search;

/**
 * Approximate position of a snippet inside a time-bearing document, in seconds.
 */
public record TimeRange(double startSeconds, double endSeconds) {
}
