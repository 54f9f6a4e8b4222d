package de.mirkosertic.mcp.memoryindex.index;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Outcome of a backend query: either hits, or a failure. Never both.
 */
public record BackendResult(List<IndexHit> hits, @Nullable BackendFailure failure) {

    public BackendResult {
        hits = List.copyOf(hits);
    }

    public static BackendResult ok(final List<IndexHit> hits) {
        return new BackendResult(hits, null);
    }

    public static BackendResult failed(final BackendFailure failure) {
        return new BackendResult(List.of(), failure);
    }

    public boolean isOk() {
        return failure == null;
    }
}
