package de.mirkosertic.mcp.memoryindex.index;

/**
 * Why a backend could not answer a query.
 */
public record BackendFailure(BackendKind backend, Reason reason, String message) {

    public enum Reason {
        /**
         * Not initialized, closed, or failing with an I/O error.
         */
        UNAVAILABLE,

        /**
         * Structural read failure. The index has been flagged for rebuild.
         */
        CORRUPTION
    }

    public static BackendFailure unavailable(final BackendKind backend, final String message) {
        return new BackendFailure(backend, Reason.UNAVAILABLE, message);
    }

    public static BackendFailure corruption(final BackendKind backend, final String message) {
        return new BackendFailure(backend, Reason.CORRUPTION, message);
    }
}
