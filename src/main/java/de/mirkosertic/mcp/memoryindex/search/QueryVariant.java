package de.mirkosertic.mcp.memoryindex.search;

/**
 * A pattern sent to a backend on behalf of one keyword.
 */
public record QueryVariant(String pattern, VariantKind kind, double weight) {

    public static QueryVariant of(final String pattern, final VariantKind kind) {
        return new QueryVariant(pattern, kind, kind.weight());
    }

    /**
     * Characters before the first wildcard.
     */
    public int literalPrefixLength() {
        int length = 0;
        while (length < pattern.length() && pattern.charAt(length) != '*' && pattern.charAt(length) != '?') {
            length++;
        }
        return length;
    }
}
