package de.mirkosertic.mcp.memoryindex.search;

/**
 * How a query variant was derived from the keyword, with the weight applied to scores of its hits.
 */
public enum VariantKind {

    /** Keyword with a trailing wildcard. */
    PREFIX(1.0),
    /** Wildcard inserted inside the keyword, tolerating a missing character. */
    INSERTION(0.8),
    /** One character removed plus a trailing wildcard, tolerating an extra character. */
    DELETION(0.8),
    /** Configured expansion of a four-letter code into category patterns. */
    CATEGORY(0.6),
    /** Keyword as typed, analyzed and stemmed. */
    EXACT(1.0),
    /** Keyword sent to the segmented backend. */
    APPROXIMATE(1.0),
    /** Substring scan, ranked below token matches. */
    LITERAL(0.5);

    private final double weight;

    VariantKind(final double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }
}
