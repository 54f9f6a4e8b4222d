package de.mirkosertic.mcp.memoryindex.search;

import java.util.List;

/**
 * Cuts a context window around the first occurrence of a matched term.
 */
public class SnippetExtractor {

    public static final String ELLIPSIS = "...";

    private final int contextChars;
    private final int fallbackChars;

    public SnippetExtractor(final int contextChars, final int fallbackChars) {
        this.contextChars = contextChars;
        this.fallbackChars = fallbackChars;
    }

    /**
     * Tries the terms in order and builds the window around the first one that occurs in the text. If none
     * occurs, which happens after fuzzy or stemmed matches, the start of the text is returned.
     */
    public String extract(final String text, final List<String> terms) {
        for (final String term : terms) {
            if (term == null || term.isBlank()) {
                continue;
            }
            final int position = indexOfIgnoreCase(text, term);
            if (position >= 0) {
                return window(text, position, term.length());
            }
        }
        return leading(text);
    }

    String window(final String text, final int position, final int termLength) {
        int start = Math.max(0, position - contextChars);
        int end = Math.min(text.length(), position + termLength + contextChars);
        if (start > 0 && Character.isLowSurrogate(text.charAt(start))) {
            start--;
        }
        if (end < text.length() && Character.isLowSurrogate(text.charAt(end))) {
            end++;
        }
        final StringBuilder snippet = new StringBuilder(end - start + 2 * ELLIPSIS.length());
        if (start > 0) {
            snippet.append(ELLIPSIS);
        }
        snippet.append(text, start, end);
        if (end < text.length()) {
            snippet.append(ELLIPSIS);
        }
        return snippet.toString();
    }

    String leading(final String text) {
        if (text.length() <= fallbackChars) {
            return text;
        }
        int end = fallbackChars;
        if (Character.isLowSurrogate(text.charAt(end))) {
            end--;
        }
        return text.substring(0, end) + ELLIPSIS;
    }

    static int indexOfIgnoreCase(final String text, final String term) {
        final int last = text.length() - term.length();
        for (int i = 0; i <= last; i++) {
            if (text.regionMatches(true, i, term, 0, term.length())) {
                return i;
            }
        }
        return -1;
    }
}
