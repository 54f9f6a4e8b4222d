package de.mirkosertic.mcp.memoryindex.util;

import java.util.regex.Pattern;

/**
 * Removes characters that break tokenization, snippets or timeline matching from pipeline text.
 *
 * <p>Filters out:</p>
 * <ul>
 *   <li>Unicode replacement characters from failed decoding</li>
 *   <li>Control characters that aren't whitespace</li>
 *   <li>Zero-width characters and byte order marks</li>
 *   <li>Soft hyphens, which OCR output carries at line breaks</li>
 * </ul>
 */
public final class TextCleaner {

    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000" +                    // NULL
        "\u0001-\u0008" +             // Control chars before TAB
        "\u000B-\u000C" +             // Control chars between TAB and CR (excluding LF)
        "\u000E-\u001F" +             // Control chars after CR
        "\u00AD" +             // Soft hyphen
        "\u200B" +             // Zero-width space
        "\u200C" +             // Zero-width non-joiner
        "\u200D" +             // Zero-width joiner
        "\uFEFF" +             // Byte order mark
        "\uFFFD" +             // Replacement character
        "]"
    );

    /**
     * Unicode line and paragraph separators, treated as plain line breaks.
     */
    private static final Pattern LINE_SEPARATORS = Pattern.compile("[\u2028\u2029]");

    private static final Pattern MULTIPLE_WHITESPACE = Pattern.compile("\\s{2,}");

    private TextCleaner() {
        // Utility class, no instances
    }

    /**
     * Removes invalid characters and collapses whitespace runs into a single space.
     *
     * @param text the text to clean (may be null)
     * @return cleaned text, or null if input was null
     */
    public static String clean(final String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String cleaned = cleanPreservingWhitespace(text);
        cleaned = MULTIPLE_WHITESPACE.matcher(cleaned).replaceAll(" ");
        return cleaned.trim();
    }

    /**
     * Removes invalid characters but keeps the whitespace layout, apart from mapping Unicode line
     * separators to {@code \n}.
     *
     * @param text the text to clean (may be null)
     * @return cleaned text, or null if input was null
     */
    public static String cleanPreservingWhitespace(final String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        final String cleaned = INVALID_CHARS.matcher(text).replaceAll("");
        return LINE_SEPARATORS.matcher(cleaned).replaceAll("\n");
    }
}
