package de.mirkosertic.mcp.memoryindex.search;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a one-line summary from a generated Markdown report for document listings.
 * <p>
 * Looks for a {@code ## Summary} section or a {@code Summary:} label (English or Chinese), otherwise takes
 * the first line that is neither a heading nor a list item and is longer than 10 characters.
 */
public class ReportSummaryExtractor {

    private static final List<Pattern> SUMMARY_PATTERNS = List.of(
            Pattern.compile("(?:^|\\n)##\\s*(?:summary|摘要)\\s*\\n+(.+?)(?:\\n\\n|\\n##|$)",
                    Pattern.DOTALL | Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:summary|摘要)[:：]\\s*(.+?)(?:\\n\\n|\\n##|$)",
                    Pattern.DOTALL | Pattern.CASE_INSENSITIVE));

    private static final Pattern MARKDOWN = Pattern.compile("\\*\\*|\\*|`|#|\\[|]|\\(.*?\\)");

    private static final int MIN_LINE_LENGTH = 10;

    private final int maxChars;

    public ReportSummaryExtractor(final int maxChars) {
        this.maxChars = maxChars;
    }

    public Optional<String> extract(final @Nullable String report) {
        if (report == null || report.isBlank()) {
            return Optional.empty();
        }
        for (final Pattern pattern : SUMMARY_PATTERNS) {
            final Matcher matcher = pattern.matcher(report);
            if (matcher.find()) {
                final String summary = clean(matcher.group(1));
                if (!summary.isEmpty()) {
                    return Optional.of(truncate(summary));
                }
            }
        }
        for (final String rawLine : report.split("\n")) {
            final String line = rawLine.strip();
            if (line.length() > MIN_LINE_LENGTH && !line.startsWith("#") && !line.startsWith("*")
                    && !line.startsWith("-")) {
                final String cleaned = clean(line);
                if (!cleaned.isEmpty()) {
                    return Optional.of(truncate(cleaned));
                }
            }
        }
        return Optional.empty();
    }

    private static String clean(final String text) {
        return MARKDOWN.matcher(text).replaceAll("").strip().replaceAll("\\s+", " ");
    }

    private String truncate(final String text) {
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + SnippetExtractor.ELLIPSIS;
    }
}
