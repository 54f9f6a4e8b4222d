package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.store.ContentStore;
import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.Optional;

/**
 * Attaches an approximate timestamp to snippets of transcript and OCR fields by looking up the timeline
 * entry that contains the beginning of the snippet.
 */
public class TimelineResolver {

    private static final Logger logger = LoggerFactory.getLogger(TimelineResolver.class);

    private final ContentStore contentStore;
    private final int probeChars;
    private final double windowSeconds;

    public TimelineResolver(final ContentStore contentStore, final int probeChars, final double windowSeconds) {
        this.contentStore = contentStore;
        this.probeChars = probeChars;
        this.windowSeconds = windowSeconds;
    }

    public Optional<TimeRange> resolve(final long documentId, final FieldKind kind, final String snippet) {
        if (!kind.isTimeBearing()) {
            return Optional.empty();
        }
        final String probe = probe(snippet);
        if (probe.isEmpty()) {
            return Optional.empty();
        }
        try {
            return contentStore.findTimelineTimestamp(documentId, kind, probe)
                    .map(start -> new TimeRange(start, start + windowSeconds));
        } catch (final DataAccessException e) {
            logger.warn("Timeline lookup failed for document {}: {}", documentId, e.getMessage());
            return Optional.empty();
        }
    }

    String probe(final String snippet) {
        String text = snippet.strip();
        if (text.startsWith(SnippetExtractor.ELLIPSIS)) {
            text = text.substring(SnippetExtractor.ELLIPSIS.length());
        }
        if (text.endsWith(SnippetExtractor.ELLIPSIS)) {
            text = text.substring(0, text.length() - SnippetExtractor.ELLIPSIS.length());
        }
        text = text.strip();
        if (text.length() <= probeChars) {
            return text;
        }
        int end = probeChars;
        if (Character.isLowSurrogate(text.charAt(end))) {
            end--;
        }
        return text.substring(0, end);
    }
}
