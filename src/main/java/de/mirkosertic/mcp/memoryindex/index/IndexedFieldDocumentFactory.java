package de.mirkosertic.mcp.memoryindex.index;

import de.mirkosertic.mcp.memoryindex.store.ContentStore;
import de.mirkosertic.mcp.memoryindex.store.FieldKind;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;

/**
 * Creates Lucene documents for indexed field rows with a consistent field schema across both backends.
 */
public final class IndexedFieldDocumentFactory {

    /**
     * Schema version of both indexes.
     * MUST be incremented whenever fields, analyzers or the field key format change.
     * Version 1: content, content_stemmed (English Snowball), field_key, document_id, field_kind.
     */
    public static final int SCHEMA_VERSION = 1;

    public static final String FIELD_KEY = "field_key";
    public static final String DOCUMENT_ID = "document_id";
    public static final String FIELD_KIND = "field_kind";
    public static final String CONTENT = "content";
    public static final String CONTENT_STEMMED = "content_stemmed";

    private IndexedFieldDocumentFactory() {
    }

    /**
     * Unique key of a field row. Identical text for the same document and kind yields the same key,
     * which makes re-indexing idempotent.
     */
    public static String fieldKey(final long documentId, final FieldKind kind, final String text) {
        return documentId + ":" + kind.code() + ":" + ContentStore.contentHash(text);
    }

    public static Document createExactDocument(final long documentId, final FieldKind kind, final String text) {
        final Document doc = createBaseDocument(documentId, kind, text);
        // content_stemmed (analyzed with EnglishStemmingAnalyzer via PerFieldAnalyzerWrapper, not stored)
        doc.add(new TextField(CONTENT_STEMMED, text, Field.Store.NO));
        return doc;
    }

    public static Document createSegmentedDocument(final long documentId, final FieldKind kind, final String text) {
        return createBaseDocument(documentId, kind, text);
    }

    private static Document createBaseDocument(final long documentId, final FieldKind kind, final String text) {
        final Document doc = new Document();
        doc.add(new StringField(FIELD_KEY, fieldKey(documentId, kind, text), Field.Store.YES));
        doc.add(new StringField(DOCUMENT_ID, String.valueOf(documentId), Field.Store.YES));
        doc.add(new StringField(FIELD_KIND, kind.code(), Field.Store.YES));
        doc.add(new TextField(CONTENT, text, Field.Store.YES));
        return doc;
    }

    /**
     * Reads a hit back from a stored Lucene document.
     */
    public static IndexHit toHit(final Document doc, final double rawRank) {
        return new IndexHit(
                Long.parseLong(doc.get(DOCUMENT_ID)),
                FieldKind.fromCode(doc.get(FIELD_KIND)),
                rawRank,
                doc.get(CONTENT),
                doc.get(FIELD_KEY));
    }
}
