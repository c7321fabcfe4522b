package de.mirkosertic.mcp.blobsearch.index;

import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.FieldType;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.SortedDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.Term;
import org.apache.lucene.util.BytesRef;

import java.time.Instant;
import java.util.List;

/**
 * Maps {@link IndexRecord}s to Lucene documents and back, keeping the field schema in one place.
 */
public final class IndexRecordMapper {

    /**
     * Schema version for the index.
     * MUST be incremented whenever fields or analyzers change, existing indexes then need a full resync.
     */
    public static final int SCHEMA_VERSION = 2;

    public static final String FIELD_KEY = "key";
    public static final String FIELD_FILE_NAME = "file_name";
    public static final String FIELD_CONTENT = "content";
    public static final String FIELD_FILE_EXTENSION = "file_extension";
    public static final String FIELD_SIZE = "size";
    public static final String FIELD_MODIFIED_AT = "modified_at";
    public static final String FIELD_MODIFIED_AT_SORT = "modified_at_sort";
    public static final String FIELD_FINGERPRINT = "fingerprint";
    public static final String FIELD_URL = "url";
    public static final String FIELD_INDEXED_AT = "indexed_at";

    private static final FieldType CONTENT_FIELD_TYPE;

    static {
        // Offsets in term vectors let the UnifiedHighlighter locate matches without re-analysing the text
        CONTENT_FIELD_TYPE = new FieldType(TextField.TYPE_STORED);
        CONTENT_FIELD_TYPE.setStoreTermVectors(true);
        CONTENT_FIELD_TYPE.setStoreTermVectorPositions(true);
        CONTENT_FIELD_TYPE.setStoreTermVectorOffsets(true);
        CONTENT_FIELD_TYPE.freeze();
    }

    private IndexRecordMapper() {
    }

    public static Term keyTerm(final String key) {
        return new Term(FIELD_KEY, key);
    }

    public static Document toDocument(final IndexRecord record) {
        final Document doc = new Document();

        // key - unique ID (not analyzed, stored), doc values for sorted enumeration
        doc.add(new StringField(FIELD_KEY, record.key(), Field.Store.YES));
        doc.add(new SortedDocValuesField(FIELD_KEY, new BytesRef(record.key())));

        doc.add(new TextField(FIELD_FILE_NAME, record.fileName(), Field.Store.YES));
        doc.add(new Field(FIELD_CONTENT, record.extractedText(), CONTENT_FIELD_TYPE));

        if (!record.fileExtension().isEmpty()) {
            doc.add(new StringField(FIELD_FILE_EXTENSION, record.fileExtension(), Field.Store.YES));
        }

        doc.add(new LongPoint(FIELD_SIZE, record.size()));
        doc.add(new StoredField(FIELD_SIZE, record.size()));

        final long modifiedAt = record.modifiedAt().toEpochMilli();
        doc.add(new LongPoint(FIELD_MODIFIED_AT, modifiedAt));
        doc.add(new StoredField(FIELD_MODIFIED_AT, modifiedAt));
        // Own field name, doc values cannot be added to a field that existing segments index without them
        doc.add(new NumericDocValuesField(FIELD_MODIFIED_AT_SORT, modifiedAt));

        doc.add(new StringField(FIELD_FINGERPRINT, record.fingerprint(), Field.Store.YES));
        doc.add(new StoredField(FIELD_URL, record.url()));

        final long indexedAt = record.indexedAt().toEpochMilli();
        doc.add(new LongPoint(FIELD_INDEXED_AT, indexedAt));
        doc.add(new StoredField(FIELD_INDEXED_AT, indexedAt));

        return doc;
    }

    public static IndexRecord fromDocument(final Document doc) {
        return new IndexRecord(
                doc.get(FIELD_KEY),
                stringOrEmpty(doc, FIELD_FILE_NAME),
                stringOrEmpty(doc, FIELD_CONTENT),
                stringOrEmpty(doc, FIELD_FILE_EXTENSION),
                longOrZero(doc, FIELD_SIZE),
                Instant.ofEpochMilli(longOrZero(doc, FIELD_MODIFIED_AT)),
                stringOrEmpty(doc, FIELD_FINGERPRINT),
                stringOrEmpty(doc, FIELD_URL),
                Instant.ofEpochMilli(longOrZero(doc, FIELD_INDEXED_AT))
        );
    }

    /**
     * Builds a hit from stored fields. The URL and highlights are filled in by the caller.
     */
    static SearchHit toHit(final Document doc, final float score, final List<String> highlights,
                           final List<String> fileNameHighlights) {
        return new SearchHit(
                doc.get(FIELD_KEY),
                stringOrEmpty(doc, FIELD_FILE_NAME),
                stringOrEmpty(doc, FIELD_FILE_EXTENSION),
                longOrZero(doc, FIELD_SIZE),
                Instant.ofEpochMilli(longOrZero(doc, FIELD_MODIFIED_AT)),
                stringOrEmpty(doc, FIELD_URL),
                score,
                highlights,
                fileNameHighlights
        );
    }

    private static String stringOrEmpty(final Document doc, final String field) {
        final String value = doc.get(field);
        return value == null ? "" : value;
    }

    private static long longOrZero(final Document doc, final String field) {
        final IndexableField stored = doc.getField(field);
        if (stored == null || stored.numericValue() == null) {
            return 0L;
        }
        return stored.numericValue().longValue();
    }
}
