package de.mirkosertic.homelibrary.index;

import de.mirkosertic.homelibrary.catalog.BookRecord;
import de.mirkosertic.homelibrary.search.IndexedContentBuilder;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;

import java.io.IOException;

/**
 * Maps catalog records to Lucene documents and back, with one consistent field schema.
 *
 * <p>Each record becomes one document holding the record's values as stored fields and the
 * folded search blob in the analyzed {@value #FIELD_CONTENT} field.</p>
 */
public class BookDocumentMapper {

    /**
     * Schema version for the index.
     * MUST be incremented whenever the indexed content changes for the same record (fields
     * added/removed/reordered, folding rules changed, analyzer changed). An index written
     * with another version has its content rebuilt on startup.
     */
    public static final int SCHEMA_VERSION = 1;

    public static final String FIELD_ID = "id";
    public static final String FIELD_ID_ORDER = "id_order";
    public static final String FIELD_SHELF = "shelf";
    public static final String FIELD_AUTHOR = "author";
    public static final String FIELD_TITLE = "title";
    public static final String FIELD_TRANSLATOR = "translator";
    public static final String FIELD_ORIGINAL_TITLE = "original_title";
    public static final String FIELD_BORROWED = "borrowed";
    public static final String FIELD_CONTENT = "content";

    private final IndexedContentBuilder contentBuilder;

    public BookDocumentMapper(final IndexedContentBuilder contentBuilder) {
        this.contentBuilder = contentBuilder;
    }

    public Document createDocument(final BookRecord record) {
        final Document doc = new Document();

        // id - unique key (not analyzed, stored) plus doc values for ordering by id
        doc.add(new StringField(FIELD_ID, Long.toString(record.id()), Field.Store.YES));
        doc.add(new NumericDocValuesField(FIELD_ID_ORDER, record.id()));

        doc.add(new StoredField(FIELD_SHELF, record.shelf()));
        doc.add(new StoredField(FIELD_AUTHOR, record.author()));
        doc.add(new StoredField(FIELD_TITLE, record.title()));
        doc.add(new StoredField(FIELD_TRANSLATOR, record.translator()));
        doc.add(new StoredField(FIELD_ORIGINAL_TITLE, record.originalTitle()));
        doc.add(new StoredField(FIELD_BORROWED, record.borrowed()));

        // content (analyzed, not stored): folded author, title, translator, original title
        doc.add(new TextField(FIELD_CONTENT, contentBuilder.buildIndexedContent(record), Field.Store.NO));

        return doc;
    }

    public BookRecord toRecord(final Document doc) {
        return new BookRecord(
                Long.parseLong(doc.get(FIELD_ID)),
                doc.get(FIELD_SHELF),
                doc.get(FIELD_AUTHOR),
                doc.get(FIELD_TITLE),
                doc.get(FIELD_TRANSLATOR),
                doc.get(FIELD_ORIGINAL_TITLE),
                doc.get(FIELD_BORROWED));
    }

    /**
     * Inserts the record, or replaces the document with the same id.
     */
    public void indexRecord(final IndexWriter writer, final BookRecord record) throws IOException {
        writer.updateDocument(idTerm(record.id()), createDocument(record));
    }

    public void deleteRecord(final IndexWriter writer, final long id) throws IOException {
        writer.deleteDocuments(idTerm(id));
    }

    public static Term idTerm(final long id) {
        return new Term(FIELD_ID, Long.toString(id));
    }
}
