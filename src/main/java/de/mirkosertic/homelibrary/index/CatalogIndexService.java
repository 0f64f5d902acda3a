package de.mirkosertic.homelibrary.index;

import de.mirkosertic.homelibrary.catalog.BookRecord;
import de.mirkosertic.homelibrary.catalog.Column;
import de.mirkosertic.homelibrary.catalog.InvalidRecordException;
import de.mirkosertic.homelibrary.catalog.RecordNotFoundException;
import de.mirkosertic.homelibrary.config.ApplicationConfig;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The catalog's record store and full-text index, kept in a single Lucene index.
 *
 * <p>Every record is one document: the record values are stored fields, the folded search
 * blob is the analyzed {@code content} field. Writes are committed immediately and the
 * searcher is refreshed before the write returns, so the next search sees the change.</p>
 *
 * <p>Search expressions use the classic Lucene query syntax with AND as the default operator,
 * so {@code "lem* sol*"} finds records whose content has a word starting with "lem" and a word
 * starting with "sol". Prefix terms are split into words by the content analyzer, see
 * {@link FoldedPrefixQueryParser}. The empty expression, and one without any word characters,
 * matches every record. An expression the parser rejects fails with the parser's
 * {@link ParseException}.</p>
 */
public class CatalogIndexService {

    private static final Logger logger = LoggerFactory.getLogger(CatalogIndexService.class);

    public static final String SCHEMA_VERSION_KEY = "schema.version";

    private static final Sort BY_ID = new Sort(new SortField(BookDocumentMapper.FIELD_ID_ORDER, SortField.Type.LONG));
    private static final Sort BY_ID_DESCENDING =
            new Sort(new SortField(BookDocumentMapper.FIELD_ID_ORDER, SortField.Type.LONG, true));

    private final String indexPath;
    private final BookDocumentMapper documentMapper;
    private final FoldedContentAnalyzer analyzer;
    private final AtomicLong lastAssignedId = new AtomicLong(0);

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private boolean contentRebuilt;

    public CatalogIndexService(final ApplicationConfig config, final BookDocumentMapper documentMapper) {
        this(config.getIndexPath(), documentMapper);
    }

    public CatalogIndexService(final String indexPath, final BookDocumentMapper documentMapper) {
        this.indexPath = indexPath;
        this.documentMapper = documentMapper;
        this.analyzer = new FoldedContentAnalyzer();
    }

    /**
     * Open or create the index. Must be called before using the service.
     */
    public void init() throws IOException {
        final Path path = Path.of(indexPath);
        if (!Files.exists(path)) {
            Files.createDirectories(path);
            logger.info("Created index directory: {}", path.toAbsolutePath());
        }

        directory = FSDirectory.open(path);
        final String storedVersion = readSchemaVersion();

        final IndexWriterConfig config = new IndexWriterConfig(analyzer);
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        indexWriter = new IndexWriter(directory, config);
        searcherManager = new SearcherManager(indexWriter, null);

        lastAssignedId.set(findHighestId());

        if (!Integer.toString(BookDocumentMapper.SCHEMA_VERSION).equals(storedVersion)) {
            if (getDocumentCount() > 0) {
                logger.warn("Index schema version {} differs from {}, rebuilding search content",
                        storedVersion, BookDocumentMapper.SCHEMA_VERSION);
                final int rebuilt = rebuildContent();
                contentRebuilt = true;
                logger.info("Rebuilt search content of {} record(s)", rebuilt);
            }
            commit();
        }

        logger.info("Catalog index initialized at: {} ({} record(s), last id {})",
                path.toAbsolutePath(), getDocumentCount(), lastAssignedId.get());
    }

    /**
     * Close the index service and release all resources.
     */
    public void close() throws IOException {
        // Close SearcherManager before IndexWriter
        if (searcherManager != null) {
            searcherManager.close();
        }
        if (indexWriter != null) {
            indexWriter.close();
        }
        if (directory != null) {
            directory.close();
        }
        logger.info("Catalog index closed");
    }

    /**
     * Stores a new record under a freshly assigned id.
     *
     * @return the stored record: whitespace-normalized, carrying its new id
     * @throws InvalidRecordException if shelf, author or title is empty
     */
    public synchronized BookRecord insert(final BookRecord record) throws IOException {
        final BookRecord cleaned = validated(record);
        final BookRecord stored = cleaned.withId(lastAssignedId.incrementAndGet());
        documentMapper.indexRecord(indexWriter, stored);
        commit();
        logger.info("Inserted book {}: {} / {}", stored.id(), stored.author(), stored.title());
        return stored;
    }

    /**
     * Replaces the stored values and the search content of an existing record.
     *
     * @return the stored record
     * @throws RecordNotFoundException if no record has the record's id
     * @throws InvalidRecordException  if shelf, author or title is empty
     */
    public synchronized BookRecord update(final BookRecord record) throws IOException {
        requireExisting(record.id());
        final BookRecord stored = validated(record);
        documentMapper.indexRecord(indexWriter, stored);
        commit();
        logger.info("Updated book {}", stored.id());
        return stored;
    }

    /**
     * @throws RecordNotFoundException if no record has this id
     */
    public synchronized void delete(final long id) throws IOException {
        requireExisting(id);
        documentMapper.deleteRecord(indexWriter, id);
        commit();
        logger.info("Deleted book {}", id);
    }

    public Optional<BookRecord> get(final long id) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final TopDocs topDocs = searcher.search(new TermQuery(BookDocumentMapper.idTerm(id)), 1);
            if (topDocs.scoreDocs.length == 0) {
                return Optional.empty();
            }
            return Optional.of(documentMapper.toRecord(searcher.storedFields().document(topDocs.scoreDocs[0].doc)));
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Runs a prefix-match expression against the search content.
     *
     * @param expression an expression as built by the search query builder; empty matches all
     * @return every matching record, ordered by id
     * @throws ParseException if the expression is not valid query syntax
     */
    public List<BookRecord> search(final String expression) throws IOException, ParseException {
        Query query = new MatchAllDocsQuery();
        if (!expression.isBlank()) {
            final Query parsed = new FoldedPrefixQueryParser(BookDocumentMapper.FIELD_CONTENT, analyzer)
                    .parse(expression);
            if (!(parsed instanceof BooleanQuery) || !((BooleanQuery) parsed).clauses().isEmpty()) {
                query = parsed;
            }
        }
        logger.debug("Searching for '{}' as {}", expression, query);
        return collect(query);
    }

    public long getDocumentCount() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.getIndexReader().numDocs();
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Whether {@link #init()} had to rebuild the search content because the index was written
     * with another schema version.
     */
    public boolean isContentRebuilt() {
        return contentRebuilt;
    }

    public String getIndexPath() {
        return indexPath;
    }

    /**
     * Re-creates every document from its stored values, so the search content matches the
     * current folding rules.
     */
    private int rebuildContent() throws IOException {
        final List<BookRecord> records = collect(new MatchAllDocsQuery());
        for (final BookRecord record : records) {
            documentMapper.indexRecord(indexWriter, record);
        }
        return records.size();
    }

    private List<BookRecord> collect(final Query query) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final int limit = Math.max(1, searcher.getIndexReader().maxDoc());
            final TopDocs topDocs = searcher.search(query, limit, BY_ID);
            final List<BookRecord> records = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                records.add(documentMapper.toRecord(searcher.storedFields().document(scoreDoc.doc)));
            }
            return records;
        } finally {
            searcherManager.release(searcher);
        }
    }

    private long findHighestId() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final TopDocs topDocs = searcher.search(new MatchAllDocsQuery(), 1, BY_ID_DESCENDING);
            if (topDocs.scoreDocs.length == 0) {
                return 0;
            }
            return documentMapper.toRecord(searcher.storedFields().document(topDocs.scoreDocs[0].doc)).id();
        } finally {
            searcherManager.release(searcher);
        }
    }

    private @Nullable String readSchemaVersion() throws IOException {
        if (!DirectoryReader.indexExists(directory)) {
            return null;
        }
        return SegmentInfos.readLatestCommit(directory).getUserData().get(SCHEMA_VERSION_KEY);
    }

    private void commit() throws IOException {
        indexWriter.setLiveCommitData(
                Map.of(SCHEMA_VERSION_KEY, Integer.toString(BookDocumentMapper.SCHEMA_VERSION)).entrySet());
        indexWriter.commit();
        searcherManager.maybeRefreshBlocking();
    }

    private void requireExisting(final long id) throws IOException {
        if (get(id).isEmpty()) {
            throw new RecordNotFoundException(id);
        }
    }

    private static BookRecord validated(final BookRecord record) {
        final BookRecord cleaned = record.cleaned();
        final List<Column> missing = cleaned.missingRequiredColumns();
        if (!missing.isEmpty()) {
            throw new InvalidRecordException(missing);
        }
        return cleaned;
    }
}
