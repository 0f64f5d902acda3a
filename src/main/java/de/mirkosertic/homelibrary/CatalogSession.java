package de.mirkosertic.homelibrary;

import de.mirkosertic.homelibrary.catalog.BookRecord;
import de.mirkosertic.homelibrary.catalog.Column;
import de.mirkosertic.homelibrary.index.CatalogIndexService;
import de.mirkosertic.homelibrary.search.SearchBox;
import de.mirkosertic.homelibrary.sort.RowSorter;
import de.mirkosertic.homelibrary.sort.SortState;
import org.apache.lucene.queryparser.classic.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * State of one interactive catalog session: the search box text, the rows it found and how
 * they are sorted.
 *
 * <p>Searches only run when the search text changed. Every write invalidates the search memo
 * and re-runs the current search, so the table always reflects the catalog. A write is never
 * reported as failed because that re-run failed: the rows are cleared instead, and the next
 * search for the same text reports the error. Rows are kept in the current {@link SortState}.</p>
 */
public class CatalogSession {

    private static final Logger logger = LoggerFactory.getLogger(CatalogSession.class);

    private final CatalogIndexService indexService;
    private final RowSorter rowSorter;
    private final SearchBox searchBox;

    private String searchText = "";
    private SortState sortState = SortState.initial();
    private List<BookRecord> rows = List.of();

    public CatalogSession(final CatalogIndexService indexService, final NormalizationContext context) {
        this.indexService = indexService;
        this.rowSorter = context.getRowSorter();
        this.searchBox = new SearchBox(context.getSearchQueryBuilder());
    }

    /**
     * Updates the search text and, if it changed, runs the search.
     *
     * @return true if the search ran, false if the text was unchanged
     * @throws ParseException if the index rejects the query built from the text
     */
    public boolean search(final String text) throws IOException, ParseException {
        searchText = text;
        final Optional<String> query = searchBox.refresh(text);
        if (query.isEmpty()) {
            return false;
        }
        try {
            rows = rowSorter.sortRows(indexService.search(query.get()), sortState);
        } catch (final IOException | ParseException e) {
            // forget the text, so searching it again reports the failure again
            searchBox.invalidate();
            throw e;
        }
        logger.debug("Search '{}' found {} book(s)", text, rows.size());
        return true;
    }

    /**
     * A click on a column header: sorts by that column, flipping the direction when it is
     * already the sorted column.
     */
    public List<BookRecord> sortBy(final Column column) {
        sortState = sortState.clicked(column);
        rows = rowSorter.sortRows(rows, sortState);
        return rows;
    }

    public BookRecord insert(final BookRecord record) throws IOException {
        final BookRecord stored = indexService.insert(record);
        refresh();
        return stored;
    }

    public BookRecord update(final BookRecord record) throws IOException {
        final BookRecord stored = indexService.update(record);
        refresh();
        return stored;
    }

    public void delete(final long id) throws IOException {
        indexService.delete(id);
        refresh();
    }

    public Optional<BookRecord> find(final long id) throws IOException {
        return indexService.get(id);
    }

    /**
     * Values to pre-fill a new record with: a copy of the given record without its id, so
     * similar books (another volume, another edition) are quick to add.
     */
    public Optional<BookRecord> templateForInsert(final long selectedId) throws IOException {
        return indexService.get(selectedId).map(record -> record.withId(BookRecord.UNASSIGNED_ID));
    }

    /**
     * Window title, e.g. "Home Library: 1 book" or "Home Library: 12 books".
     */
    public String title() throws IOException {
        final long count = indexService.getDocumentCount();
        return "Home Library: " + count + " book" + (count == 1 ? "" : "s");
    }

    public List<BookRecord> getRows() {
        return rows;
    }

    public SortState getSortState() {
        return sortState;
    }

    public String getSearchText() {
        return searchText;
    }

    private void refresh() throws IOException {
        searchBox.invalidate();
        try {
            search(searchText);
        } catch (final ParseException e) {
            logger.warn("Search '{}' could not be re-run after a write: {}", searchText, e.getMessage());
            rows = List.of();
        }
    }
}
