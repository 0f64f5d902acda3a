package de.mirkosertic.homelibrary;

import com.ibm.icu.util.ULocale;
import de.mirkosertic.homelibrary.catalog.BookRecord;
import de.mirkosertic.homelibrary.catalog.Column;
import de.mirkosertic.homelibrary.index.BookDocumentMapper;
import de.mirkosertic.homelibrary.index.CatalogIndexService;
import de.mirkosertic.homelibrary.normalize.CodepointFoldingTable;
import de.mirkosertic.homelibrary.sort.CollationComparator;
import de.mirkosertic.homelibrary.sort.SortState;
import org.apache.lucene.queryparser.classic.ParseException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Catalog session")
class CatalogSessionTest {

    @TempDir
    Path tempDir;

    private NormalizationContext context;
    private CatalogIndexService indexService;
    private CatalogSession session;

    @BeforeEach
    void setUp() throws IOException {
        context = new NormalizationContext(new CodepointFoldingTable(), new CollationComparator(new ULocale("pl_PL")));
        indexService = new CatalogIndexService(tempDir.resolve("index").toString(),
                new BookDocumentMapper(context.getIndexedContentBuilder()));
        indexService.init();
        session = new CatalogSession(indexService, context);
    }

    @AfterEach
    void tearDown() throws IOException {
        indexService.close();
    }

    @Test
    @DisplayName("Unchanged search text does not search again")
    void searchIsMemoized() throws IOException, ParseException {
        final CatalogIndexService mockedIndex = mock(CatalogIndexService.class);
        when(mockedIndex.search(anyString())).thenReturn(List.of());
        final CatalogSession mockedSession = new CatalogSession(mockedIndex, context);

        assertThat(mockedSession.search("Żer")).isTrue();
        assertThat(mockedSession.search("Żer")).isFalse();
        assertThat(mockedSession.search("Żero")).isTrue();

        verify(mockedIndex, times(1)).search("Zer*");
        verify(mockedIndex, times(1)).search("Zero*");
    }

    @Test
    @DisplayName("A failed search is not remembered, so repeating it fails again")
    void failedSearchIsRepeated() throws IOException, ParseException {
        final CatalogIndexService mockedIndex = mock(CatalogIndexService.class);
        when(mockedIndex.search("(lem*")).thenThrow(new ParseException("Encountered <EOF>"));
        final CatalogSession mockedSession = new CatalogSession(mockedIndex, context);

        assertThatThrownBy(() -> mockedSession.search("(lem")).isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> mockedSession.search("(lem")).isInstanceOf(ParseException.class);

        verify(mockedIndex, times(2)).search("(lem*");
    }

    @Test
    @DisplayName("A write is kept and reported even when the current search cannot be re-run")
    void writeSurvivesFailingRefresh() throws IOException, ParseException {
        session.insert(book("A1", "Prus", "Lalka"));
        session.search("");
        assertThat(session.getRows()).hasSize(1);

        assertThatThrownBy(() -> session.search("(lem")).isInstanceOf(ParseException.class);

        final BookRecord solaris = session.insert(book("A2", "Lem", "Solaris"));

        assertThat(solaris.id()).isEqualTo(2);
        assertThat(session.find(solaris.id())).contains(solaris);
        assertThat(session.getRows()).isEmpty();
        assertThat(session.title()).isEqualTo("Home Library: 2 books");
        assertThatThrownBy(() -> session.search("(lem")).isInstanceOf(ParseException.class);

        session.search("lem");
        assertThat(session.getRows()).containsExactly(solaris);
    }

    @Test
    @DisplayName("Rows are sorted by author, and the same column click reverses them")
    void sortToggle() throws IOException, ParseException {
        session.insert(book("A1", "Żeromski", "Przedwiośnie"));
        session.insert(book("A2", "Lem", "Solaris"));
        session.insert(book("A3", "Łysiak", "Flet z mandragory"));
        session.search("");

        assertThat(session.getRows()).extracting(BookRecord::author).containsExactly("Lem", "Łysiak", "Żeromski");

        session.sortBy(Column.AUTHOR);
        assertThat(session.getSortState()).isEqualTo(new SortState(Column.AUTHOR, true));
        assertThat(session.getRows()).extracting(BookRecord::author).containsExactly("Żeromski", "Łysiak", "Lem");

        session.sortBy(Column.SHELF);
        assertThat(session.getRows()).extracting(BookRecord::shelf).containsExactly("A1", "A2", "A3");
    }

    @Test
    @DisplayName("Writes refresh the rows of the current search")
    void writesRefreshRows() throws IOException, ParseException {
        session.search("lem");
        assertThat(session.getRows()).isEmpty();

        final BookRecord solaris = session.insert(book("A1", "Lem", "Solaris"));
        assertThat(session.getRows()).containsExactly(solaris);

        final BookRecord eden = session.update(solaris.with(Map.of(Column.TITLE, "Eden")));
        assertThat(session.getRows()).containsExactly(eden);

        session.insert(book("A2", "Prus", "Lalka"));
        assertThat(session.getRows()).containsExactly(eden);

        session.delete(eden.id());
        assertThat(session.getRows()).isEmpty();
        assertThat(session.getSearchText()).isEqualTo("lem");
    }

    @Test
    @DisplayName("Insert template copies the selected record without its id")
    void templateForInsert() throws IOException, ParseException {
        final BookRecord solaris = session.insert(book("A1", "Lem", "Solaris"));

        assertThat(session.templateForInsert(solaris.id()))
                .contains(new BookRecord(BookRecord.UNASSIGNED_ID, "A1", "Lem", "Solaris", "", "", ""));
        assertThat(session.templateForInsert(99)).isEmpty();
        assertThat(session.find(solaris.id())).contains(solaris);
    }

    @Test
    @DisplayName("Title shows the number of books")
    void title() throws IOException, ParseException {
        assertThat(session.title()).isEqualTo("Home Library: 0 books");

        session.insert(book("A1", "Lem", "Solaris"));
        assertThat(session.title()).isEqualTo("Home Library: 1 book");

        session.insert(book("A2", "Prus", "Lalka"));
        assertThat(session.title()).isEqualTo("Home Library: 2 books");
    }

    private static BookRecord book(final String shelf, final String author, final String title) {
        return new BookRecord(BookRecord.UNASSIGNED_ID, shelf, author, title, "", "", "");
    }
}
