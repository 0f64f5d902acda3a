package de.mirkosertic.homelibrary.sort;

import com.ibm.icu.util.ULocale;
import de.mirkosertic.homelibrary.catalog.BookRecord;
import de.mirkosertic.homelibrary.catalog.Column;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Row sorter")
class RowSorterTest {

    private record Row(String key, int seq) {
    }

    private final RowSorter sorter = new RowSorter(new CollationComparator(new ULocale("pl_PL")));

    @Test
    @DisplayName("Rows with equal keys keep their relative order")
    void stableAscending() {
        final List<Row> rows = List.of(new Row("B", 1), new Row("A", 2), new Row("B", 3));

        assertThat(sorter.sortRows(rows, Row::key, false))
                .containsExactly(new Row("A", 2), new Row("B", 1), new Row("B", 3));
    }

    @Test
    @DisplayName("Rows with equal keys keep their relative order when descending")
    void stableDescending() {
        final List<Row> rows = List.of(new Row("B", 1), new Row("A", 2), new Row("B", 3), new Row("A", 4));

        assertThat(sorter.sortRows(rows, Row::key, true))
                .containsExactly(new Row("B", 1), new Row("B", 3), new Row("A", 2), new Row("A", 4));
    }

    @Test
    @DisplayName("Descending is the exact reverse of ascending when there are no ties")
    void toggleReverses() {
        final List<Row> rows = List.of(new Row("Żeromski", 1), new Row("Lem", 2), new Row("Łysiak", 3),
                new Row("Andrzejewski", 4), new Row("Mickiewicz", 5));

        final List<Row> ascending = sorter.sortRows(rows, Row::key, false);
        final List<Row> descending = sorter.sortRows(ascending, Row::key, true);

        final List<Row> reversed = new ArrayList<>(ascending);
        Collections.reverse(reversed);
        assertThat(descending).isEqualTo(reversed);
        assertThat(ascending).extracting(Row::key)
                .containsExactly("Andrzejewski", "Lem", "Łysiak", "Mickiewicz", "Żeromski");
    }

    @Test
    @DisplayName("Null keys sort like the empty string")
    void nullKeys() {
        final List<Row> rows = List.of(new Row("b", 1), new Row(null, 2), new Row("a", 3));

        assertThat(sorter.sortRows(rows, Row::key, false)).extracting(Row::seq).containsExactly(2, 3, 1);
    }

    @Test
    @DisplayName("Should not modify the input list")
    void returnsCopy() {
        final List<Row> rows = new ArrayList<>(List.of(new Row("b", 1), new Row("a", 2)));

        sorter.sortRows(rows, Row::key, false);

        assertThat(rows).extracting(Row::seq).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Should sort records by the column of the sort state")
    void sortsBySortState() {
        final BookRecord lem = new BookRecord(1, "B2", "Lem", "Solaris", null, null, null);
        final BookRecord prus = new BookRecord(2, "A1", "Prus", "Lalka", null, null, null);
        final BookRecord orzeszkowa = new BookRecord(3, "C3", "Orzeszkowa", "Nad Niemnem", null, null, null);
        final List<BookRecord> rows = List.of(lem, prus, orzeszkowa);

        assertThat(sorter.sortRows(rows, SortState.initial())).containsExactly(lem, orzeszkowa, prus);
        assertThat(sorter.sortRows(rows, new SortState(Column.SHELF, false))).containsExactly(prus, lem, orzeszkowa);
        assertThat(sorter.sortRows(rows, new SortState(Column.TITLE, true))).containsExactly(lem, orzeszkowa, prus);
    }
}
