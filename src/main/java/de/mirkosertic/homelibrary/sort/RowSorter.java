package de.mirkosertic.homelibrary.sort;

import de.mirkosertic.homelibrary.catalog.BookRecord;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Stable, collation-aware sorting of table rows.
 *
 * <p>Rows that compare equal keep their relative order in both directions, so flipping the
 * direction of a column never shuffles its ties.</p>
 */
public class RowSorter {

    private final Comparator<@Nullable String> collation;

    public RowSorter(final Comparator<@Nullable String> collation) {
        this.collation = collation;
    }

    /**
     * Returns a sorted copy of {@code rows}.
     *
     * @param rows           the rows in their current order
     * @param columnSelector extracts the sort key from a row; null keys sort like ""
     * @param descending     true for descending order
     */
    public <T> List<T> sortRows(final List<T> rows,
                                final Function<? super T, @Nullable String> columnSelector,
                                final boolean descending) {
        Comparator<T> order = Comparator.comparing(columnSelector::apply, collation);
        if (descending) {
            order = order.reversed();
        }
        final List<T> sorted = new ArrayList<>(rows);
        // List.sort is a stable merge sort
        sorted.sort(order);
        return sorted;
    }

    public List<BookRecord> sortRows(final List<BookRecord> rows, final SortState state) {
        return sortRows(rows, state.column()::extract, state.descending());
    }
}
