package de.mirkosertic.homelibrary.sort;

import de.mirkosertic.homelibrary.catalog.Column;

/**
 * Which column the result table is sorted by, and in which direction.
 *
 * <p>Immutable: a header click produces the next state through {@link #clicked(Column)}.</p>
 */
public record SortState(Column column, boolean descending) {

    /**
     * Author, ascending.
     */
    public static SortState initial() {
        return new SortState(Column.AUTHOR, false);
    }

    /**
     * Clicking the sorted column again flips the direction; clicking another column sorts
     * that column ascending.
     */
    public SortState clicked(final Column clickedColumn) {
        if (clickedColumn == column) {
            return new SortState(column, !descending);
        }
        return new SortState(clickedColumn, false);
    }
}
