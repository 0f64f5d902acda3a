package de.mirkosertic.homelibrary.catalog;

import de.mirkosertic.homelibrary.util.TextCleaner;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One book in the catalog.
 *
 * <p>Absent values are stored as empty strings. {@link #UNASSIGNED_ID} marks a record that
 * has not been inserted yet.</p>
 */
public record BookRecord(
        long id,
        String shelf,
        String author,
        String title,
        String translator,
        String originalTitle,
        String borrowed
) {

    public static final long UNASSIGNED_ID = -1L;

    /**
     * Columns a record cannot be stored without.
     */
    public static final List<Column> REQUIRED_COLUMNS = List.of(Column.SHELF, Column.AUTHOR, Column.TITLE);

    public BookRecord(final long id,
                      final @Nullable String shelf,
                      final @Nullable String author,
                      final @Nullable String title,
                      final @Nullable String translator,
                      final @Nullable String originalTitle,
                      final @Nullable String borrowed) {
        this.id = id;
        this.shelf = emptyIfNull(shelf);
        this.author = emptyIfNull(author);
        this.title = emptyIfNull(title);
        this.translator = emptyIfNull(translator);
        this.originalTitle = emptyIfNull(originalTitle);
        this.borrowed = emptyIfNull(borrowed);
    }

    /**
     * Creates a record from column values; columns missing from the map are empty.
     */
    public static BookRecord of(final long id, final Map<Column, String> values) {
        return new BookRecord(id,
                values.get(Column.SHELF),
                values.get(Column.AUTHOR),
                values.get(Column.TITLE),
                values.get(Column.TRANSLATOR),
                values.get(Column.ORIGINAL_TITLE),
                values.get(Column.BORROWED));
    }

    /**
     * The fields that make up the search index content, in index order:
     * author, title, translator, original title.
     */
    public List<String> searchableFields() {
        return List.of(author, title, translator, originalTitle);
    }

    /**
     * The editable column values of this record.
     */
    public Map<Column, String> values() {
        final Map<Column, String> values = new EnumMap<>(Column.class);
        for (final Column column : Column.values()) {
            if (column != Column.ID) {
                values.put(column, column.extract(this));
            }
        }
        return values;
    }

    /**
     * Returns a copy with the given column values replaced.
     */
    public BookRecord with(final Map<Column, String> changes) {
        final Map<Column, String> merged = values();
        merged.putAll(changes);
        return of(id, merged);
    }

    public BookRecord withId(final long newId) {
        return new BookRecord(newId, shelf, author, title, translator, originalTitle, borrowed);
    }

    /**
     * Returns a copy with every value whitespace-normalized: runs of whitespace become a
     * single space and the ends are trimmed.
     */
    public BookRecord cleaned() {
        return new BookRecord(id,
                TextCleaner.clean(shelf),
                TextCleaner.clean(author),
                TextCleaner.clean(title),
                TextCleaner.clean(translator),
                TextCleaner.clean(originalTitle),
                TextCleaner.clean(borrowed));
    }

    public List<Column> missingRequiredColumns() {
        final List<Column> missing = new ArrayList<>();
        for (final Column column : REQUIRED_COLUMNS) {
            if (column.extract(this).isEmpty()) {
                missing.add(column);
            }
        }
        return missing;
    }

    private static String emptyIfNull(final @Nullable String value) {
        return value == null ? "" : value;
    }
}
