package de.mirkosertic.homelibrary.catalog;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * The columns of a catalog record, with their display labels.
 */
public enum Column {

    ID("ID", record -> record.id() == BookRecord.UNASSIGNED_ID ? "" : Long.toString(record.id())),
    SHELF("Shelf", BookRecord::shelf),
    AUTHOR("Author", BookRecord::author),
    TITLE("Title", BookRecord::title),
    TRANSLATOR("Translator", BookRecord::translator),
    ORIGINAL_TITLE("Original title", BookRecord::originalTitle),
    BORROWED("Borrowed", BookRecord::borrowed);

    /**
     * Columns shown in the result table, in display order.
     */
    public static final List<Column> DISPLAYED = List.of(ID, SHELF, AUTHOR, TITLE, BORROWED);

    private final String label;
    private final Function<BookRecord, String> extractor;

    Column(final String label, final Function<BookRecord, String> extractor) {
        this.label = label;
        this.extractor = extractor;
    }

    public String label() {
        return label;
    }

    public String extract(final BookRecord record) {
        return extractor.apply(record);
    }

    /**
     * Looks a column up by enum name or label, ignoring case; blanks, dashes and
     * underscores are interchangeable ("original title", "original-title", "ORIGINAL_TITLE").
     */
    public static Optional<Column> fromName(final String name) {
        final String key = name.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
        for (final Column column : values()) {
            if (column.name().equals(key)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }
}
