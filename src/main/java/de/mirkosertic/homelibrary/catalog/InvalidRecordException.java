package de.mirkosertic.homelibrary.catalog;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a record lacks a value the catalog requires.
 */
public class InvalidRecordException extends RuntimeException {

    private final List<Column> missingColumns;

    public InvalidRecordException(final List<Column> missingColumns) {
        super("Missing required value(s): " + missingColumns.stream()
                .map(Column::label)
                .collect(Collectors.joining(", ")));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<Column> getMissingColumns() {
        return missingColumns;
    }
}
