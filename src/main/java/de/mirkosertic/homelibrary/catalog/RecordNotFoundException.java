package de.mirkosertic.homelibrary.catalog;

/**
 * Thrown when an operation addresses a record id that is not in the catalog.
 */
public class RecordNotFoundException extends RuntimeException {

    private final long id;

    public RecordNotFoundException(final long id) {
        super("No book with id " + id);
        this.id = id;
    }

    public long getId() {
        return id;
    }
}
