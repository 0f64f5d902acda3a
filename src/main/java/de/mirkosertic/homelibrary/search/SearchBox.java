package de.mirkosertic.homelibrary.search;

import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Remembers the last search box text so the query is only rebuilt, and the search only
 * rerun, when the text actually changed.
 *
 * <p>Key presses that leave the text alone (modifier keys, cursor movement) therefore cost
 * nothing. After the catalog changes, {@link #invalidate()} forces the next refresh to
 * rebuild even for the same text.</p>
 */
public class SearchBox {

    private final SearchQueryBuilder queryBuilder;

    private @Nullable String lastRaw;
    private String lastQuery = "";

    public SearchBox(final SearchQueryBuilder queryBuilder) {
        this.queryBuilder = queryBuilder;
    }

    /**
     * @param raw the current search box text
     * @return the rebuilt query if the text changed since the last call, empty otherwise
     */
    public Optional<String> refresh(final String raw) {
        if (raw.equals(lastRaw)) {
            return Optional.empty();
        }
        lastRaw = raw;
        lastQuery = queryBuilder.buildQuery(raw);
        return Optional.of(lastQuery);
    }

    public void invalidate() {
        lastRaw = null;
    }

    public String getLastQuery() {
        return lastQuery;
    }
}
