package de.mirkosertic.homelibrary.search;

import de.mirkosertic.homelibrary.catalog.BookRecord;
import de.mirkosertic.homelibrary.normalize.TextFolder;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the folded text blob that the full-text index stores for a record.
 *
 * <p>Empty and absent fields are dropped, the rest are joined with single spaces and the
 * joined text is folded. Queries are folded by the same {@link TextFolder}
 * ({@link SearchQueryBuilder}), so indexed content and query terms always agree.</p>
 */
public class IndexedContentBuilder {

    private final TextFolder textFolder;

    public IndexedContentBuilder(final TextFolder textFolder) {
        this.textFolder = textFolder;
    }

    public String buildIndexedContent(final List<@Nullable String> fields) {
        final String joined = fields.stream()
                .filter(Objects::nonNull)
                .filter(field -> !field.isEmpty())
                .collect(Collectors.joining(" "));
        return Objects.requireNonNull(textFolder.foldText(joined));
    }

    /**
     * Content for a catalog record: author, title, translator and original title, in that order.
     */
    public String buildIndexedContent(final BookRecord record) {
        return buildIndexedContent(record.searchableFields());
    }
}
