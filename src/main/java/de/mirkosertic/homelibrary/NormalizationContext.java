package de.mirkosertic.homelibrary;

import com.ibm.icu.util.ULocale;
import de.mirkosertic.homelibrary.config.ApplicationConfig;
import de.mirkosertic.homelibrary.normalize.CodepointFoldingTable;
import de.mirkosertic.homelibrary.normalize.FoldingCacheStats;
import de.mirkosertic.homelibrary.normalize.TextFolder;
import de.mirkosertic.homelibrary.search.IndexedContentBuilder;
import de.mirkosertic.homelibrary.search.SearchQueryBuilder;
import de.mirkosertic.homelibrary.sort.CollationComparator;
import de.mirkosertic.homelibrary.sort.RowSorter;

/**
 * Owns the folding cache and the collation locale, and the builders that depend on them.
 *
 * <p>Created once at startup and handed to whoever needs to fold, build queries or sort.
 * Index population and query construction must share one instance so both sides fold the
 * same way.</p>
 */
public final class NormalizationContext {

    private final CodepointFoldingTable foldingTable;
    private final TextFolder textFolder;
    private final IndexedContentBuilder indexedContentBuilder;
    private final SearchQueryBuilder searchQueryBuilder;
    private final CollationComparator collationComparator;
    private final RowSorter rowSorter;

    public NormalizationContext(final CodepointFoldingTable foldingTable,
                                final CollationComparator collationComparator) {
        this.foldingTable = foldingTable;
        this.textFolder = new TextFolder(foldingTable);
        this.indexedContentBuilder = new IndexedContentBuilder(textFolder);
        this.searchQueryBuilder = new SearchQueryBuilder(textFolder);
        this.collationComparator = collationComparator;
        this.rowSorter = new RowSorter(collationComparator);
    }

    public static NormalizationContext create(final ApplicationConfig config) {
        final CodepointFoldingTable foldingTable =
                new CodepointFoldingTable(config.isFoldingCacheEnabled(), new FoldingCacheStats());
        final CollationComparator collation = new CollationComparator(
                new ULocale(config.getCollationLocale()),
                CollationComparator.parseStrength(config.getCollationStrength()));
        return new NormalizationContext(foldingTable, collation);
    }

    public CodepointFoldingTable getFoldingTable() {
        return foldingTable;
    }

    public TextFolder getTextFolder() {
        return textFolder;
    }

    public IndexedContentBuilder getIndexedContentBuilder() {
        return indexedContentBuilder;
    }

    public SearchQueryBuilder getSearchQueryBuilder() {
        return searchQueryBuilder;
    }

    public CollationComparator getCollationComparator() {
        return collationComparator;
    }

    public RowSorter getRowSorter() {
        return rowSorter;
    }
}
