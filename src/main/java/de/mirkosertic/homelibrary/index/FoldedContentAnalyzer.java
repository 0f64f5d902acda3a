package de.mirkosertic.homelibrary.index;

import de.mirkosertic.homelibrary.search.IndexedContentBuilder;
import de.mirkosertic.homelibrary.search.SearchQueryBuilder;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Analyzer for the indexed content field.
 *
 * <p>Content and queries arrive already folded by {@link IndexedContentBuilder} and
 * {@link SearchQueryBuilder}, so this analyzer only splits words and lowercases them. It
 * does no Unicode folding of its own: both sides of a match go through the same fold, and
 * that fold lives outside the index.</p>
 *
 * <p>Prefix terms are split into words by this analyzer, see {@link FoldedPrefixQueryParser}.
 * {@link #normalize(String, TokenStream)} lowercases the remaining multi-term queries of the
 * query syntax, such as wildcard and fuzzy terms.</p>
 */
public class FoldedContentAnalyzer extends Analyzer {

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        final TokenStream stream = new LowerCaseFilter(tokenizer);
        return new TokenStreamComponents(tokenizer, stream);
    }

    @Override
    protected TokenStream normalize(final String fieldName, final TokenStream in) {
        return new LowerCaseFilter(in);
    }
}
