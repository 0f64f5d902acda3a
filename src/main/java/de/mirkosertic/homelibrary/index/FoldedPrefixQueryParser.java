package de.mirkosertic.homelibrary.index;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * A {@link QueryParser} whose prefix terms are split into words the same way the indexed
 * content is.
 *
 * <p>The classic parser treats {@code -}, {@code ,} and {@code .} as term characters, so
 * {@code boy-zelenski*} would stay one prefix term while the content analyzer indexed
 * {@code boy} and {@code zelenski}. Here the prefix text runs through the analyzer first:</p>
 * <pre>
 * boy-zelenski*  →  +boy +zelenski*
 * tadeusz,*      →  tadeusz*
 * ,*             →  (no condition)
 * </pre>
 * Every word but the last has to match exactly, the last one as a prefix. AND is the default
 * operator.
 */
public class FoldedPrefixQueryParser extends QueryParser {

    public FoldedPrefixQueryParser(final String field, final Analyzer analyzer) {
        super(field, analyzer);
        setDefaultOperator(Operator.AND);
    }

    /**
     * @return the prefix query for the analyzed words, or null if the text holds no word at all;
     * the parser leaves null clauses out of the query
     */
    @Override
    protected @Nullable Query getPrefixQuery(final String field, final String termStr) throws ParseException {
        final List<String> words = analyzeWords(field, termStr);
        if (words.isEmpty()) {
            return null;
        }
        final Query prefix = newPrefixQuery(new Term(field, words.get(words.size() - 1)));
        if (words.size() == 1) {
            return prefix;
        }
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (final String word : words.subList(0, words.size() - 1)) {
            builder.add(new TermQuery(new Term(field, word)), BooleanClause.Occur.MUST);
        }
        builder.add(prefix, BooleanClause.Occur.MUST);
        return builder.build();
    }

    private List<String> analyzeWords(final String field, final String text) throws ParseException {
        final List<String> words = new ArrayList<>();
        try (final TokenStream stream = getAnalyzer().tokenStream(field, text)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                words.add(term.toString());
            }
            stream.end();
        } catch (final IOException e) {
            throw new ParseException("Cannot split '" + text + "' into words: " + e.getMessage());
        }
        return words;
    }
}
