package de.mirkosertic.homelibrary.search;

import de.mirkosertic.homelibrary.normalize.TextFolder;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns the text of the search box into a prefix-match expression for the catalog index.
 *
 * <p>The input is split on whitespace, every token gets a trailing {@value #PREFIX_WILDCARD}
 * and the tokens are joined with single spaces. The joined expression is then folded with the
 * same {@link TextFolder} that built the indexed content. Folding happens after the wildcard
 * is appended, so the wildcard itself is never subject to folding.</p>
 *
 * <pre>
 * "Jane  Doe"   →  "Jane* Doe*"
 * "Żeromski"    →  "Zeromski*"
 * "" or "   "   →  ""   (the index treats this as "match every record")
 * </pre>
 */
public class SearchQueryBuilder {

    public static final String PREFIX_WILDCARD = "*";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final TextFolder textFolder;

    public SearchQueryBuilder(final TextFolder textFolder) {
        this.textFolder = textFolder;
    }

    /**
     * @param raw the search box text; null is treated as empty
     * @return the folded prefix-match expression, empty if there are no tokens
     */
    public String buildQuery(final @Nullable String raw) {
        if (raw == null) {
            return "";
        }
        final String expression = Arrays.stream(WHITESPACE.split(raw))
                .filter(token -> !token.isEmpty())
                .map(token -> token + PREFIX_WILDCARD)
                .collect(Collectors.joining(" "));
        return Objects.requireNonNull(textFolder.foldText(expression));
    }
}
