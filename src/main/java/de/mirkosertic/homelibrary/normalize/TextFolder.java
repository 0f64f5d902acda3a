package de.mirkosertic.homelibrary.normalize;

import org.jspecify.annotations.Nullable;

/**
 * Folds whole strings through a {@link CodepointFoldingTable}.
 *
 * <p>Each codepoint is replaced by its fold, in order. Whitespace is kept exactly as it
 * is; collapsing it is up to the caller.</p>
 */
public class TextFolder {

    private final CodepointFoldingTable foldingTable;

    public TextFolder(final CodepointFoldingTable foldingTable) {
        this.foldingTable = foldingTable;
    }

    /**
     * @param text the text to fold (may be null)
     * @return the folded text, or null if the input was null
     */
    public @Nullable String foldText(final @Nullable String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        final StringBuilder folded = new StringBuilder(text.length());
        text.codePoints().forEach(codepoint -> folded.append(foldingTable.fold(codepoint)));
        return folded.toString();
    }

    public CodepointFoldingTable getFoldingTable() {
        return foldingTable;
    }
}
