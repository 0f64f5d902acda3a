package de.mirkosertic.homelibrary.util;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Cleans values typed into record fields before they are stored.
 *
 * <p>Removes characters that only ever get into a field by accident:</p>
 * <ul>
 *   <li>U+0000-U+001F control characters other than whitespace</li>
 *   <li>U+200B-U+200D zero-width characters</li>
 *   <li>U+FEFF byte order mark</li>
 *   <li>U+FFFD replacement character</li>
 * </ul>
 * <p>and then turns every run of whitespace (tabs, line breaks and no-break spaces included)
 * into a single space and trims both ends.</p>
 */
public final class TextCleaner {

    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000-\u0008" +
        "\u000E-\u001F" +
        "\u200B-\u200D" +
        "\uFEFF" +
        "\uFFFD" +
        "]"
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextCleaner() {
        // Utility class, no instances
    }

    /**
     * @param text the field value (may be null)
     * @return the cleaned value, or null if the input was null
     */
    public static @Nullable String clean(final @Nullable String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        final String withoutInvalid = INVALID_CHARS.matcher(text).replaceAll("");
        return WHITESPACE_RUN.matcher(withoutInvalid).replaceAll(" ").trim();
    }
}
