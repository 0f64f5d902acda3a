package de.mirkosertic.homelibrary.sort;

import com.ibm.icu.text.Collator;
import com.ibm.icu.util.ULocale;
import org.jspecify.annotations.Nullable;

import java.util.Comparator;
import java.util.Locale;

/**
 * Locale-sensitive string ordering for on-screen sorting.
 *
 * <p>Uses an ICU {@link Collator}, so accented letters sort next to their base letter and
 * language-specific letters sort where the configured locale's alphabet puts them. In Polish,
 * for example, "ł" comes right after "l" rather than after "z" as codepoint order would have
 * it. {@code null} compares like the empty string.</p>
 *
 * <p>The collator is frozen after configuration and therefore safe to share between threads.</p>
 */
public class CollationComparator implements Comparator<@Nullable String> {

    private final ULocale locale;
    private final Collator collator;

    /**
     * @param locale   the locale whose alphabetic ordering applies
     * @param strength one of the {@link Collator} strength constants, e.g. {@link Collator#TERTIARY}
     */
    public CollationComparator(final ULocale locale, final int strength) {
        this.locale = locale;
        final Collator configured = Collator.getInstance(locale);
        configured.setStrength(strength);
        this.collator = configured.freeze();
    }

    public CollationComparator(final ULocale locale) {
        this(locale, Collator.TERTIARY);
    }

    /**
     * Parses a strength name: primary, secondary, tertiary, quaternary or identical.
     *
     * @throws IllegalArgumentException for any other name
     */
    public static int parseStrength(final String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "primary" -> Collator.PRIMARY;
            case "secondary" -> Collator.SECONDARY;
            case "tertiary" -> Collator.TERTIARY;
            case "quaternary" -> Collator.QUATERNARY;
            case "identical" -> Collator.IDENTICAL;
            default -> throw new IllegalArgumentException("Unknown collation strength: " + name);
        };
    }

    @Override
    public int compare(final @Nullable String a, final @Nullable String b) {
        return collator.compare(a == null ? "" : a, b == null ? "" : b);
    }

    public ULocale getLocale() {
        return locale;
    }
}
