package de.mirkosertic.homelibrary.normalize;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UCharacterCategory;
import com.ibm.icu.text.Normalizer2;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Maps a single Unicode codepoint to its unaccented, ASCII-approximate replacement.
 *
 * <p>Resolution order (first match wins):</p>
 * <ol>
 *   <li>Explicit overrides for letters whose Unicode decomposition gives no useful result:
 *       ligatures (Æ → AE), stroked letters (Ł → L, Đ → Dj) and the sharp s (ß → ss).</li>
 *   <li>Canonical decomposition into a base character plus combining marks: the base
 *       character is folded again and the marks are dropped (é → e, ǖ → ü → u).</li>
 *   <li>Compatibility decomposition (ﬁ, fullwidth letters, superscripts): every component that
 *       is not a combining mark is folded and the results are concatenated. A replacement
 *       without any letter or digit is not used: spaces (no-break, en, ideographic space),
 *       fullwidth punctuation (（, ：, ＊) and the ellipsis keep their own codepoint, so folding
 *       neither changes whitespace nor produces query syntax characters.</li>
 *   <li>Otherwise the codepoint maps to itself.</li>
 * </ol>
 *
 * <p>Every resolved entry stays cached for the lifetime of the table. The mapping is a pure
 * function of the Unicode data, so entries are never invalidated and never evicted. Entries
 * are stored with insert-if-absent semantics and computed outside the cache's lock, because
 * resolving one codepoint recursively folds the components of its decomposition. Two threads
 * resolving the same codepoint compute the same string, and the first write wins.</p>
 *
 * <p>The output of {@link #fold(int)} consists only of codepoints that fold to themselves.</p>
 */
public class CodepointFoldingTable {

    private static final Logger logger = LoggerFactory.getLogger(CodepointFoldingTable.class);

    private static final Map<Integer, String> OVERRIDES = Map.ofEntries(
            entry(0x00C6, "AE"),   // Æ
            entry(0x00E6, "ae"),   // æ
            entry(0x00D0, "D"),    // Ð
            entry(0x00F0, "d"),    // ð
            entry(0x00D8, "OE"),   // Ø
            entry(0x00F8, "oe"),   // ø
            entry(0x00DE, "Th"),   // Þ
            entry(0x00FE, "th"),   // þ
            entry(0x00DF, "ss"),   // ß
            entry(0x0110, "Dj"),   // Đ
            entry(0x0111, "dj"),   // đ
            entry(0x0126, "H"),    // Ħ
            entry(0x0127, "h"),    // ħ
            entry(0x0131, "i"),    // ı
            entry(0x0138, "q"),    // ĸ
            entry(0x0141, "L"),    // Ł
            entry(0x0142, "l"),    // ł
            entry(0x014A, "Ng"),   // Ŋ
            entry(0x014B, "ng"),   // ŋ
            entry(0x0152, "OE"),   // Œ
            entry(0x0153, "oe"),   // œ
            entry(0x0166, "Th"),   // Ŧ
            entry(0x0167, "th")    // ŧ
    );

    private final Normalizer2 canonical = Normalizer2.getNFDInstance();
    private final Normalizer2 compatibility = Normalizer2.getNFKDInstance();

    private final @Nullable Cache<Integer, String> cache;
    private final FoldingCacheStats stats;

    /**
     * Creates a caching folding table.
     */
    public CodepointFoldingTable() {
        this(true, new FoldingCacheStats());
    }

    /**
     * @param cacheEnabled false recomputes every lookup, for memory-constrained callers;
     *                     results are identical either way
     * @param stats        collector for cache hits and misses
     */
    public CodepointFoldingTable(final boolean cacheEnabled, final FoldingCacheStats stats) {
        this.stats = stats;
        this.cache = cacheEnabled ? Caffeine.newBuilder().build() : null;
    }

    /**
     * Returns the replacement for a codepoint: zero or more characters, possibly the codepoint
     * itself.
     *
     * @throws IllegalArgumentException if {@code codepoint} is not a valid Unicode codepoint
     */
    public String fold(final int codepoint) {
        if (!Character.isValidCodePoint(codepoint)) {
            throw new IllegalArgumentException("Not a Unicode codepoint: " + codepoint);
        }
        if (cache == null) {
            stats.recordMiss();
            return resolve(codepoint);
        }

        final String cached = cache.getIfPresent(codepoint);
        if (cached != null) {
            stats.recordHit();
            return cached;
        }

        stats.recordMiss();
        final String resolved = resolve(codepoint);
        final String existing = cache.asMap().putIfAbsent(codepoint, resolved);
        stats.setCurrentSize(cache.estimatedSize());
        return existing != null ? existing : resolved;
    }

    public FoldingCacheStats getStats() {
        return stats;
    }

    private String resolve(final int codepoint) {
        final String override = OVERRIDES.get(codepoint);
        if (override != null) {
            return override;
        }

        try {
            final String canonicalMapping = canonical.getRawDecomposition(codepoint);
            if (canonicalMapping != null) {
                return foldCanonical(codepoint, canonicalMapping);
            }
            final String compatibilityMapping = compatibility.getRawDecomposition(codepoint);
            if (compatibilityMapping != null) {
                return foldCompatibility(codepoint, compatibilityMapping);
            }
        } catch (final RuntimeException e) {
            logger.warn("No usable decomposition for U+{}, keeping it unchanged",
                    Integer.toHexString(codepoint).toUpperCase(), e);
        }

        return Character.toString(codepoint);
    }

    private String foldCanonical(final int codepoint, final String mapping) {
        final int[] components = mapping.codePoints().toArray();
        for (int i = 1; i < components.length; i++) {
            if (!isCombiningMark(components[i])) {
                // Not a base + marks sequence (Hangul syllables)
                return Character.toString(codepoint);
            }
        }
        return fold(components[0]);
    }

    private String foldCompatibility(final int codepoint, final String mapping) {
        final StringBuilder result = new StringBuilder();
        mapping.codePoints()
                .filter(component -> !isCombiningMark(component))
                .forEach(component -> result.append(fold(component)));
        if (result.codePoints().noneMatch(UCharacter::isLetterOrDigit)) {
            return Character.toString(codepoint);
        }
        return result.toString();
    }

    private static boolean isCombiningMark(final int codepoint) {
        final int type = UCharacter.getType(codepoint);
        return type == UCharacterCategory.NON_SPACING_MARK
                || type == UCharacterCategory.ENCLOSING_MARK
                || type == UCharacterCategory.COMBINING_SPACING_MARK;
    }
}
