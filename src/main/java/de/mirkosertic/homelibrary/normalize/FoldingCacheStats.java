package de.mirkosertic.homelibrary.normalize;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters for the codepoint folding cache.
 *
 * <p>Tracks lookups served from the cache (hits), lookups that had to resolve the
 * replacement from the override table or Unicode data (misses), and the number of cached
 * entries. The folding cache never evicts, so there is no eviction counter.</p>
 */
public class FoldingCacheStats {

    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong size = new AtomicLong(0);

    public void recordHit() {
        hits.incrementAndGet();
    }

    public void recordMiss() {
        misses.incrementAndGet();
    }

    public void setCurrentSize(final long entries) {
        size.set(entries);
    }

    public long getTotalLookups() {
        return hits.get() + misses.get();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getCurrentSize() {
        return size.get();
    }

    /**
     * Hit rate as a percentage (0-100), or 0.0 before the first lookup.
     */
    public double getHitRate() {
        final long total = getTotalLookups();
        if (total == 0) {
            return 0.0;
        }
        return (hits.get() * 100.0) / total;
    }

    @Override
    public String toString() {
        return String.format(
                "FoldingCacheStats[lookups=%d, hits=%d, misses=%d, hitRate=%.1f%%, size=%d]",
                getTotalLookups(),
                getHits(),
                getMisses(),
                getHitRate(),
                getCurrentSize()
        );
    }
}
