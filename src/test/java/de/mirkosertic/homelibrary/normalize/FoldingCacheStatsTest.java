package de.mirkosertic.homelibrary.normalize;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FoldingCacheStatsTest {

    @Test
    void testCounters() {
        final FoldingCacheStats stats = new FoldingCacheStats();

        assertThat(stats.getTotalLookups()).isEqualTo(0);
        assertThat(stats.getHitRate()).isEqualTo(0.0);

        stats.recordHit();
        stats.recordHit();
        stats.recordHit();
        stats.recordMiss();

        assertThat(stats.getTotalLookups()).isEqualTo(4);
        assertThat(stats.getHits()).isEqualTo(3);
        assertThat(stats.getMisses()).isEqualTo(1);
        assertThat(stats.getHitRate()).isEqualTo(75.0);

        stats.setCurrentSize(42);
        assertThat(stats.getCurrentSize()).isEqualTo(42);
    }

    @Test
    void testToString() {
        final FoldingCacheStats stats = new FoldingCacheStats();
        stats.recordHit();
        stats.recordMiss();
        stats.setCurrentSize(1);

        assertThat(stats.toString())
                .contains("lookups=2")
                .contains("hits=1")
                .contains("misses=1")
                .contains("size=1");
    }

    @Test
    void testThreadSafety() throws InterruptedException {
        final FoldingCacheStats stats = new FoldingCacheStats();
        final int threads = 10;
        final int operationsPerThread = 1000;

        final ExecutorService executor = Executors.newFixedThreadPool(threads);
        final CountDownLatch latch = new CountDownLatch(threads);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    for (int j = 0; j < operationsPerThread; j++) {
                        stats.recordHit();
                        stats.recordMiss();
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(stats.getHits()).isEqualTo(threads * operationsPerThread);
        assertThat(stats.getMisses()).isEqualTo(threads * operationsPerThread);
        assertThat(stats.getHitRate()).isEqualTo(50.0);
    }
}
