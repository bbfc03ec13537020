package com.ryuqq.tenantguard.adapter.inmemory.bucket;

import com.ryuqq.tenantguard.core.ratelimit.BucketConfig;
import com.ryuqq.tenantguard.core.ratelimit.TokenBucket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InMemoryBucketStore}.
 *
 * <p>Covers the atomicity contract of {@code compareAndUpdate} and the prefix based
 * scan and purge operations.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
class InMemoryBucketStoreTest {

    private static final BucketConfig CONFIG = new BucketConfig(1000, 1.0);
    private static final String KEY = "tg:tenant:bot-1";

    private InMemoryBucketStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryBucketStore();
    }

    private TokenBucket consumeOne(String key, long now) {
        return store.compareAndUpdate(key, () -> TokenBucket.full(CONFIG, now),
            bucket -> bucket.tryConsume(1, now).bucket());
    }

    @Test
    void compareAndUpdate_MissingKey_StartsFromInitial() {
        // When
        TokenBucket committed = consumeOne(KEY, 0L);

        // Then
        assertEquals(999.0, committed.availableTokens(0L));
        assertEquals(committed, store.find(KEY).orElseThrow());
        assertEquals(1, store.size());
    }

    @Test
    void compareAndUpdate_NullResult_ThrowsAndKeepsPrevious() {
        // Given
        TokenBucket before = consumeOne(KEY, 0L);

        // When & Then
        assertThrows(IllegalStateException.class,
            () -> store.compareAndUpdate(KEY, () -> TokenBucket.full(CONFIG, 0L), bucket -> null));
        assertEquals(before, store.find(KEY).orElseThrow());
    }

    @Test
    void compareAndUpdate_UpdaterException_Propagates() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> store.compareAndUpdate(KEY, () -> TokenBucket.full(CONFIG, 0L),
                bucket -> bucket.tryConsume(5000, 0L).bucket()));

        assertTrue(error.getMessage().contains("requested cannot exceed capacity"));
        assertTrue(store.find(KEY).isEmpty());
    }

    @Test
    void compareAndUpdate_ConcurrentUpdates_NoLostUpdates() throws Exception {
        // Given
        int threads = 8;
        int perThread = 100;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        consumeOne(KEY, 0L);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // Then: 1000 - 800
        assertEquals(200.0, store.find(KEY).orElseThrow().availableTokens(0L));
    }

    @Test
    void compareAndUpdate_DifferentKeys_InitialSuppliedPerKey() {
        AtomicInteger initialCalls = new AtomicInteger();

        for (String key : List.of("tg:tenant:a", "tg:tenant:b", "tg:tenant:a")) {
            store.compareAndUpdate(key, () -> {
                initialCalls.incrementAndGet();
                return TokenBucket.full(CONFIG, 0L);
            }, bucket -> bucket.tryConsume(1, 0L).bucket());
        }

        assertEquals(2, initialCalls.get());
    }

    @Test
    void findByPrefix_ReturnsOnlyMatchingScope() {
        // Given
        consumeOne("tg:tenant:a", 0L);
        consumeOne("tg:tenant:b", 0L);
        consumeOne("tg:global:all", 0L);

        // When
        Map<String, TokenBucket> tenants = store.findByPrefix("tg:tenant:");

        // Then
        assertEquals(2, tenants.size());
        assertTrue(tenants.containsKey("tg:tenant:a"));
        assertFalse(tenants.containsKey("tg:global:all"));
    }

    @Test
    void removeIdle_RemovesOnlyIdleBucketsUnderPrefix() {
        // Given
        consumeOne("tg:tenant:old", 100L);
        consumeOne("tg:tenant:fresh", 500L);
        consumeOne("tg:global:all", 100L);

        // When
        int removed = store.removeIdle("tg:tenant:", 300L);

        // Then
        assertEquals(1, removed);
        assertTrue(store.find("tg:tenant:old").isEmpty());
        assertTrue(store.find("tg:tenant:fresh").isPresent());
        assertTrue(store.find("tg:global:all").isPresent());
    }
}
