package com.ryuqq.tenantguard.testkit.contract;

import com.ryuqq.tenantguard.application.guard.TenantGuard;
import com.ryuqq.tenantguard.core.exception.BucketStoreUnavailableException;
import com.ryuqq.tenantguard.core.exception.RateLimitExceededException;
import com.ryuqq.tenantguard.core.exception.RateLimitedException;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.ratelimit.LimitScope;
import com.ryuqq.tenantguard.core.ratelimit.RateLimitDecision;
import com.ryuqq.tenantguard.core.ratelimit.RateLimitStats;
import com.ryuqq.tenantguard.core.ratelimit.TokenBucket;
import com.ryuqq.tenantguard.core.spi.BucketStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rate Limit Contract Tests.
 *
 * <p>Verifies the two-tier token bucket guarantees:</p>
 * <ul>
 *   <li>Tokens always stay within [0, capacity]</li>
 *   <li>Refill at the configured rate after exhaustion</li>
 *   <li>Admission through GuardedExecutor reports an accurate retryAfter</li>
 *   <li>Upstream wait hints throttle the tenant bucket</li>
 *   <li>Store outages fail open</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
class RateLimitContractTest extends AbstractContractTest {

    // ============================================================
    // Bucket Bounds
    // ============================================================

    @Test
    void testTokenBucket_RandomTraffic_TokensStayWithinBounds() {
        // Given
        TenantId tenant = tenant("bot-bounds");
        String key = guard.rateLimiter().getConfig().bucketKey(LimitScope.TENANT, tenant.getValue());
        Random random = new Random(42);

        // When / Then
        for (int i = 0; i < 500; i++) {
            guard.rateLimiter().acquire(tenant, 1 + random.nextInt(3));
            clock.advanceMillis(random.nextInt(1500));

            TokenBucket bucket = bucketStore.find(key).orElseThrow();
            double available = bucket.availableTokens(clock.nanoTime());
            assertTrue(available >= 0.0, "tokens below zero: " + available);
            assertTrue(available <= bucket.capacity(), "tokens above capacity: " + available);
        }
    }

    // ============================================================
    // Refill
    // ============================================================

    @Test
    void testRefill_AfterExhaustion_OneTokenPerSecond() {
        // Given: capacity 10, 1 token/s
        TenantId tenant = tenant("bot-refill");
        for (int i = 0; i < 10; i++) {
            assertTrue(guard.rateLimiter().acquire(tenant, 1).allowed());
        }
        assertFalse(guard.rateLimiter().acquire(tenant, 1).allowed());

        // When
        clock.advance(Duration.ofSeconds(1));

        // Then
        assertTrue(guard.rateLimiter().acquire(tenant, 1).allowed());
        assertFalse(guard.rateLimiter().acquire(tenant, 1).allowed());
    }

    @Test
    void testRefill_AfterCapacityOverRateSeconds_BucketIsFull() {
        // Given
        TenantId tenant = tenant("bot-full");
        for (int i = 0; i < 10; i++) {
            guard.rateLimiter().acquire(tenant, 1);
        }

        // When: C / R = 10 seconds
        clock.advance(Duration.ofSeconds(10));

        // Then
        for (int i = 0; i < 10; i++) {
            assertTrue(guard.rateLimiter().acquire(tenant, 1).allowed(), "token " + i + " should be available");
        }
        assertFalse(guard.rateLimiter().acquire(tenant, 1).allowed());
    }

    @Test
    void testTenantBuckets_AreIndependent() {
        // Given
        TenantId noisy = tenant("bot-noisy");
        TenantId quiet = tenant("bot-quiet");
        for (int i = 0; i < 10; i++) {
            guard.rateLimiter().acquire(noisy, 1);
        }

        // When
        RateLimitDecision noisyDecision = guard.rateLimiter().acquire(noisy, 1);
        RateLimitDecision quietDecision = guard.rateLimiter().acquire(quiet, 1);

        // Then
        assertFalse(noisyDecision.allowed());
        assertTrue(quietDecision.allowed());
    }

    // ============================================================
    // End-to-End Admission
    // ============================================================

    @Test
    void testExecute_CapacityTenRateOne_EleventhCallRejectedWithOneSecondRetryAfter() {
        // Given
        TenantId tenant = tenant("bot-e2e");
        for (int i = 0; i < 10; i++) {
            assertEquals("sent", guard.executor().execute(tenant, () -> "sent"));
        }

        // When
        RateLimitExceededException rejected = assertThrows(RateLimitExceededException.class,
            () -> guard.executor().execute(tenant, () -> "sent"));

        // Then
        assertApproximately(1.0, rejected.getRetryAfter().toMillis() / 1000.0, 0.01);

        clock.advance(rejected.getRetryAfter());
        assertEquals("sent", guard.executor().execute(tenant, () -> "sent"));
    }

    @Test
    void testExecute_RejectedAdmission_DoesNotCountAsUpstreamFailure() {
        // Given
        TenantId tenant = tenant("bot-admission");
        for (int i = 0; i < 10; i++) {
            guard.executor().execute(tenant, () -> "sent");
        }

        // When
        assertThrows(RateLimitExceededException.class, () -> guard.executor().execute(tenant, () -> "sent"));

        // Then
        assertEquals(10, guard.healthMonitor().getMetrics(tenant).orElseThrow().totalRequests());
        assertEquals(0, guard.healthMonitor().getMetrics(tenant).orElseThrow().failedRequests());
    }

    // ============================================================
    // Upstream Rate Limit Feedback
    // ============================================================

    @Test
    void testUpstreamFloodWait_RetriesHonorHintAndThrottlesTenantBucket() {
        // Given
        TenantId tenant = tenant("bot-flood");
        AtomicInteger invocations = new AtomicInteger();

        // When
        RateLimitedException error = assertThrows(RateLimitedException.class,
            () -> guard.executor().execute(tenant, () -> {
                invocations.incrementAndGet();
                throw new RateLimitedException("FLOOD_WAIT_30", Duration.ofSeconds(30));
            }));

        // Then: 1 attempt + 3 retries, each waiting exactly the server hint
        assertEquals(4, invocations.get());
        assertEquals(Optional.of(Duration.ofSeconds(30)), error.getRetryAfter());
        assertEquals(3, clock.getSleeps().size());
        clock.getSleeps().forEach(sleep -> assertEquals(Duration.ofSeconds(30), sleep));

        RateLimitExceededException throttled = assertThrows(RateLimitExceededException.class,
            () -> guard.executor().execute(tenant, () -> "sent"));
        assertEquals(Duration.ofSeconds(31), throttled.getRetryAfter());

        assertTrue(guard.healthMonitor().getMetrics(tenant).orElseThrow().rateLimited());
        assertEquals(1, guard.rateLimiter().getStats(LimitScope.TENANT).throttledBuckets());
    }

    // ============================================================
    // Fail-Open
    // ============================================================

    @Test
    void testStoreUnavailable_RequestsAreAdmitted() {
        // Given
        UnavailableBucketStore unavailable = new UnavailableBucketStore();
        try (TenantGuard failOpenGuard = TenantGuard.builder(baseConfig())
            .bucketStore(unavailable)
            .clock(clock)
            .sleeper(clock)
            .build()) {
            TenantId tenant = tenant("bot-failopen");

            // When: far more than capacity
            for (int i = 0; i < 20; i++) {
                assertEquals("sent", failOpenGuard.executor().execute(tenant, () -> "sent"));
            }

            // Then
            RateLimitStats stats = failOpenGuard.rateLimiter().getStats(LimitScope.TENANT);
            assertEquals(20, stats.failOpenCount());
            assertEquals(0, stats.rejectedCount());
        }
    }

    private static final class UnavailableBucketStore implements BucketStore {

        @Override
        public TokenBucket compareAndUpdate(String key, Supplier<TokenBucket> initial, UnaryOperator<TokenBucket> updater) {
            throw new BucketStoreUnavailableException("connection refused");
        }

        @Override
        public Optional<TokenBucket> find(String key) {
            return Optional.empty();
        }

        @Override
        public Map<String, TokenBucket> findByPrefix(String prefix) {
            return Map.of();
        }

        @Override
        public int removeIdle(String prefix, long cutoffNanos) {
            return 0;
        }
    }
}
