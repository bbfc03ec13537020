package com.ryuqq.tenantguard.application.ratelimit;

import com.ryuqq.tenantguard.core.exception.BucketStoreUnavailableException;
import com.ryuqq.tenantguard.core.exception.OperationCancelledException;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.ratelimit.BucketConfig;
import com.ryuqq.tenantguard.core.ratelimit.LimitScope;
import com.ryuqq.tenantguard.core.ratelimit.RateLimitDecision;
import com.ryuqq.tenantguard.core.ratelimit.RateLimitStats;
import com.ryuqq.tenantguard.core.ratelimit.RateLimiterConfig;
import com.ryuqq.tenantguard.core.ratelimit.TokenBucket;
import com.ryuqq.tenantguard.core.spi.BucketStore;
import com.ryuqq.tenantguard.core.time.Clock;
import com.ryuqq.tenantguard.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * 2단계 토큰 버킷 레이트 리미터.
 *
 * <p>모든 호출은 전역 버킷(업스트림 공유 한도)과 테넌트 버킷(공정성) 양쪽을 통과해야 합니다.
 * 한쪽만 허용했다면 그쪽에서 소비한 토큰을 돌려주고, 두 거부 중 더 긴 retryAfter를 반환합니다.</p>
 *
 * <p><strong>장애 정책:</strong> {@link BucketStore}가 {@link BucketStoreUnavailableException}을 던지면
 * 해당 범위는 허용(fail-open)으로 처리합니다. 이 예외 외의 모든 오류는 그대로 전파됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateLimitDecision decision = rateLimiter.acquire(tenantId, 1);
 * if (!decision.allowed()) {
 *     throw new RateLimitExceededException(tenantId, decision.retryAfter());
 * }
 * }</pre>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class TenantRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TenantRateLimiter.class);

    /** 전역 범위 버킷의 식별자 */
    static final String GLOBAL_IDENTIFIER = "all";

    private final RateLimiterConfig config;
    private final BucketStore store;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<LimitScope, ScopeCounters> counters = new EnumMap<>(LimitScope.class);

    public TenantRateLimiter(RateLimiterConfig config, BucketStore store, Clock clock, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
        for (LimitScope scope : LimitScope.values()) {
            counters.put(scope, new ScopeCounters());
        }
    }

    /**
     * 전역 + 테넌트 2단계 토큰 획득.
     *
     * @param tenantId 테넌트 ID
     * @param tokens 요청 토큰 수
     * @return 판정 (거부 시 두 범위 중 더 긴 retryAfter)
     * @throws IllegalArgumentException tokens가 양수가 아니거나 어느 범위의 capacity를 넘는 경우
     */
    public RateLimitDecision acquire(TenantId tenantId, int tokens) {
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        validateTokens(tokens);

        Consumed global = consume(LimitScope.GLOBAL, GLOBAL_IDENTIFIER, tokens);
        Consumed tenant = consume(LimitScope.TENANT, tenantId.getValue(), tokens);
        RateLimitDecision combined = global.decision().and(tenant.decision());

        if (!combined.allowed()) {
            if (global.consumed()) {
                refund(LimitScope.GLOBAL, GLOBAL_IDENTIFIER, tokens);
            }
            if (tenant.consumed()) {
                refund(LimitScope.TENANT, tenantId.getValue(), tokens);
            }
            log.debug("Rate limited tenant {} (global: {}, tenant: {}, retryAfter: {}ms)",
                tenantId.getValue(), global.decision().allowed(), tenant.decision().allowed(),
                combined.retryAfter().toMillis());
        }
        return combined;
    }

    /**
     * 단일 범위 버킷에서 토큰 획득.
     *
     * @param scope 범위
     * @param identifier 범위 내 식별자
     * @param tokens 요청 토큰 수
     * @return 판정
     */
    public RateLimitDecision tryAcquire(LimitScope scope, String identifier, int tokens) {
        Objects.requireNonNull(scope, "scope cannot be null");
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier cannot be null or blank");
        }
        if (tokens <= 0) {
            throw new IllegalArgumentException("tokens must be positive (current: " + tokens + ")");
        }
        return consume(scope, identifier, tokens).decision();
    }

    /**
     * 제한된 시간 안에서 기다렸다가 한 번 더 시도하는 토큰 획득.
     *
     * <p>첫 시도가 거부되고 retryAfter가 {@code maxWait} 이하면 그만큼 대기 후 한 번 재시도합니다.
     * 그보다 길면 기다리지 않고 거부를 반환합니다.</p>
     *
     * @param tenantId 테넌트 ID
     * @param tokens 요청 토큰 수
     * @param maxWait 최대 대기 시간
     * @return 최종 판정
     * @throws OperationCancelledException 대기 중 인터럽트된 경우
     */
    public RateLimitDecision acquireWithDelay(TenantId tenantId, int tokens, Duration maxWait) {
        Objects.requireNonNull(maxWait, "maxWait cannot be null");
        RateLimitDecision first = acquire(tenantId, tokens);
        if (first.allowed() || first.retryAfter().compareTo(maxWait) > 0) {
            return first;
        }

        log.debug("Waiting {}ms for rate limit of tenant {}", first.retryAfter().toMillis(), tenantId.getValue());
        try {
            sleeper.sleep(first.retryAfter());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(
                "Interrupted while waiting for rate limit of tenant " + tenantId.getValue(), e
            );
        }
        return acquire(tenantId, tokens);
    }

    /**
     * 업스트림 대기 힌트를 테넌트 버킷에 반영.
     *
     * <p>버킷을 비우고 {@code now + waitHint}까지 차단하여, 자연 리필을 기다리지 않고
     * 이후 호출이 스스로 속도를 줄이게 합니다.</p>
     *
     * @param tenantId 테넌트 ID
     * @param waitHint 업스트림이 지정한 대기 시간
     */
    public void throttle(TenantId tenantId, Duration waitHint) {
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        Objects.requireNonNull(waitHint, "waitHint cannot be null");
        if (waitHint.isNegative() || waitHint.isZero()) {
            return;
        }

        String key = config.bucketKey(LimitScope.TENANT, tenantId.getValue());
        BucketConfig bucketConfig = config.forScope(LimitScope.TENANT);
        long now = clock.nanoTime();
        try {
            store.compareAndUpdate(key, () -> TokenBucket.full(bucketConfig, now),
                bucket -> bucket.throttle(waitHint, now));
            log.info("Throttled tenant {} for {}ms after upstream rate limit", tenantId.getValue(), waitHint.toMillis());
        } catch (BucketStoreUnavailableException e) {
            log.warn("Bucket store unavailable, wait hint for tenant {} not applied", tenantId.getValue(), e);
        }
    }

    /**
     * 유휴 버킷 정리.
     *
     * @return 제거된 버킷 수
     */
    public int purgeIdle() {
        long cutoff = clock.nanoTime() - Duration.ofMillis(config.idleBucketTtlMs()).toNanos();
        int removed = 0;
        for (LimitScope scope : LimitScope.values()) {
            removed += store.removeIdle(config.scopePrefix(scope), cutoff);
        }
        if (removed > 0) {
            log.info("Purged {} idle rate limit buckets", removed);
        }
        return removed;
    }

    /**
     * 범위별 통계.
     *
     * @param scope 범위
     * @return 통계
     */
    public RateLimitStats getStats(LimitScope scope) {
        Objects.requireNonNull(scope, "scope cannot be null");
        Map<String, TokenBucket> buckets = store.findByPrefix(config.scopePrefix(scope));
        long now = clock.nanoTime();

        double totalTokens = 0;
        int throttled = 0;
        for (TokenBucket bucket : buckets.values()) {
            totalTokens += bucket.availableTokens(now);
            if (bucket.isBlocked(now)) {
                throttled++;
            }
        }
        double average = buckets.isEmpty() ? 0.0 : totalTokens / buckets.size();

        ScopeCounters scopeCounters = counters.get(scope);
        return new RateLimitStats(
            scope,
            buckets.size(),
            config.forScope(scope),
            average,
            throttled,
            scopeCounters.allowed.sum(),
            scopeCounters.rejected.sum(),
            scopeCounters.failOpen.sum()
        );
    }

    public RateLimiterConfig getConfig() {
        return config;
    }

    private Consumed consume(LimitScope scope, String identifier, int tokens) {
        String key = config.bucketKey(scope, identifier);
        BucketConfig bucketConfig = config.forScope(scope);
        ScopeCounters scopeCounters = counters.get(scope);
        long now = clock.nanoTime();

        AtomicReference<RateLimitDecision> decision = new AtomicReference<>();
        try {
            store.compareAndUpdate(key, () -> TokenBucket.full(bucketConfig, now), bucket -> {
                TokenBucket.Consumption consumption = bucket.tryConsume(tokens, now);
                decision.set(consumption.decision());
                return consumption.bucket();
            });
        } catch (BucketStoreUnavailableException e) {
            scopeCounters.failOpen.increment();
            log.warn("Bucket store unavailable for {}, failing open", key, e);
            return new Consumed(RateLimitDecision.allow(), false);
        }

        RateLimitDecision result = decision.get();
        if (result.allowed()) {
            scopeCounters.allowed.increment();
        } else {
            scopeCounters.rejected.increment();
        }
        return new Consumed(result, result.allowed());
    }

    private void refund(LimitScope scope, String identifier, int tokens) {
        String key = config.bucketKey(scope, identifier);
        BucketConfig bucketConfig = config.forScope(scope);
        long now = clock.nanoTime();
        try {
            store.compareAndUpdate(key, () -> TokenBucket.full(bucketConfig, now), bucket -> bucket.refund(tokens));
        } catch (BucketStoreUnavailableException e) {
            log.warn("Bucket store unavailable, {} tokens not refunded to {}", tokens, key, e);
        }
    }

    private void validateTokens(int tokens) {
        if (tokens <= 0) {
            throw new IllegalArgumentException("tokens must be positive (current: " + tokens + ")");
        }
        int smallest = Math.min(config.global().capacity(), config.perTenant().capacity());
        if (tokens > smallest) {
            throw new IllegalArgumentException(
                "tokens cannot exceed bucket capacity (tokens: " + tokens + ", capacity: " + smallest + ")"
            );
        }
    }

    private record Consumed(RateLimitDecision decision, boolean consumed) {
    }

    private static final class ScopeCounters {
        private final LongAdder allowed = new LongAdder();
        private final LongAdder rejected = new LongAdder();
        private final LongAdder failOpen = new LongAdder();
    }
}
