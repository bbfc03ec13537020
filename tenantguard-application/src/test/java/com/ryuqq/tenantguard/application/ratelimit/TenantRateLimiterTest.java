package com.ryuqq.tenantguard.application.ratelimit;

import com.ryuqq.tenantguard.adapter.inmemory.bucket.InMemoryBucketStore;
import com.ryuqq.tenantguard.core.exception.BucketStoreUnavailableException;
import com.ryuqq.tenantguard.core.exception.OperationCancelledException;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.ratelimit.BucketConfig;
import com.ryuqq.tenantguard.core.ratelimit.LimitScope;
import com.ryuqq.tenantguard.core.ratelimit.RateLimitDecision;
import com.ryuqq.tenantguard.core.ratelimit.RateLimitStats;
import com.ryuqq.tenantguard.core.ratelimit.RateLimiterConfig;
import com.ryuqq.tenantguard.core.spi.BucketStore;
import com.ryuqq.tenantguard.core.time.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * TenantRateLimiter 유닛 테스트.
 *
 * <ul>
 *   <li>전역/테넌트 2단계 판정과 반대쪽 토큰 반환</li>
 *   <li>저장소 장애 시 fail-open, 그 외 오류는 전파</li>
 *   <li>acquireWithDelay 대기 한도</li>
 *   <li>업스트림 대기 힌트 반영 (throttle)</li>
 *   <li>유휴 버킷 정리와 통계</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
@DisplayName("TenantRateLimiter 테스트")
class TenantRateLimiterTest {

    private static final TenantId ALICE = TenantId.of("alice");
    private static final TenantId BOB = TenantId.of("bob");

    private ManualClock clock;
    private InMemoryBucketStore store;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        store = new InMemoryBucketStore();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private TenantRateLimiter limiter(BucketConfig global, BucketConfig tenant) {
        return limiter(store, global, tenant);
    }

    private TenantRateLimiter limiter(BucketStore bucketStore, BucketConfig global, BucketConfig tenant) {
        return new TenantRateLimiter(new RateLimiterConfig("tg", global, tenant, 60_000), bucketStore, clock, clock);
    }

    private double available(TenantRateLimiter limiter, LimitScope scope, String identifier) {
        String key = limiter.getConfig().bucketKey(scope, identifier);
        return store.find(key).orElseThrow().availableTokens(clock.nanoTime());
    }

    // ============================================================
    // 1. 2단계 판정
    // ============================================================

    @Test
    @DisplayName("전역 버킷이 거부하면 테넌트 버킷에서 소비한 토큰을 돌려준다")
    void acquire_전역_거부_시_테넌트_토큰_반환() {
        // given
        TenantRateLimiter limiter = limiter(new BucketConfig(2, 1.0), new BucketConfig(5, 1.0));
        assertThat(limiter.acquire(ALICE, 2).allowed()).isTrue();

        // when
        RateLimitDecision decision = limiter.acquire(BOB, 1);

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.retryAfter()).isEqualTo(Duration.ofSeconds(1));
        assertThat(available(limiter, LimitScope.TENANT, "bob")).isEqualTo(5.0);
    }

    @Test
    @DisplayName("테넌트 버킷이 거부하면 전역 버킷에서 소비한 토큰을 돌려준다")
    void acquire_테넌트_거부_시_전역_토큰_반환() {
        // given
        TenantRateLimiter limiter = limiter(new BucketConfig(10, 10.0), new BucketConfig(2, 1.0));
        limiter.acquire(ALICE, 1);
        limiter.acquire(ALICE, 1);

        // when
        RateLimitDecision decision = limiter.acquire(ALICE, 1);

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.retryAfter()).isEqualTo(Duration.ofSeconds(1));
        assertThat(available(limiter, LimitScope.GLOBAL, TenantRateLimiter.GLOBAL_IDENTIFIER)).isEqualTo(8.0);
    }

    @Test
    @DisplayName("두 범위가 모두 거부하면 더 긴 retryAfter를 반환한다")
    void acquire_양쪽_거부_시_긴_retryAfter() {
        // given: 전역은 0.5초, 테넌트는 2초 뒤 1토큰
        TenantRateLimiter limiter = limiter(new BucketConfig(1, 2.0), new BucketConfig(1, 0.5));
        limiter.acquire(ALICE, 1);

        // when
        RateLimitDecision decision = limiter.acquire(ALICE, 1);

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.retryAfter()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("테넌트 버킷은 서로 독립적이다")
    void acquire_테넌트_독립() {
        TenantRateLimiter limiter = limiter(new BucketConfig(100, 100.0), new BucketConfig(1, 1.0));

        assertThat(limiter.acquire(ALICE, 1).allowed()).isTrue();
        assertThat(limiter.acquire(ALICE, 1).allowed()).isFalse();
        assertThat(limiter.acquire(BOB, 1).allowed()).isTrue();
    }

    @Test
    @DisplayName("토큰 수는 양수이고 두 범위 capacity 중 작은 값 이하여야 한다")
    void acquire_토큰_수_검증() {
        TenantRateLimiter limiter = limiter(new BucketConfig(10, 10.0), new BucketConfig(3, 1.0));

        assertThatThrownBy(() -> limiter.acquire(ALICE, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("tokens must be positive");
        assertThatThrownBy(() -> limiter.acquire(ALICE, 4))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("capacity: 3");
    }

    @Test
    @DisplayName("tryAcquire는 지정한 범위 하나만 소비한다")
    void tryAcquire_단일_범위() {
        // given
        TenantRateLimiter limiter = limiter(new BucketConfig(10, 10.0), new BucketConfig(2, 1.0));

        // when
        RateLimitDecision decision = limiter.tryAcquire(LimitScope.TENANT, "alice", 2);

        // then
        assertThat(decision.allowed()).isTrue();
        assertThat(store.find(limiter.getConfig().bucketKey(LimitScope.GLOBAL, TenantRateLimiter.GLOBAL_IDENTIFIER)))
            .isEmpty();
        assertThatThrownBy(() -> limiter.tryAcquire(LimitScope.TENANT, " ", 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 2. 저장소 장애
    // ============================================================

    @Test
    @DisplayName("저장소가 BucketStoreUnavailableException을 던지면 허용하고 fail-open으로 집계한다")
    void acquire_저장소_장애_시_fail_open() {
        // given
        BucketStore broken = mock(BucketStore.class);
        when(broken.compareAndUpdate(anyString(), any(), any()))
            .thenThrow(new BucketStoreUnavailableException("connection refused"));
        TenantRateLimiter limiter = limiter(broken, new BucketConfig(1, 1.0), new BucketConfig(1, 1.0));

        // when
        RateLimitDecision first = limiter.acquire(ALICE, 1);
        RateLimitDecision second = limiter.acquire(ALICE, 1);

        // then
        assertThat(first.allowed()).isTrue();
        assertThat(second.allowed()).isTrue();
        RateLimitStats global = limiter.getStats(LimitScope.GLOBAL);
        assertThat(global.failOpenCount()).isEqualTo(2);
        assertThat(global.allowedCount()).isZero();
        assertThat(limiter.getStats(LimitScope.TENANT).failOpenCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("저장소의 다른 오류는 그대로 전파된다")
    void acquire_기타_저장소_오류는_전파() {
        // given
        BucketStore broken = mock(BucketStore.class);
        when(broken.compareAndUpdate(anyString(), any(), any()))
            .thenThrow(new IllegalStateException("corrupted bucket"));
        TenantRateLimiter limiter = limiter(broken, new BucketConfig(1, 1.0), new BucketConfig(1, 1.0));

        // when & then
        assertThatThrownBy(() -> limiter.acquire(ALICE, 1))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("corrupted bucket");
    }

    @Test
    @DisplayName("throttle 중 저장소 장애는 경고만 남기고 던지지 않는다")
    void throttle_저장소_장애는_무시() {
        BucketStore broken = mock(BucketStore.class);
        when(broken.compareAndUpdate(anyString(), any(), any()))
            .thenThrow(new BucketStoreUnavailableException("timeout"));
        TenantRateLimiter limiter = limiter(broken, new BucketConfig(1, 1.0), new BucketConfig(1, 1.0));

        assertThatCode(() -> limiter.throttle(ALICE, Duration.ofSeconds(5))).doesNotThrowAnyException();
    }

    // ============================================================
    // 3. acquireWithDelay
    // ============================================================

    @Test
    @DisplayName("retryAfter가 maxWait 이하면 대기 후 한 번 더 시도한다")
    void acquireWithDelay_한도_내_대기_후_재시도() {
        // given
        TenantRateLimiter limiter = limiter(new BucketConfig(10, 10.0), new BucketConfig(1, 1.0));
        limiter.acquire(ALICE, 1);

        // when
        RateLimitDecision decision = limiter.acquireWithDelay(ALICE, 1, Duration.ofSeconds(2));

        // then
        assertThat(decision.allowed()).isTrue();
        assertThat(clock.getSleeps()).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("retryAfter가 maxWait보다 길면 기다리지 않고 거부한다")
    void acquireWithDelay_한도_초과는_즉시_거부() {
        // given
        TenantRateLimiter limiter = limiter(new BucketConfig(10, 10.0), new BucketConfig(1, 1.0));
        limiter.acquire(ALICE, 1);

        // when
        RateLimitDecision decision = limiter.acquireWithDelay(ALICE, 1, Duration.ofMillis(500));

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(clock.getSleeps()).isEmpty();
    }

    @Test
    @DisplayName("대기 중 인터럽트되면 OperationCancelledException")
    void acquireWithDelay_인터럽트_시_취소() {
        // given
        TenantRateLimiter limiter = limiter(new BucketConfig(10, 10.0), new BucketConfig(1, 1.0));
        limiter.acquire(ALICE, 1);
        Thread.currentThread().interrupt();

        // when & then
        assertThatThrownBy(() -> limiter.acquireWithDelay(ALICE, 1, Duration.ofSeconds(2)))
            .isInstanceOf(OperationCancelledException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    // ============================================================
    // 4. throttle
    // ============================================================

    @Test
    @DisplayName("throttle은 테넌트 버킷을 비우고 대기 힌트만큼 차단한다")
    void throttle_대기_힌트만큼_차단() {
        // given
        TenantRateLimiter limiter = limiter(new BucketConfig(100, 100.0), new BucketConfig(10, 1.0));

        // when
        limiter.throttle(ALICE, Duration.ofSeconds(30));

        // then
        RateLimitDecision blocked = limiter.acquire(ALICE, 1);
        assertThat(blocked.allowed()).isFalse();
        assertThat(blocked.retryAfter()).isEqualTo(Duration.ofSeconds(31));
        assertThat(limiter.getStats(LimitScope.TENANT).throttledBuckets()).isEqualTo(1);

        clock.advance(blocked.retryAfter());
        assertThat(limiter.acquire(ALICE, 1).allowed()).isTrue();
        assertThat(limiter.acquire(BOB, 1).allowed()).isTrue();
    }

    @Test
    @DisplayName("0 이하의 대기 힌트는 무시한다")
    void throttle_0_이하_힌트_무시() {
        TenantRateLimiter limiter = limiter(new BucketConfig(100, 100.0), new BucketConfig(10, 1.0));

        limiter.throttle(ALICE, Duration.ZERO);

        assertThat(store.size()).isZero();
    }

    // ============================================================
    // 5. 정리와 통계
    // ============================================================

    @Test
    @DisplayName("purgeIdle은 TTL 동안 접근이 없는 버킷만 제거한다")
    void purgeIdle_유휴_버킷만_제거() {
        // given
        TenantRateLimiter limiter = limiter(new BucketConfig(100, 100.0), new BucketConfig(10, 1.0));
        limiter.acquire(ALICE, 1);
        clock.advance(Duration.ofSeconds(50));
        limiter.acquire(BOB, 1);
        clock.advance(Duration.ofSeconds(20));

        // when: alice 70초, bob 20초, 전역 20초 유휴
        int removed = limiter.purgeIdle();

        // then
        assertThat(removed).isEqualTo(1);
        assertThat(store.findByPrefix(limiter.getConfig().scopePrefix(LimitScope.TENANT)).keySet())
            .containsExactly("tg:tenant:bob");
    }

    @Test
    @DisplayName("getStats는 버킷 수, 평균 토큰, 허용/거부 횟수를 집계한다")
    void getStats_집계() {
        // given
        TenantRateLimiter limiter = limiter(new BucketConfig(100, 100.0), new BucketConfig(2, 1.0));
        for (String name : List.of("alice", "alice", "alice", "bob")) {
            limiter.acquire(TenantId.of(name), 1);
        }

        // when
        RateLimitStats tenant = limiter.getStats(LimitScope.TENANT);

        // then: alice 0토큰, bob 1토큰
        assertThat(tenant.totalBuckets()).isEqualTo(2);
        assertThat(tenant.averageAvailableTokens()).isEqualTo(0.5);
        assertThat(tenant.allowedCount()).isEqualTo(3);
        assertThat(tenant.rejectedCount()).isEqualTo(1);
        assertThat(tenant.throttledBuckets()).isZero();
        assertThat(tenant.config().capacity()).isEqualTo(2);
    }
}
