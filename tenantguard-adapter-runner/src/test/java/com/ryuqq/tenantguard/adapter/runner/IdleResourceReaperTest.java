package com.ryuqq.tenantguard.adapter.runner;

import com.ryuqq.tenantguard.application.ratelimit.TenantRateLimiter;
import com.ryuqq.tenantguard.application.registry.TenantRegistry;
import com.ryuqq.tenantguard.core.exception.BucketStoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * IdleResourceReaper 유닛 테스트.
 *
 * <p>유휴 정리 동작을 검증합니다:</p>
 * <ul>
 *   <li>버킷과 테넌트 엔트리 정리 결과 집계</li>
 *   <li>한쪽 정리가 실패해도 다른 쪽은 계속 진행</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class IdleResourceReaperTest {

    private static final Duration TTL = Duration.ofHours(1);

    @Mock
    private TenantRateLimiter rateLimiter;

    @Mock
    private TenantRegistry registry;

    private IdleResourceReaper reaper;

    @BeforeEach
    void setUp() {
        reaper = new IdleResourceReaper(rateLimiter, registry, TTL);
    }

    // ============================================================
    // 1. 정상 정리
    // ============================================================

    @Test
    void sweep_버킷과_엔트리_정리_결과를_집계함() {
        // given
        when(rateLimiter.purgeIdle()).thenReturn(3);
        when(registry.removeIdle(TTL)).thenReturn(2);

        // when
        IdleResourceReaper.SweepResult result = reaper.sweep();

        // then
        assertThat(result.bucketsRemoved()).isEqualTo(3);
        assertThat(result.tenantsRemoved()).isEqualTo(2);
        assertThat(result.partialFailure()).isFalse();
    }

    // ============================================================
    // 2. 부분 실패
    // ============================================================

    @Test
    void sweep_버킷_정리_실패해도_엔트리_정리는_계속됨() {
        // given
        when(rateLimiter.purgeIdle()).thenThrow(new BucketStoreUnavailableException("redis down"));
        when(registry.removeIdle(TTL)).thenReturn(4);

        // when
        IdleResourceReaper.SweepResult result = reaper.sweep();

        // then
        assertThat(result.bucketsRemoved()).isZero();
        assertThat(result.tenantsRemoved()).isEqualTo(4);
        assertThat(result.partialFailure()).isTrue();
        verify(registry).removeIdle(TTL);
    }

    @Test
    void sweep_엔트리_정리_실패는_부분_실패로_보고됨() {
        // given
        when(rateLimiter.purgeIdle()).thenReturn(1);
        when(registry.removeIdle(TTL)).thenThrow(new IllegalStateException("boom"));

        // when
        IdleResourceReaper.SweepResult result = reaper.sweep();

        // then
        assertThat(result.bucketsRemoved()).isEqualTo(1);
        assertThat(result.partialFailure()).isTrue();
    }

    @Test
    void run_sweep을_한번_수행함() {
        // when
        reaper.run();

        // then
        verify(rateLimiter, times(1)).purgeIdle();
        verify(registry, times(1)).removeIdle(TTL);
    }
}
