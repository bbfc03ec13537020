package com.ryuqq.tenantguard.adapter.runner;

import com.ryuqq.tenantguard.application.ratelimit.TenantRateLimiter;
import com.ryuqq.tenantguard.application.registry.TenantRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * 유휴 자원 정리기.
 *
 * <p>오래 쓰이지 않은 레이트 리밋 버킷과 테넌트 엔트리를 제거합니다.
 * 두 정리는 서로 독립적이어서 한쪽이 실패해도 다른 쪽은 실행됩니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class IdleResourceReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(IdleResourceReaper.class);

    private final TenantRateLimiter rateLimiter;
    private final TenantRegistry registry;
    private final Duration tenantIdleTtl;

    public IdleResourceReaper(TenantRateLimiter rateLimiter, TenantRegistry registry, Duration tenantIdleTtl) {
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter cannot be null");
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.tenantIdleTtl = Objects.requireNonNull(tenantIdleTtl, "tenantIdleTtl cannot be null");
    }

    @Override
    public void run() {
        sweep();
    }

    /**
     * 유휴 버킷과 엔트리 정리.
     *
     * @return 정리 결과
     */
    public SweepResult sweep() {
        int buckets = 0;
        int tenants = 0;
        boolean failed = false;

        try {
            buckets = rateLimiter.purgeIdle();
        } catch (RuntimeException e) {
            failed = true;
            log.error("Failed to purge idle rate limit buckets", e);
        }

        try {
            tenants = registry.removeIdle(tenantIdleTtl);
        } catch (RuntimeException e) {
            failed = true;
            log.error("Failed to remove idle tenant entries", e);
        }

        log.info("Idle sweep completed: {} buckets, {} tenants removed", buckets, tenants);
        return new SweepResult(buckets, tenants, failed);
    }

    /**
     * 정리 결과.
     *
     * @param bucketsRemoved 제거된 버킷 수
     * @param tenantsRemoved 제거된 테넌트 엔트리 수
     * @param partialFailure 한쪽 정리가 실패했으면 true
     */
    public record SweepResult(int bucketsRemoved, int tenantsRemoved, boolean partialFailure) {
    }
}
