package com.ryuqq.tenantguard.application.registry;

import com.ryuqq.tenantguard.core.health.HealthMetrics;
import com.ryuqq.tenantguard.core.health.HealthStatus;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.protection.CircuitBreaker;
import com.ryuqq.tenantguard.core.session.SessionSlot;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 테넌트 하나가 소유하는 상태 묶음.
 *
 * <p>Circuit Breaker 하나, 건강 지표 하나, 최대 하나의 세션 슬롯을 가집니다.
 * 각 구성 요소는 스스로 원자성을 보장하므로 엔트리 전체를 잠그지 않습니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class TenantEntry {

    private final TenantId tenantId;
    private final CircuitBreaker breaker;
    private final HealthMetrics metrics;
    private final AtomicReference<SessionSlot> session = new AtomicReference<>();
    private volatile long lastActivityNanos;

    TenantEntry(TenantId tenantId, CircuitBreaker breaker, HealthMetrics metrics, long createdAtNanos) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId cannot be null");
        this.breaker = Objects.requireNonNull(breaker, "breaker cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.lastActivityNanos = createdAtNanos;
    }

    public TenantId getTenantId() {
        return tenantId;
    }

    public CircuitBreaker getBreaker() {
        return breaker;
    }

    public HealthMetrics getMetrics() {
        return metrics;
    }

    /**
     * 세션 슬롯 참조.
     *
     * <p>null이면 열린 세션이 없습니다. 점유와 반납은 compare-and-set으로만 수행합니다.</p>
     *
     * @return 세션 슬롯 참조
     */
    public AtomicReference<SessionSlot> session() {
        return session;
    }

    public long getLastActivityNanos() {
        return lastActivityNanos;
    }

    void touch(long nowNanos) {
        if (nowNanos > lastActivityNanos) {
            lastActivityNanos = nowNanos;
        }
    }

    /**
     * 유휴 정리 대상인지 확인.
     *
     * <p>열린 세션이 있거나 SUSPENDED 상태면 대상이 아닙니다.</p>
     */
    boolean isRemovable(long cutoffNanos) {
        return lastActivityNanos < cutoffNanos
            && session.get() == null
            && metrics.getStatus() != HealthStatus.SUSPENDED;
    }
}
