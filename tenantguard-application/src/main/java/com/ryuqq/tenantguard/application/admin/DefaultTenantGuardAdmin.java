package com.ryuqq.tenantguard.application.admin;

import com.ryuqq.tenantguard.application.breaker.CircuitBreakerRegistry;
import com.ryuqq.tenantguard.application.health.HealthMonitor;
import com.ryuqq.tenantguard.application.ratelimit.TenantRateLimiter;
import com.ryuqq.tenantguard.application.session.SessionPool;
import com.ryuqq.tenantguard.core.health.HealthMetricsSnapshot;
import com.ryuqq.tenantguard.core.health.HealthStatus;
import com.ryuqq.tenantguard.core.health.HealthSummary;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.tenantguard.core.ratelimit.LimitScope;
import com.ryuqq.tenantguard.core.ratelimit.RateLimitStats;
import com.ryuqq.tenantguard.core.session.PoolStatus;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 서비스들에 위임하는 기본 관리 API 구현.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class DefaultTenantGuardAdmin implements TenantGuardAdmin {

    private final TenantRateLimiter rateLimiter;
    private final CircuitBreakerRegistry breakers;
    private final HealthMonitor healthMonitor;
    private final SessionPool sessionPool;

    public DefaultTenantGuardAdmin(
        TenantRateLimiter rateLimiter,
        CircuitBreakerRegistry breakers,
        HealthMonitor healthMonitor,
        SessionPool sessionPool
    ) {
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter cannot be null");
        this.breakers = Objects.requireNonNull(breakers, "breakers cannot be null");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor cannot be null");
        this.sessionPool = Objects.requireNonNull(sessionPool, "sessionPool cannot be null");
    }

    @Override
    public RateLimitStats getRateLimitStats(LimitScope scope) {
        return rateLimiter.getStats(scope);
    }

    @Override
    public Optional<CircuitBreakerSnapshot> getBreakerState(TenantId tenantId) {
        return breakers.getState(tenantId);
    }

    @Override
    public Map<TenantId, CircuitBreakerSnapshot> getAllBreakerStates() {
        return breakers.getAllStates();
    }

    @Override
    public boolean resetBreaker(TenantId tenantId) {
        return breakers.resetBreaker(tenantId);
    }

    @Override
    public HealthSummary getHealthSummary() {
        return healthMonitor.getHealthSummary();
    }

    @Override
    public Optional<HealthMetricsSnapshot> getMetrics(TenantId tenantId) {
        return healthMonitor.getMetrics(tenantId);
    }

    @Override
    public List<HealthMetricsSnapshot> getUnhealthyTenants() {
        return healthMonitor.getUnhealthyTenants();
    }

    @Override
    public void suspend(TenantId tenantId, String reason) {
        healthMonitor.suspend(tenantId, reason);
    }

    @Override
    public Optional<HealthStatus> resume(TenantId tenantId) {
        return healthMonitor.resume(tenantId);
    }

    @Override
    public PoolStatus getPoolStatus() {
        return sessionPool.getPoolStatus();
    }
}
