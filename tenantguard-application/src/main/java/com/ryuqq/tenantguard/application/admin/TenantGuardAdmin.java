package com.ryuqq.tenantguard.application.admin;

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
import java.util.Optional;

/**
 * 관리 계층(HTTP/관리 화면)에 노출하는 조회/조치 API.
 *
 * <p>집계된 비율, 등급, 테넌트별 상태만 반환하며 저수준 예외는 노출하지 않습니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public interface TenantGuardAdmin {

    RateLimitStats getRateLimitStats(LimitScope scope);

    Optional<CircuitBreakerSnapshot> getBreakerState(TenantId tenantId);

    Map<TenantId, CircuitBreakerSnapshot> getAllBreakerStates();

    /**
     * 브레이커를 CLOSED로 강제 리셋.
     *
     * @param tenantId 테넌트 ID
     * @return 추적 중인 테넌트였으면 true
     */
    boolean resetBreaker(TenantId tenantId);

    HealthSummary getHealthSummary();

    Optional<HealthMetricsSnapshot> getMetrics(TenantId tenantId);

    List<HealthMetricsSnapshot> getUnhealthyTenants();

    /**
     * 테넌트 정지. 해제 전까지 상태가 자동으로 바뀌지 않습니다.
     *
     * @param tenantId 테넌트 ID
     * @param reason 정지 사유
     */
    void suspend(TenantId tenantId, String reason);

    Optional<HealthStatus> resume(TenantId tenantId);

    PoolStatus getPoolStatus();
}
