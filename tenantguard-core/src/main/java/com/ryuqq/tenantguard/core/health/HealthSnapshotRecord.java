package com.ryuqq.tenantguard.core.health;

import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.protection.CircuitBreakerState;

import java.time.Instant;
import java.util.Objects;

/**
 * 영속 저장소로 보내는 건강 스냅샷 한 건.
 *
 * @param tenantId 테넌트 ID
 * @param timestamp 스냅샷 시각
 * @param metrics 지표
 * @param breakerState 같은 시각의 Circuit Breaker 상태
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record HealthSnapshotRecord(
    TenantId tenantId,
    Instant timestamp,
    HealthMetricsSnapshot metrics,
    CircuitBreakerState breakerState
) {

    public HealthSnapshotRecord {
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(metrics, "metrics cannot be null");
        Objects.requireNonNull(breakerState, "breakerState cannot be null");
    }
}
