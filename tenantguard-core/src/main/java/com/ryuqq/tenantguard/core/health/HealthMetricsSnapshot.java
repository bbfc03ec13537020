package com.ryuqq.tenantguard.core.health;

import com.ryuqq.tenantguard.core.model.TenantId;

import java.time.Instant;

/**
 * 특정 시점의 테넌트 건강 지표 (불변).
 *
 * <p>시각 필드는 해당 이벤트가 없으면 null입니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record HealthMetricsSnapshot(
    TenantId tenantId,
    HealthStatus status,
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    int consecutiveFailures,
    double errorRate,
    double avgLatencyMs,
    Instant lastSuccess,
    Instant lastFailure,
    Instant lastCheck,
    boolean rateLimited,
    String lastErrorType,
    String suspendedReason,
    Instant suspendedAt
) {
}
