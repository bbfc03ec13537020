package com.ryuqq.tenantguard.core.health;

import java.util.Map;

/**
 * 전체 테넌트 건강 요약.
 *
 * @param totalTenants 추적 중인 테넌트 수
 * @param statusCounts 상태별 테넌트 수 (모든 상태 키 포함)
 * @param globalErrorRate 전체 실패 수 / 전체 요청 수
 * @param averageLatencyMs 요청 이력이 있는 테넌트들의 평균 지연 평균
 * @param healthyRatio HEALTHY 테넌트 비율 (테넌트가 없으면 1.0)
 * @param band 비율로 정한 등급
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record HealthSummary(
    int totalTenants,
    Map<HealthStatus, Integer> statusCounts,
    double globalErrorRate,
    double averageLatencyMs,
    double healthyRatio,
    HealthBand band
) {

    public HealthSummary {
        statusCounts = Map.copyOf(statusCounts);
    }

    public int count(HealthStatus status) {
        return statusCounts.getOrDefault(status, 0);
    }
}
