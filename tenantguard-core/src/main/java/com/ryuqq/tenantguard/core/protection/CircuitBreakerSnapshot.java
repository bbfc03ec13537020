package com.ryuqq.tenantguard.core.protection;

import com.ryuqq.tenantguard.core.model.TenantId;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 특정 시점의 Circuit Breaker 상태 (불변).
 *
 * @param tenantId 테넌트 ID
 * @param state 현재 상태
 * @param failureCount 현재 상태에서 누적된 실패 수
 * @param successCount 현재 상태에서 누적된 성공 수
 * @param openedAt 마지막으로 OPEN된 시각 (OPEN 이력이 없으면 null)
 * @param timeoutRemaining OPEN 상태의 남은 쿨다운 (그 외 상태는 0)
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record CircuitBreakerSnapshot(
    TenantId tenantId,
    CircuitBreakerState state,
    int failureCount,
    int successCount,
    Instant openedAt,
    Duration timeoutRemaining
) {

    public Optional<Instant> openedAtOptional() {
        return Optional.ofNullable(openedAt);
    }
}
