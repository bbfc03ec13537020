package com.ryuqq.tenantguard.core.exception;

import com.ryuqq.tenantguard.core.model.TenantId;

import java.time.Duration;

/**
 * 테넌트 서킷 브레이커가 OPEN 상태여서 호출이 로컬에서 거부됨.
 *
 * <p>이 거부는 실패 카운트에 포함되지 않으며 재시도 예산도 소비하지 않습니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class CircuitOpenException extends GuardException {

    private final TenantId tenantId;
    private final Duration timeoutRemaining;

    /**
     * 생성자.
     *
     * @param tenantId 테넌트 ID
     * @param timeoutRemaining 남은 쿨다운 시간
     */
    public CircuitOpenException(TenantId tenantId, Duration timeoutRemaining) {
        super(ErrorCategory.CIRCUIT_OPEN,
            "Circuit breaker is OPEN for " + tenantId + " (retry in " + timeoutRemaining.toMillis() + "ms)");
        this.tenantId = tenantId;
        this.timeoutRemaining = timeoutRemaining;
    }

    public TenantId getTenantId() {
        return tenantId;
    }

    /**
     * 남은 쿨다운 시간.
     *
     * @return 다음 호출이 HALF_OPEN 시험으로 허용되기까지 남은 시간
     */
    public Duration getTimeoutRemaining() {
        return timeoutRemaining;
    }
}
