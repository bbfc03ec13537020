package com.ryuqq.tenantguard.core.exception;

import com.ryuqq.tenantguard.core.model.TenantId;

/**
 * 제한 시간 내에 전역 세션 슬롯을 얻지 못함.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class PoolExhaustedException extends GuardException {

    private final TenantId tenantId;

    public PoolExhaustedException(TenantId tenantId, int maxTotalConnections, long timeoutMs) {
        super(ErrorCategory.POOL_EXHAUSTED,
            "Session pool exhausted for " + tenantId + " (max: " + maxTotalConnections
                + ", waited: " + timeoutMs + "ms)");
        this.tenantId = tenantId;
    }

    public TenantId getTenantId() {
        return tenantId;
    }
}
