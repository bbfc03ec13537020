package com.ryuqq.tenantguard.core.exception;

import com.ryuqq.tenantguard.core.model.TenantId;

/**
 * 테넌트가 이미 OPEN 세션을 보유하고 있어 새 세션 획득이 거부됨 (single-flight).
 *
 * <p>대기열에 넣지 않고 즉시 거부합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class SessionBusyException extends GuardException {

    private final TenantId tenantId;

    public SessionBusyException(TenantId tenantId) {
        super(ErrorCategory.POOL_EXHAUSTED, "Session already active for " + tenantId);
        this.tenantId = tenantId;
    }

    public TenantId getTenantId() {
        return tenantId;
    }
}
