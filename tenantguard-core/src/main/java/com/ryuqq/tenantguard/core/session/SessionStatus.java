package com.ryuqq.tenantguard.core.session;

/**
 * 세션 슬롯 상태.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public enum SessionStatus {
    OPEN,
    RELEASED
}
