/**
 * 테넌트 건강 지표와 상태 평가.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.core.health;
