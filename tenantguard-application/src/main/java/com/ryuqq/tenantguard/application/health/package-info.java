/**
 * 테넌트 건강 모니터링.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.application.health;
