/**
 * 테넌트 레이트 리미터.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.application.ratelimit;
