/**
 * 보호 계층 구성 진입점.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.application.guard;
