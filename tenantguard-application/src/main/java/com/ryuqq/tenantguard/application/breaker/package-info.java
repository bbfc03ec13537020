/**
 * 테넌트별 Circuit Breaker 레지스트리.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.application.breaker;
