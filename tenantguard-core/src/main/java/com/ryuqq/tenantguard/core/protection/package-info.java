/**
 * 테넌트 단위 보호 장치 (Circuit Breaker).
 *
 * <p>실패 중인 테넌트로의 호출을 빠르게 차단하고, 쿨다운 후 시험 호출로 복구 여부를 확인합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.tenantguard.core.protection.CircuitBreaker} - 브레이커 계약</li>
 *   <li>{@link com.ryuqq.tenantguard.core.protection.TenantCircuitBreaker} - 기본 구현</li>
 *   <li>{@link com.ryuqq.tenantguard.core.protection.CircuitBreakerConfig} - 임계값과 쿨다운</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.core.protection;
