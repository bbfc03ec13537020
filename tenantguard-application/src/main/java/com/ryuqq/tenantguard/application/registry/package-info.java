/**
 * 테넌트 상태 레지스트리.
 *
 * <p>전역 싱글톤 대신 명시적으로 생성되어 주입되는 {@link com.ryuqq.tenantguard.application.registry.TenantRegistry}가
 * 테넌트별 Circuit Breaker, 건강 지표, 세션 슬롯을 소유합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.application.registry;
