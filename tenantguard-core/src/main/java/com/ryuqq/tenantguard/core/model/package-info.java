/**
 * Core 도메인 값 타입 패키지.
 *
 * <p>테넌트 식별자처럼 모든 보호 컴포넌트가 공유하는 불변 값 타입을 정의합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.core.model;
