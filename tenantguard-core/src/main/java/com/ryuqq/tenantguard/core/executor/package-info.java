/**
 * Executor 추상화 패키지.
 *
 * <p>보호 계층이 실행하는 실제 업스트림 호출의 함수형 계약
 * {@link com.ryuqq.tenantguard.core.executor.UpstreamCall}과 세션 안에서 실행하는
 * {@link com.ryuqq.tenantguard.core.executor.SessionCall}을 정의합니다.
 * 구체적인 업스트림 프로토콜 구현은 이 SDK의 범위 밖입니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.core.executor;
