/**
 * 테넌트 세션 모델.
 *
 * <p>테넌트당 OPEN 세션은 하나만 허용되며(single-flight), 전체 동시 세션 수는
 * {@link com.ryuqq.tenantguard.core.session.SessionPoolConfig#maxTotalConnections()}로 제한됩니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.core.session;
