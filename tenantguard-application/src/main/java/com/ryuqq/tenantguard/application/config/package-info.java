/**
 * 설정 로딩.
 *
 * <p>모든 값은 외부 {@link java.util.Properties}에서 공급되며, 로직 안에 운영 기본값을 두지 않습니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.application.config;
