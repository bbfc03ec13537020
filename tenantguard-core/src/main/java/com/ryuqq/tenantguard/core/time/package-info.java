/**
 * 시간 추상화 패키지.
 *
 * <p>모든 시간 의존 로직은 {@link com.ryuqq.tenantguard.core.time.Clock}과
 * {@link com.ryuqq.tenantguard.core.time.Sleeper}를 주입받아 동작하며,
 * 테스트에서는 {@link com.ryuqq.tenantguard.core.time.ManualClock}으로 대체합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.core.time;
