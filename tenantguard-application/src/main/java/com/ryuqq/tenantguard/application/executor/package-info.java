/**
 * 보호된 업스트림 호출 실행.
 *
 * <p>{@link com.ryuqq.tenantguard.application.executor.GuardedExecutor}가 레이트 리밋,
 * Circuit Breaker, 재시도, 건강 기록, 세션 관리를 하나의 호출 흐름으로 묶습니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.application.executor;
