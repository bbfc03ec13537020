/**
 * Runner Adapter Layer - 감독되는 백그라운드 작업.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tenantguard.adapter.runner.MaintenanceScheduler} - 취소 핸들과 종료 대기를 갖춘 주기 작업 스케줄러</li>
 *   <li>{@link com.ryuqq.tenantguard.adapter.runner.StaleSessionReaper} - 오래된 세션 회수</li>
 *   <li>{@link com.ryuqq.tenantguard.adapter.runner.IdleResourceReaper} - 유휴 버킷/테넌트 정리</li>
 *   <li>{@link com.ryuqq.tenantguard.adapter.runner.HealthSnapshotPersister} - 건강 스냅샷 저장/복원</li>
 *   <li>{@link com.ryuqq.tenantguard.adapter.runner.TenantGuardRuntime} - 위 작업과 TenantGuard 생명주기</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (TenantGuardRuntime, reapers)
 *   ↓ uses
 * application (TenantGuard, SessionPool, TenantRateLimiter, TenantRegistry)
 *   ↓ depends on
 * core (TokenBucket, TenantCircuitBreaker, HealthMetrics, SPI)
 * </pre>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.adapter.runner;
