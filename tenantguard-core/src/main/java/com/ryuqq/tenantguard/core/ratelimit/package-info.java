/**
 * Token Bucket 레이트 리밋 모델 패키지.
 *
 * <p>{@link com.ryuqq.tenantguard.core.ratelimit.TokenBucket}은 순수 함수형 상태 전이만 제공하며,
 * 버킷 저장과 원자적 갱신은 {@link com.ryuqq.tenantguard.core.spi.BucketStore} 구현체가 담당합니다.</p>
 *
 * <h2>2단계 게이팅</h2>
 * <pre>
 * 호출 → GLOBAL 버킷 → TENANT 버킷 → 둘 다 허용 시 통과
 *                                   → 하나라도 거부 시 더 긴 retryAfter로 거부
 * </pre>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.core.ratelimit;
