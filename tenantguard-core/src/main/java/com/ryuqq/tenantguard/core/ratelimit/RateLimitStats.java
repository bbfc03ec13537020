package com.ryuqq.tenantguard.core.ratelimit;

/**
 * 범위별 레이트 리밋 통계 (관리 화면 노출용).
 *
 * @param scope 범위
 * @param totalBuckets 현재 보유 중인 버킷 수
 * @param config 해당 범위의 버킷 설정
 * @param averageAvailableTokens 버킷 평균 가용 토큰 수
 * @param throttledBuckets 업스트림 대기 힌트로 차단 중인 버킷 수
 * @param allowedCount 허용 누적 횟수
 * @param rejectedCount 거부 누적 횟수
 * @param failOpenCount 저장소 장애로 fail-open 허용한 누적 횟수
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record RateLimitStats(
    LimitScope scope,
    int totalBuckets,
    BucketConfig config,
    double averageAvailableTokens,
    int throttledBuckets,
    long allowedCount,
    long rejectedCount,
    long failOpenCount
) {
}
