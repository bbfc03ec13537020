package com.ryuqq.tenantguard.core.session;

/**
 * 세션 풀 현황.
 *
 * @param activeSessions 현재 열린 세션 수
 * @param maxTotalConnections 설정된 상한
 * @param availablePermits 남은 전역 슬롯
 * @param utilization activeSessions / maxTotalConnections
 * @param recentSessions 평균 계산에 사용된 최근 이력 건수
 * @param avgDurationMs 최근 세션 평균 점유 시간
 * @param avgMessages 최근 세션 평균 메시지 수
 * @param avgChannels 최근 세션 평균 채널 수
 * @param recentErrors 최근 세션 오류 합계
 * @param staleSessionsReclaimed 누적 강제 회수 건수
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record PoolStatus(
    int activeSessions,
    int maxTotalConnections,
    int availablePermits,
    double utilization,
    int recentSessions,
    double avgDurationMs,
    double avgMessages,
    double avgChannels,
    long recentErrors,
    long staleSessionsReclaimed
) {
}
