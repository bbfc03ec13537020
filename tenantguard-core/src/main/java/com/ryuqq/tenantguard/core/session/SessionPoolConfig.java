package com.ryuqq.tenantguard.core.session;

/**
 * 세션 풀 설정.
 *
 * @param maxTotalConnections 전체 테넌트 합산 동시 세션 상한
 * @param acquireTimeoutMs 전역 슬롯 획득 대기 시간 (밀리초)
 * @param sessionTimeoutMs 이 시간보다 오래 열린 세션은 강제 회수 (밀리초)
 * @param historySize 보관할 반납 이력 최대 건수
 * @param recentWindowSize 풀 상태 평균 계산에 쓰는 최근 이력 건수
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record SessionPoolConfig(
    int maxTotalConnections,
    long acquireTimeoutMs,
    long sessionTimeoutMs,
    int historySize,
    int recentWindowSize
) {

    public SessionPoolConfig {
        if (maxTotalConnections <= 0) {
            throw new IllegalArgumentException(
                "maxTotalConnections must be positive (current: " + maxTotalConnections + ")"
            );
        }
        if (acquireTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "acquireTimeoutMs must be non-negative (current: " + acquireTimeoutMs + ")"
            );
        }
        if (sessionTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "sessionTimeoutMs must be positive (current: " + sessionTimeoutMs + ")"
            );
        }
        if (historySize <= 0) {
            throw new IllegalArgumentException(
                "historySize must be positive (current: " + historySize + ")"
            );
        }
        if (recentWindowSize <= 0 || recentWindowSize > historySize) {
            throw new IllegalArgumentException(
                "recentWindowSize must be between 1 and historySize (current: " + recentWindowSize
                    + ", historySize: " + historySize + ")"
            );
        }
    }

    public SessionPoolConfig withMaxTotalConnections(int maxTotalConnections) {
        return new SessionPoolConfig(maxTotalConnections, acquireTimeoutMs, sessionTimeoutMs, historySize, recentWindowSize);
    }

    public SessionPoolConfig withAcquireTimeoutMs(long acquireTimeoutMs) {
        return new SessionPoolConfig(maxTotalConnections, acquireTimeoutMs, sessionTimeoutMs, historySize, recentWindowSize);
    }

    public SessionPoolConfig withSessionTimeoutMs(long sessionTimeoutMs) {
        return new SessionPoolConfig(maxTotalConnections, acquireTimeoutMs, sessionTimeoutMs, historySize, recentWindowSize);
    }
}
