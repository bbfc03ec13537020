package com.ryuqq.tenantguard.application.executor;

/**
 * GuardedExecutor 설정.
 *
 * @param tokensPerCall 호출 하나가 소비하는 토큰 수
 * @param maxAdmissionWaitMs 레이트 리밋 거부 시 최대 대기 시간 (0이면 대기 없이 실패)
 * @param asyncWorkers {@code submit}에 사용하는 공유 워커 스레드 수
 * @param shutdownTimeoutMs 종료 시 진행 중 작업을 기다리는 시간
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record GuardedExecutorConfig(
    int tokensPerCall,
    long maxAdmissionWaitMs,
    int asyncWorkers,
    long shutdownTimeoutMs
) {

    public GuardedExecutorConfig {
        if (tokensPerCall <= 0) {
            throw new IllegalArgumentException(
                "tokensPerCall must be positive (current: " + tokensPerCall + ")"
            );
        }
        if (maxAdmissionWaitMs < 0) {
            throw new IllegalArgumentException(
                "maxAdmissionWaitMs must be non-negative (current: " + maxAdmissionWaitMs + ")"
            );
        }
        if (asyncWorkers <= 0) {
            throw new IllegalArgumentException(
                "asyncWorkers must be positive (current: " + asyncWorkers + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public GuardedExecutorConfig withMaxAdmissionWaitMs(long maxAdmissionWaitMs) {
        return new GuardedExecutorConfig(tokensPerCall, maxAdmissionWaitMs, asyncWorkers, shutdownTimeoutMs);
    }

    public GuardedExecutorConfig withAsyncWorkers(int asyncWorkers) {
        return new GuardedExecutorConfig(tokensPerCall, maxAdmissionWaitMs, asyncWorkers, shutdownTimeoutMs);
    }
}
