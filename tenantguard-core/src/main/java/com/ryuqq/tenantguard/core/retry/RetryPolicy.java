package com.ryuqq.tenantguard.core.retry;

import java.util.Objects;

/**
 * 오류 분류 하나에 적용되는 재시도 정책.
 *
 * <p><strong>불변식:</strong> 계산된 모든 지연은 {@code maxDelayMs} 이하입니다
 * ({@link BackoffCalculator}가 보장).</p>
 *
 * @param maxRetries 최대 재시도 횟수 (0이면 재시도하지 않음)
 * @param baseDelayMs 기본 지연 (밀리초)
 * @param maxDelayMs 최대 지연 (밀리초)
 * @param strategy 지연 계산 방식
 * @param exponentialBase EXPONENTIAL 방식의 밑 (1.0 이상)
 * @param jitter ±25% jitter 적용 여부
 * @param honorServerWait 업스트림이 대기 시간을 알려주면 그대로 따를지 여부
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxRetries,
    long baseDelayMs,
    long maxDelayMs,
    BackoffStrategy strategy,
    double exponentialBase,
    boolean jitter,
    boolean honorServerWait
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 값이 범위를 벗어난 경우
     */
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be non-negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        Objects.requireNonNull(strategy, "strategy cannot be null");
        if (!(exponentialBase >= 1.0)) {
            throw new IllegalArgumentException(
                "exponentialBase must be >= 1.0 (current: " + exponentialBase + ")"
            );
        }
    }

    /**
     * 재시도하지 않는 정책.
     *
     * <p>PERMANENT, CIRCUIT_OPEN, POOL_EXHAUSTED 분류에 사용됩니다.</p>
     *
     * @return maxRetries=0 정책
     */
    public static RetryPolicy none() {
        return new RetryPolicy(0, 0, 0, BackoffStrategy.FIXED, 1.0, false, false);
    }

    public RetryPolicy withMaxRetries(int maxRetries) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxDelayMs, strategy, exponentialBase, jitter, honorServerWait);
    }

    public RetryPolicy withBaseDelayMs(long baseDelayMs) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxDelayMs, strategy, exponentialBase, jitter, honorServerWait);
    }

    public RetryPolicy withMaxDelayMs(long maxDelayMs) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxDelayMs, strategy, exponentialBase, jitter, honorServerWait);
    }

    public RetryPolicy withStrategy(BackoffStrategy strategy) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxDelayMs, strategy, exponentialBase, jitter, honorServerWait);
    }

    public RetryPolicy withJitter(boolean jitter) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxDelayMs, strategy, exponentialBase, jitter, honorServerWait);
    }

    public RetryPolicy withHonorServerWait(boolean honorServerWait) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxDelayMs, strategy, exponentialBase, jitter, honorServerWait);
    }
}
