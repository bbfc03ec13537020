package com.ryuqq.tenantguard.core.retry;

/**
 * 재시도 지연 계산 방식.
 *
 * <p>attempt는 0부터 시작합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public enum BackoffStrategy {

    /** {@code base * exponentialBase^attempt} */
    EXPONENTIAL,

    /** {@code base * (attempt + 1)} */
    LINEAR,

    /** {@code base} */
    FIXED,

    /** {@code base * fib(attempt)}, fib(0) = fib(1) = 1 */
    FIBONACCI
}
