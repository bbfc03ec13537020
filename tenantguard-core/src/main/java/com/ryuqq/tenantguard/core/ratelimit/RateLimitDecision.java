package com.ryuqq.tenantguard.core.ratelimit;

import java.time.Duration;

/**
 * 레이트 리밋 판정 결과.
 *
 * @param allowed 허용 여부
 * @param retryAfter 거부 시 다시 시도할 수 있기까지의 시간 (허용 시 0)
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record RateLimitDecision(boolean allowed, Duration retryAfter) {

    private static final RateLimitDecision ALLOW = new RateLimitDecision(true, Duration.ZERO);

    public RateLimitDecision {
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be non-negative (current: " + retryAfter + ")");
        }
        if (allowed && !retryAfter.isZero()) {
            throw new IllegalArgumentException("allowed decision cannot carry retryAfter");
        }
    }

    public static RateLimitDecision allow() {
        return ALLOW;
    }

    public static RateLimitDecision reject(Duration retryAfter) {
        return new RateLimitDecision(false, retryAfter);
    }

    /**
     * 초 단위 retryAfter.
     *
     * @return retryAfter (초)
     */
    public double retryAfterSeconds() {
        return retryAfter.toNanos() / 1_000_000_000d;
    }

    /**
     * 두 판정 결합 (둘 다 허용일 때만 허용, 거부 시 더 긴 retryAfter).
     *
     * @param other 다른 범위의 판정
     * @return 결합된 판정
     */
    public RateLimitDecision and(RateLimitDecision other) {
        if (allowed && other.allowed) {
            return ALLOW;
        }
        Duration longer = retryAfter.compareTo(other.retryAfter) >= 0 ? retryAfter : other.retryAfter;
        return reject(longer);
    }
}
