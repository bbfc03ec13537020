package com.ryuqq.tenantguard.core.ratelimit;

/**
 * 토큰 버킷 설정.
 *
 * @param capacity 버킷 최대 토큰 수 (버스트 허용량)
 * @param refillRatePerSecond 초당 리필 토큰 수
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record BucketConfig(int capacity, double refillRatePerSecond) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException capacity 또는 refillRatePerSecond가 양수가 아닌 경우
     */
    public BucketConfig {
        if (capacity <= 0) {
            throw new IllegalArgumentException(
                "capacity must be positive (current: " + capacity + ")"
            );
        }
        if (!(refillRatePerSecond > 0) || Double.isInfinite(refillRatePerSecond)) {
            throw new IllegalArgumentException(
                "refillRatePerSecond must be positive (current: " + refillRatePerSecond + ")"
            );
        }
    }

    /**
     * 빈 버킷이 가득 차기까지 걸리는 시간 (초).
     *
     * @return capacity / refillRatePerSecond
     */
    public double secondsToFill() {
        return capacity / refillRatePerSecond;
    }
}
