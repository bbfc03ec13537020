package com.ryuqq.tenantguard.core.ratelimit;

import java.time.Duration;

/**
 * 토큰 버킷 상태 (불변 record).
 *
 * <p>모든 연산은 새 인스턴스를 반환하므로 {@link com.ryuqq.tenantguard.core.spi.BucketStore}의
 * compare-and-update 갱신 함수 안에서 그대로 사용할 수 있습니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * tokens = min(capacity, tokens + elapsedSeconds * refillRate)
 * tokens >= requested → tokens -= requested, 허용
 * 그 외 → retryAfter = (requested - tokens) / refillRate, 거부
 * 차단 중 → retryAfter = (blockedUntil - now) + (requested - tokens) / refillRate, 거부
 * </pre>
 *
 * <p><strong>불변식:</strong> 0 ≤ tokens ≤ capacity (모든 인스턴스에서 생성자가 검증)</p>
 *
 * <p>{@code blockedUntilNanos}는 업스트림이 알려준 대기 힌트를 반영한 차단 시각입니다.
 * 이 시각 전의 요청은 토큰 잔량과 무관하게 거부됩니다.</p>
 *
 * @param capacity 최대 토큰 수
 * @param refillRatePerSecond 초당 리필 토큰 수
 * @param tokens 현재 토큰 수
 * @param lastRefillNanos 마지막 리필 시각 (단조 나노초)
 * @param blockedUntilNanos 차단 해제 시각 (차단 없으면 Long.MIN_VALUE)
 * @param lastAccessNanos 마지막 접근 시각 (유휴 버킷 정리 기준)
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record TokenBucket(
    int capacity,
    double refillRatePerSecond,
    double tokens,
    long lastRefillNanos,
    long blockedUntilNanos,
    long lastAccessNanos
) {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;
    private static final long NOT_BLOCKED = Long.MIN_VALUE;

    public TokenBucket {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        if (!(refillRatePerSecond > 0)) {
            throw new IllegalArgumentException(
                "refillRatePerSecond must be positive (current: " + refillRatePerSecond + ")"
            );
        }
        if (tokens < 0 || tokens > capacity || Double.isNaN(tokens)) {
            throw new IllegalArgumentException(
                "tokens must be between 0 and " + capacity + " (current: " + tokens + ")"
            );
        }
    }

    /**
     * 가득 찬 버킷 생성.
     *
     * @param config 버킷 설정
     * @param nowNanos 현재 시각
     * @return 새 버킷
     */
    public static TokenBucket full(BucketConfig config, long nowNanos) {
        return new TokenBucket(config.capacity(), config.refillRatePerSecond(), config.capacity(),
            nowNanos, NOT_BLOCKED, nowNanos);
    }

    /**
     * 경과 시간만큼 토큰 리필.
     *
     * <p>시계가 뒤로 가거나 차단 중(lastRefill이 미래)이면 토큰을 더하지 않습니다.</p>
     *
     * @param nowNanos 현재 시각
     * @return 리필된 버킷
     */
    public TokenBucket refill(long nowNanos) {
        long elapsed = nowNanos - lastRefillNanos;
        if (elapsed <= 0) {
            return this;
        }
        double refilled = Math.min(capacity, tokens + (elapsed / NANOS_PER_SECOND) * refillRatePerSecond);
        return new TokenBucket(capacity, refillRatePerSecond, refilled, nowNanos, blockedUntilNanos, lastAccessNanos);
    }

    /**
     * 토큰 소비 시도.
     *
     * @param requested 요청 토큰 수 (1 이상, capacity 이하)
     * @param nowNanos 현재 시각
     * @return 갱신된 버킷과 판정
     * @throws IllegalArgumentException requested가 범위를 벗어난 경우
     */
    public Consumption tryConsume(int requested, long nowNanos) {
        if (requested <= 0) {
            throw new IllegalArgumentException("requested must be positive (current: " + requested + ")");
        }
        if (requested > capacity) {
            throw new IllegalArgumentException(
                "requested cannot exceed capacity (requested: " + requested + ", capacity: " + capacity + ")"
            );
        }

        TokenBucket current = refill(nowNanos).touch(nowNanos);

        if (current.isBlocked(nowNanos)) {
            double missingAtRelease = Math.max(0d, requested - current.tokens);
            long blockedFor = blockedUntilNanos - nowNanos;
            if (blockedFor < 0) {
                blockedFor = Long.MAX_VALUE;
            }
            long retryAfterNanos = saturatedAdd(blockedFor, nanosToRefill(missingAtRelease));
            return new Consumption(current, RateLimitDecision.reject(Duration.ofNanos(retryAfterNanos)));
        }

        if (current.tokens >= requested) {
            TokenBucket consumed = new TokenBucket(capacity, refillRatePerSecond, current.tokens - requested,
                current.lastRefillNanos, current.blockedUntilNanos, current.lastAccessNanos);
            return new Consumption(consumed, RateLimitDecision.allow());
        }

        double missing = requested - current.tokens;
        return new Consumption(current, RateLimitDecision.reject(Duration.ofNanos(nanosToRefill(missing))));
    }

    /**
     * 소비했던 토큰 반환 (capacity 초과분은 버림).
     *
     * @param amount 반환할 토큰 수
     * @return 갱신된 버킷
     */
    public TokenBucket refund(int amount) {
        if (amount <= 0) {
            return this;
        }
        return new TokenBucket(capacity, refillRatePerSecond, Math.min(capacity, tokens + amount),
            lastRefillNanos, blockedUntilNanos, lastAccessNanos);
    }

    /**
     * 업스트림 대기 힌트를 반영하여 버킷을 비우고 일정 시간 차단.
     *
     * <p>차단이 끝나는 시점부터 다시 리필이 시작됩니다. 이미 더 긴 차단이 있으면 유지합니다.
     * 차단 해제 시각은 {@code Long.MAX_VALUE}에서 포화됩니다.</p>
     *
     * @param waitHint 업스트림이 지정한 대기 시간
     * @param nowNanos 현재 시각
     * @return 갱신된 버킷
     */
    public TokenBucket throttle(Duration waitHint, long nowNanos) {
        long until = saturatedAdd(nowNanos, toNanosSaturated(waitHint));
        long blockedUntil = Math.max(until, blockedUntilNanos);
        long refillFrom = Math.max(lastRefillNanos, blockedUntil);
        return new TokenBucket(capacity, refillRatePerSecond, 0d, refillFrom, blockedUntil, nowNanos);
    }

    /**
     * 현재 시각 기준 사용 가능한 토큰 수.
     *
     * @param nowNanos 현재 시각
     * @return 리필 후 토큰 수
     */
    public double availableTokens(long nowNanos) {
        return refill(nowNanos).tokens;
    }

    /**
     * 차단 중인지 확인.
     *
     * @param nowNanos 현재 시각
     * @return 차단 해제 시각 전이면 true
     */
    public boolean isBlocked(long nowNanos) {
        return blockedUntilNanos != NOT_BLOCKED && nowNanos < blockedUntilNanos;
    }

    /**
     * 지정 시각 이후로 접근이 없었는지 확인.
     *
     * @param cutoffNanos 기준 시각
     * @return 마지막 접근이 기준 시각보다 이전이면 true
     */
    public boolean isIdleSince(long cutoffNanos) {
        return lastAccessNanos < cutoffNanos;
    }

    private long nanosToRefill(double missingTokens) {
        if (missingTokens <= 0) {
            return 0L;
        }
        double nanos = Math.ceil(missingTokens / refillRatePerSecond * NANOS_PER_SECOND);
        return nanos >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) nanos;
    }

    private static long toNanosSaturated(Duration duration) {
        if (duration.isNegative()) {
            return 0L;
        }
        if (duration.getSeconds() >= Long.MAX_VALUE / 1_000_000_000L) {
            return Long.MAX_VALUE;
        }
        return duration.toNanos();
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        if (((a ^ sum) & (b ^ sum)) < 0) {
            return a < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return sum;
    }

    private TokenBucket touch(long nowNanos) {
        if (nowNanos <= lastAccessNanos) {
            return this;
        }
        return new TokenBucket(capacity, refillRatePerSecond, tokens, lastRefillNanos, blockedUntilNanos, nowNanos);
    }

    /**
     * 토큰 소비 결과.
     *
     * @param bucket 갱신된 버킷
     * @param decision 판정
     */
    public record Consumption(TokenBucket bucket, RateLimitDecision decision) {
    }
}
