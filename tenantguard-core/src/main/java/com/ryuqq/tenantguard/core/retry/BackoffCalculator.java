package com.ryuqq.tenantguard.core.retry;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 재시도 지연 계산기.
 *
 * <p>{@link RetryPolicy}의 전략으로 원시 지연을 계산하고, jitter가 켜져 있으면 ±25% 흔든 뒤
 * {@code [0, maxDelayMs]} 범위로 제한합니다.</p>
 *
 * <p><strong>알고리즘 (attempt는 0부터):</strong></p>
 * <pre>
 * EXPONENTIAL: base * exponentialBase^attempt
 * LINEAR:      base * (attempt + 1)
 * FIXED:       base
 * FIBONACCI:   base * fib(attempt)      (1, 1, 2, 3, 5, ...)
 * jitter:      delay * (1 + random(-0.25, +0.25))
 * delay = clamp(delay, 0, maxDelay)
 * </pre>
 *
 * <p><strong>예시 (base=1000ms, exponentialBase=2, maxDelay=30000ms, jitter 없음):</strong></p>
 * <ul>
 *   <li>attempt=0: 1000ms</li>
 *   <li>attempt=1: 2000ms</li>
 *   <li>attempt=2: 4000ms</li>
 *   <li>attempt=5: 32000ms → 30000ms (maxDelay로 제한)</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final double JITTER_RANGE = 0.25;
    private static final int MAX_FIBONACCI_INDEX = 90;

    private final RetryPolicy policy;
    private final DoubleSupplier random;

    /**
     * 기본 난수원으로 생성.
     *
     * @param policy 재시도 정책
     */
    public BackoffCalculator(RetryPolicy policy) {
        this(policy, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수원을 지정하여 생성.
     *
     * @param policy 재시도 정책
     * @param random [0, 1) 범위 난수 공급자
     */
    public BackoffCalculator(RetryPolicy policy, DoubleSupplier random) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 재시도 순번 (0부터 시작)
     * @return 재시도 전 대기 시간 (밀리초, 0 이상 maxDelayMs 이하)
     * @throws IllegalArgumentException attempt가 음수인 경우
     */
    public long calculateDelayMs(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException(
                "attempt must be non-negative (current: " + attempt + ")"
            );
        }

        double base = policy.baseDelayMs();
        double delay = switch (policy.strategy()) {
            case EXPONENTIAL -> base * Math.pow(policy.exponentialBase(), attempt);
            case LINEAR -> base * (attempt + 1.0);
            case FIXED -> base;
            case FIBONACCI -> base * fibonacci(attempt);
        };

        if (policy.jitter()) {
            double factor = 1.0 + (random.getAsDouble() * 2.0 - 1.0) * JITTER_RANGE;
            delay = delay * factor;
        }

        // pow 오버플로우(Infinity)와 NaN 모두 상한으로 수렴
        if (Double.isNaN(delay) || delay >= policy.maxDelayMs()) {
            return policy.maxDelayMs();
        }
        return Math.max(0L, Math.round(delay));
    }

    /**
     * 적용 중인 정책 조회.
     *
     * @return 재시도 정책
     */
    public RetryPolicy getPolicy() {
        return policy;
    }

    static double fibonacci(int n) {
        int bounded = Math.min(n, MAX_FIBONACCI_INDEX);
        double previous = 1;
        double current = 1;
        for (int i = 2; i <= bounded; i++) {
            double next = previous + current;
            previous = current;
            current = next;
        }
        return current;
    }
}
