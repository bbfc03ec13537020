package com.ryuqq.tenantguard.core.protection;

/**
 * Circuit Breaker 설정.
 *
 * @param failureThreshold CLOSED에서 OPEN으로 전이하는 연속 실패 수
 * @param successThreshold HALF_OPEN에서 CLOSED로 전이하는 연속 성공 수
 * @param timeoutMs OPEN 유지 시간 (쿨다운, 밀리초)
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(int failureThreshold, int successThreshold, long timeoutMs) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 값이 양수가 아닌 경우
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException(
                "successThreshold must be positive (current: " + successThreshold + ")"
            );
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be positive (current: " + timeoutMs + ")"
            );
        }
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs);
    }

    /**
     * successThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs);
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withTimeoutMs(long timeoutMs) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutMs);
    }
}
