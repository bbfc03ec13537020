package com.ryuqq.tenantguard.application.config;

import com.ryuqq.tenantguard.application.executor.GuardedExecutorConfig;
import com.ryuqq.tenantguard.core.health.HealthThresholds;
import com.ryuqq.tenantguard.core.protection.CircuitBreakerConfig;
import com.ryuqq.tenantguard.core.ratelimit.RateLimiterConfig;
import com.ryuqq.tenantguard.core.retry.RetryPolicies;
import com.ryuqq.tenantguard.core.session.SessionPoolConfig;

import java.util.Objects;

/**
 * TenantGuard 전체 설정.
 *
 * @param rateLimiter 레이트 리미터 설정
 * @param circuitBreaker 테넌트 브레이커 설정
 * @param retry 분류별 재시도 정책
 * @param health 건강 평가 임계값
 * @param session 세션 풀 설정
 * @param executor 실행기 설정
 * @param tenantIdleTtlMs 이 시간 동안 활동이 없는 테넌트 엔트리는 정리 대상
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record TenantGuardConfig(
    RateLimiterConfig rateLimiter,
    CircuitBreakerConfig circuitBreaker,
    RetryPolicies retry,
    HealthThresholds health,
    SessionPoolConfig session,
    GuardedExecutorConfig executor,
    long tenantIdleTtlMs
) {

    public TenantGuardConfig {
        Objects.requireNonNull(rateLimiter, "rateLimiter cannot be null");
        Objects.requireNonNull(circuitBreaker, "circuitBreaker cannot be null");
        Objects.requireNonNull(retry, "retry cannot be null");
        Objects.requireNonNull(health, "health cannot be null");
        Objects.requireNonNull(session, "session cannot be null");
        Objects.requireNonNull(executor, "executor cannot be null");
        if (tenantIdleTtlMs <= 0) {
            throw new IllegalArgumentException(
                "tenantIdleTtlMs must be positive (current: " + tenantIdleTtlMs + ")"
            );
        }
    }

    public TenantGuardConfig withRateLimiter(RateLimiterConfig rateLimiter) {
        return new TenantGuardConfig(rateLimiter, circuitBreaker, retry, health, session, executor, tenantIdleTtlMs);
    }

    public TenantGuardConfig withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new TenantGuardConfig(rateLimiter, circuitBreaker, retry, health, session, executor, tenantIdleTtlMs);
    }

    public TenantGuardConfig withRetry(RetryPolicies retry) {
        return new TenantGuardConfig(rateLimiter, circuitBreaker, retry, health, session, executor, tenantIdleTtlMs);
    }

    public TenantGuardConfig withHealth(HealthThresholds health) {
        return new TenantGuardConfig(rateLimiter, circuitBreaker, retry, health, session, executor, tenantIdleTtlMs);
    }

    public TenantGuardConfig withSession(SessionPoolConfig session) {
        return new TenantGuardConfig(rateLimiter, circuitBreaker, retry, health, session, executor, tenantIdleTtlMs);
    }

    public TenantGuardConfig withExecutor(GuardedExecutorConfig executor) {
        return new TenantGuardConfig(rateLimiter, circuitBreaker, retry, health, session, executor, tenantIdleTtlMs);
    }
}
