package com.ryuqq.tenantguard.core.retry;

import com.ryuqq.tenantguard.core.exception.ErrorCategory;

import java.util.Objects;

/**
 * 오류 분류별 재시도 정책 묶음.
 *
 * <p>재시도 가능한 분류(RATE_LIMITED, TRANSIENT_NETWORK, UNKNOWN)만 정책을 가지며,
 * 나머지 분류는 항상 {@link RetryPolicy#none()}입니다.</p>
 *
 * @param rateLimited RATE_LIMITED 정책
 * @param transientNetwork TRANSIENT_NETWORK 정책
 * @param unknown UNKNOWN 정책
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record RetryPolicies(RetryPolicy rateLimited, RetryPolicy transientNetwork, RetryPolicy unknown) {

    public RetryPolicies {
        Objects.requireNonNull(rateLimited, "rateLimited cannot be null");
        Objects.requireNonNull(transientNetwork, "transientNetwork cannot be null");
        Objects.requireNonNull(unknown, "unknown cannot be null");
    }

    /**
     * 분류에 맞는 정책 선택.
     *
     * @param category 오류 분류
     * @return 적용할 정책
     */
    public RetryPolicy forCategory(ErrorCategory category) {
        Objects.requireNonNull(category, "category cannot be null");
        return switch (category) {
            case RATE_LIMITED -> rateLimited;
            case TRANSIENT_NETWORK -> transientNetwork;
            case UNKNOWN -> unknown;
            case PERMANENT, CIRCUIT_OPEN, POOL_EXHAUSTED -> RetryPolicy.none();
        };
    }

    public RetryPolicies withRateLimited(RetryPolicy rateLimited) {
        return new RetryPolicies(rateLimited, transientNetwork, unknown);
    }

    public RetryPolicies withTransientNetwork(RetryPolicy transientNetwork) {
        return new RetryPolicies(rateLimited, transientNetwork, unknown);
    }

    public RetryPolicies withUnknown(RetryPolicy unknown) {
        return new RetryPolicies(rateLimited, transientNetwork, unknown);
    }
}
