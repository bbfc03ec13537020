package com.ryuqq.tenantguard.core.exception;

import com.ryuqq.tenantguard.core.model.TenantId;

import java.time.Duration;

/**
 * 로컬 레이트 리미터(전역 또는 테넌트 버킷)가 호출을 허용하지 않음.
 *
 * <p>업스트림의 429와 구분되는 로컬 거부입니다. 호출자는
 * {@link #getRetryAfter()} 이후에 다시 시도할 수 있습니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class RateLimitExceededException extends GuardException {

    private final TenantId tenantId;
    private final Duration retryAfter;

    public RateLimitExceededException(TenantId tenantId, Duration retryAfter) {
        super(ErrorCategory.RATE_LIMITED,
            "Rate limit exceeded for " + tenantId + " (retry after " + retryAfter.toMillis() + "ms)");
        this.tenantId = tenantId;
        this.retryAfter = retryAfter;
    }

    public TenantId getTenantId() {
        return tenantId;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
