package com.ryuqq.tenantguard.core.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * 업스트림이 반환한 레이트 리밋 오류.
 *
 * <p>업스트림 클라이언트 어댑터가 429 / FloodWait 계열 응답을 이 타입으로 변환해 던집니다.
 * 서버가 대기 시간을 지정한 경우 {@link #getRetryAfter()}로 전달되며,
 * 재시도 루프는 이 값을 그대로 사용합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class RateLimitedException extends GuardException {

    private final Duration retryAfter;

    /**
     * 대기 힌트 없이 생성.
     *
     * @param message 오류 메시지
     */
    public RateLimitedException(String message) {
        this(message, null, null);
    }

    /**
     * 대기 힌트와 함께 생성.
     *
     * @param message 오류 메시지
     * @param retryAfter 서버가 지정한 대기 시간 (null 허용)
     */
    public RateLimitedException(String message, Duration retryAfter) {
        this(message, retryAfter, null);
    }

    /**
     * 대기 힌트와 원인 예외와 함께 생성.
     *
     * @param message 오류 메시지
     * @param retryAfter 서버가 지정한 대기 시간 (null 허용)
     * @param cause 원인 예외 (null 허용)
     */
    public RateLimitedException(String message, Duration retryAfter, Throwable cause) {
        super(ErrorCategory.RATE_LIMITED, message, cause);
        if (retryAfter != null && retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter cannot be negative (current: " + retryAfter + ")");
        }
        this.retryAfter = retryAfter;
    }

    /**
     * 서버가 지정한 대기 시간.
     *
     * @return 대기 시간 (지정되지 않았으면 empty)
     */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
