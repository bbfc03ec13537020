package com.ryuqq.tenantguard.core.exception;

/**
 * 타임아웃, 연결 끊김, 5xx 상당의 일시적 업스트림 오류.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class TransientNetworkException extends GuardException {

    public TransientNetworkException(String message) {
        super(ErrorCategory.TRANSIENT_NETWORK, message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(ErrorCategory.TRANSIENT_NETWORK, message, cause);
    }
}
