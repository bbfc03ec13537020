package com.ryuqq.tenantguard.core.exception;

/**
 * 재시도 루프가 영구 오류로 판단하여 즉시 종료했음을 알리는 오류.
 *
 * <p>원본 예외 타입과 관계없이 호출자는 항상 이 타입을 받으며,
 * 원본은 {@link #getCause()}로 확인할 수 있습니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class NonRetryableException extends GuardException {

    private final int attempts;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param attempts 실제 호출 횟수
     * @param cause 원본 예외
     */
    public NonRetryableException(String message, int attempts, Throwable cause) {
        super(ErrorCategory.PERMANENT, message, cause);
        this.attempts = attempts;
    }

    /**
     * 실제 호출 횟수.
     *
     * @return 호출 횟수 (1 이상)
     */
    public int getAttempts() {
        return attempts;
    }
}
