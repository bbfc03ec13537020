package com.ryuqq.tenantguard.core.exception;

/**
 * 보호 계층이 호출자에게 전달하는 모든 오류의 상위 타입.
 *
 * <p>호출자는 {@link #getCategory()}만으로 오류 분류를 판단할 수 있으며,
 * 원본 업스트림 예외가 있으면 {@link #getCause()}로 보존됩니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public abstract class GuardException extends RuntimeException {

    private final ErrorCategory category;

    protected GuardException(ErrorCategory category, String message) {
        super(message);
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        this.category = category;
    }

    protected GuardException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        this.category = category;
    }

    /**
     * 오류 분류 조회.
     *
     * @return 오류 분류
     */
    public ErrorCategory getCategory() {
        return category;
    }
}
