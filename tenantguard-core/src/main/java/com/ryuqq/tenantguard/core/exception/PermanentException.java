package com.ryuqq.tenantguard.core.exception;

/**
 * 재시도해도 성공할 수 없는 업스트림 오류.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>토큰 인증 실패 (401 Unauthorized)</li>
 *   <li>차단되거나 비활성화된 봇 아이덴티티</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class PermanentException extends GuardException {

    public PermanentException(String message) {
        super(ErrorCategory.PERMANENT, message);
    }

    public PermanentException(String message, Throwable cause) {
        super(ErrorCategory.PERMANENT, message, cause);
    }
}
