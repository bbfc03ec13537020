package com.ryuqq.tenantguard.core.exception;

/**
 * 대기 지점(백오프 sleep, 레이트 리밋 대기, 세션 슬롯 대기)에서 작업이 취소됨.
 *
 * <p>이 예외를 던지기 전에 현재 스레드의 인터럽트 플래그를 복원합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class OperationCancelledException extends GuardException {

    public OperationCancelledException(String message, InterruptedException cause) {
        super(ErrorCategory.UNKNOWN, message, cause);
    }
}
