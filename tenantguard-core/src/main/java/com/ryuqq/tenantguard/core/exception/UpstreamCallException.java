package com.ryuqq.tenantguard.core.exception;

/**
 * 재시도 예산을 모두 소진한, 타입이 지정되지 않은 업스트림 오류.
 *
 * <p>업스트림 클라이언트가 {@link GuardException} 계열이 아닌 예외를 던진 경우
 * 보호 계층이 분류 결과와 함께 이 타입으로 감싸 호출자에게 전달합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class UpstreamCallException extends GuardException {

    public UpstreamCallException(ErrorCategory category, String message, Throwable cause) {
        super(category, message, cause);
    }
}
