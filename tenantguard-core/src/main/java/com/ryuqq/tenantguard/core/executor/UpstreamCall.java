package com.ryuqq.tenantguard.core.executor;

/**
 * 보호 계층이 감싸서 실행하는 실제 업스트림 호출.
 *
 * <p>구현체는 업스트림 클라이언트가 던지는 예외를 그대로 전파해야 합니다.
 * 분류와 재시도는 보호 계층이 담당합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * UpstreamCall<Message> call = () -> botClient.sendMessage(chatId, text);
 * Message sent = guardedExecutor.execute(tenantId, call);
 * }</pre>
 *
 * @param <T> 호출 결과 타입
 * @author TenantGuard Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface UpstreamCall<T> {

    /**
     * 업스트림 호출 실행.
     *
     * @return 호출 결과
     * @throws Exception 업스트림 오류
     */
    T call() throws Exception;
}
