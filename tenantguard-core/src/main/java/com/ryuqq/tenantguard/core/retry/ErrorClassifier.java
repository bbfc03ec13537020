package com.ryuqq.tenantguard.core.retry;

import com.ryuqq.tenantguard.core.exception.ErrorCategory;
import com.ryuqq.tenantguard.core.exception.RateLimitedException;

import java.time.Duration;
import java.util.Optional;

/**
 * 업스트림 오류 분류 전략.
 *
 * <p>{@code RetryExecutor}와 {@code GuardedExecutor}에 주입되어 재시도 정책 선택과
 * 대기 힌트 추출에 사용됩니다. 기본 구현은 {@link TypedErrorClassifier}입니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public interface ErrorClassifier {

    /**
     * 오류 분류.
     *
     * @param error 업스트림 호출이 던진 예외
     * @return 분류 결과 (null 아님)
     */
    ErrorCategory classify(Throwable error);

    /**
     * 업스트림이 알려준 대기 시간 추출.
     *
     * <p>기본 구현은 cause 체인에서 {@link RateLimitedException}을 찾아 그 대기 힌트를 반환합니다.</p>
     *
     * @param error 업스트림 호출이 던진 예외
     * @return 대기 힌트 (없으면 empty)
     */
    default Optional<Duration> waitHint(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < TypedErrorClassifier.MAX_CAUSE_DEPTH) {
            if (current instanceof RateLimitedException rateLimited) {
                return rateLimited.getRetryAfter();
            }
            current = current.getCause();
            depth++;
        }
        return Optional.empty();
    }
}
