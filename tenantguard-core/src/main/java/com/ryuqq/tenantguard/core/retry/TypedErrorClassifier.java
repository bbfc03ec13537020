package com.ryuqq.tenantguard.core.retry;

import com.ryuqq.tenantguard.core.exception.ErrorCategory;
import com.ryuqq.tenantguard.core.exception.GuardException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * 예외 타입 기반 기본 분류기.
 *
 * <p>cause 체인을 따라가며 처음 만나는 판별 가능한 타입으로 분류합니다.</p>
 * <ul>
 *   <li>{@link GuardException}: 예외가 가진 분류</li>
 *   <li>{@link IOException}, {@link TimeoutException}: TRANSIENT_NETWORK</li>
 *   <li>그 외: UNKNOWN</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class TypedErrorClassifier implements ErrorClassifier {

    static final int MAX_CAUSE_DEPTH = 16;

    @Override
    public ErrorCategory classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < MAX_CAUSE_DEPTH) {
            if (current instanceof GuardException guard) {
                return guard.getCategory();
            }
            if (current instanceof IOException || current instanceof TimeoutException) {
                return ErrorCategory.TRANSIENT_NETWORK;
            }
            current = current.getCause();
            depth++;
        }
        return ErrorCategory.UNKNOWN;
    }
}
