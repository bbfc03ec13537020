package com.ryuqq.tenantguard.core.executor;

import com.ryuqq.tenantguard.core.session.SessionSlot;

/**
 * 점유한 세션 안에서 실행하는 업스트림 호출.
 *
 * <p>호출은 슬롯의 카운터({@link SessionSlot#recordMessage()} 등)로 처리량을 보고할 수 있습니다.</p>
 *
 * @param <T> 호출 결과 타입
 * @author TenantGuard Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SessionCall<T> {

    /**
     * 세션 안에서 업스트림 호출 실행.
     *
     * @param session 점유한 세션
     * @return 호출 결과
     * @throws Exception 업스트림 오류
     */
    T call(SessionSlot session) throws Exception;
}
