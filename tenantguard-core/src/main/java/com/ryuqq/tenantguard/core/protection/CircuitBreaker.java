package com.ryuqq.tenantguard.core.protection;

import com.ryuqq.tenantguard.core.exception.CircuitOpenException;
import com.ryuqq.tenantguard.core.executor.UpstreamCall;
import com.ryuqq.tenantguard.core.model.TenantId;

/**
 * 테넌트 단위 Circuit Breaker.
 *
 * <p>테넌트의 업스트림 호출 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 실패 중인 아이덴티티로 호출이 계속 나가는 것을 막습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = registry.getBreaker(tenantId);
 *
 * try {
 *     Message sent = cb.call(() -> botClient.sendMessage(chatId, text));
 * } catch (CircuitOpenException e) {
 *     // OPEN 상태: e.getTimeoutRemaining() 이후 다시 시도
 * }
 * }</pre>
 *
 * <p>수동 제어가 필요한 경우 {@link #tryAcquire()} / {@link #recordSuccess()} /
 * {@link #recordFailure(Throwable)}를 직접 사용할 수 있습니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 이 브레이커가 보호하는 테넌트.
     *
     * @return 테넌트 ID
     */
    TenantId getTenantId();

    /**
     * 브레이커로 감싸서 호출 실행.
     *
     * <p>OPEN 상태이고 쿨다운이 남아 있으면 호출하지 않고 {@link CircuitOpenException}을 던집니다.
     * 호출 결과에 따라 카운터와 상태를 갱신한 뒤, 호출이 던진 예외는 그대로 다시 던집니다.</p>
     *
     * @param call 업스트림 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws CircuitOpenException OPEN 상태에서 거부된 경우
     * @throws Exception 호출이 던진 원본 예외
     */
    <T> T call(UpstreamCall<T> call) throws Exception;

    /**
     * 호출 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED, HALF_OPEN: true</li>
     *   <li>OPEN + 쿨다운 경과: HALF_OPEN으로 전이 후 true</li>
     *   <li>OPEN + 쿨다운 남음: false (실패로 집계하지 않음)</li>
     * </ul>
     *
     * @return true: 호출 허용, false: 호출 차단
     */
    boolean tryAcquire();

    /**
     * 호출 성공 기록.
     */
    void recordSuccess();

    /**
     * 호출 실패 기록.
     *
     * @param throwable 발생한 예외
     */
    void recordFailure(Throwable throwable);

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 현재 상태 스냅샷 조회.
     *
     * @return 카운터와 남은 쿨다운을 포함한 스냅샷
     */
    CircuitBreakerSnapshot snapshot();

    /**
     * CLOSED 상태로 강제 리셋.
     *
     * <p>관리자의 수동 복구에 사용됩니다.</p>
     */
    void reset();
}
