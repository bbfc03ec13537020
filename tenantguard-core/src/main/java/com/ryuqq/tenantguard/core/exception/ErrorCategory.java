package com.ryuqq.tenantguard.core.exception;

/**
 * 오류 분류 (닫힌 집합).
 *
 * <p>업스트림 호출 실패와 로컬 보호 장치의 거부를 하나의 분류 체계로 표현합니다.</p>
 *
 * <p><strong>전파 규칙:</strong></p>
 * <ul>
 *   <li>{@link #PERMANENT}, {@link #CIRCUIT_OPEN}, {@link #POOL_EXHAUSTED}: 재시도 없이 즉시 전파</li>
 *   <li>{@link #RATE_LIMITED}, {@link #TRANSIENT_NETWORK}, {@link #UNKNOWN}: 정책에 따라 재시도 후 전파</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public enum ErrorCategory {

    /**
     * 업스트림이 부과한 레이트 리밋 (대기 힌트를 동반하는 경우가 많음).
     */
    RATE_LIMITED,

    /**
     * 타임아웃, 연결 실패, 5xx 상당의 일시적 네트워크 오류.
     */
    TRANSIENT_NETWORK,

    /**
     * 인증 실패, 차단/비활성화된 아이덴티티 등 복구 불가능한 오류.
     */
    PERMANENT,

    /**
     * 로컬 서킷 브레이커의 거부 (업스트림 오류 아님).
     */
    CIRCUIT_OPEN,

    /**
     * 세션 풀 슬롯 획득 타임아웃.
     */
    POOL_EXHAUSTED,

    /**
     * 분류할 수 없는 오류.
     */
    UNKNOWN;

    /**
     * 재시도 정책의 대상이 되는 분류인지 확인.
     *
     * @return RATE_LIMITED, TRANSIENT_NETWORK, UNKNOWN이면 true
     */
    public boolean isRetryable() {
        return this == RATE_LIMITED || this == TRANSIENT_NETWORK || this == UNKNOWN;
    }
}
