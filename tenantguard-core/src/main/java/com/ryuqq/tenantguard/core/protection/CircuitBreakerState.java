package com.ryuqq.tenantguard.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 테넌트의 업스트림 호출 실패를 추적하고,
 * 임계값 도달 시 요청을 차단하여 실패 중인 아이덴티티로의 호출을 멈춥니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 failureThreshold 도달)
 * OPEN (차단)
 *   │
 *   ▼ (timeout 경과 후 다음 호출)
 * HALF_OPEN (시험)
 *   │
 *   ├─► 연속 성공 successThreshold 도달 → CLOSED
 *   └─► 실패 1회 → OPEN
 * </pre>
 *
 * <p>모든 전이에서 failureCount와 successCount는 0으로 초기화됩니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>실패를 누적하며, 성공하면 누적된 실패 수를 초기화합니다.</p>
     */
    CLOSED("closed"),

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>timeout 이전의 요청은 남은 쿨다운과 함께 즉시 거부되며, 실패로 집계되지 않습니다.</p>
     */
    OPEN("open"),

    /**
     * 시험 상태 (복구 여부 확인).
     *
     * <p>성공이 successThreshold에 도달하면 CLOSED, 한 번이라도 실패하면 OPEN으로 전이합니다.</p>
     */
    HALF_OPEN("half_open");

    private final String value;

    CircuitBreakerState(String value) {
        this.value = value;
    }

    /**
     * 외부 노출용 소문자 값.
     *
     * @return "closed", "open", "half_open"
     */
    public String value() {
        return value;
    }
}
