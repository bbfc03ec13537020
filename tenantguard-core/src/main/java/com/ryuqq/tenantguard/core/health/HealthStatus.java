package com.ryuqq.tenantguard.core.health;

/**
 * 테넌트 건강 상태.
 *
 * <p>SUSPENDED는 관리자 조치로만 설정/해제되며 자동 평가 대상이 아닙니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public enum HealthStatus {

    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy"),
    SUSPENDED("suspended");

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 관리 화면의 "문제 테넌트" 목록에 포함되는 상태인지 확인.
     *
     * @return UNHEALTHY 또는 SUSPENDED이면 true
     */
    public boolean isProblematic() {
        return this == UNHEALTHY || this == SUSPENDED;
    }
}
