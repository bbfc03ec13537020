package com.ryuqq.tenantguard.core.ratelimit;

/**
 * 레이트 리밋 적용 범위.
 *
 * <p>모든 호출은 두 범위의 버킷을 모두 통과해야 합니다.</p>
 * <ul>
 *   <li>{@link #GLOBAL}: 공유 업스트림 예산 보호 (모든 테넌트가 하나의 버킷 공유)</li>
 *   <li>{@link #TENANT}: 테넌트 간 공정성 및 남용 방지 (테넌트마다 버킷 하나)</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public enum LimitScope {

    GLOBAL("global"),

    TENANT("tenant");

    private final String keyPart;

    LimitScope(String keyPart) {
        this.keyPart = keyPart;
    }

    /**
     * 버킷 키에 사용되는 범위 식별 문자열.
     *
     * @return 키 구성 요소 (예: "tenant")
     */
    public String keyPart() {
        return keyPart;
    }
}
