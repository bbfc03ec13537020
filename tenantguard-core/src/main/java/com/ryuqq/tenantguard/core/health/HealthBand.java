package com.ryuqq.tenantguard.core.health;

/**
 * 전체 테넌트 중 HEALTHY 비율로 정한 등급.
 *
 * <ul>
 *   <li>EXCELLENT: 0.9 이상</li>
 *   <li>GOOD: 0.75 이상</li>
 *   <li>FAIR: 0.5 이상</li>
 *   <li>POOR: 그 미만</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public enum HealthBand {

    EXCELLENT("excellent"),
    GOOD("good"),
    FAIR("fair"),
    POOR("poor");

    private final String value;

    HealthBand(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * HEALTHY 비율로 등급 결정.
     *
     * @param healthyRatio 0.0 ~ 1.0
     * @return 등급
     */
    public static HealthBand fromHealthyRatio(double healthyRatio) {
        if (healthyRatio >= 0.9) {
            return EXCELLENT;
        }
        if (healthyRatio >= 0.75) {
            return GOOD;
        }
        if (healthyRatio >= 0.5) {
            return FAIR;
        }
        return POOR;
    }
}
