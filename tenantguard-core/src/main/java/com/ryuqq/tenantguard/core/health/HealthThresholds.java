package com.ryuqq.tenantguard.core.health;

/**
 * 건강 상태 평가 임계값.
 *
 * @param maxConsecutiveFailures 이 횟수 이상 연속 실패하면 UNHEALTHY
 * @param warningErrorRate 이 오류율 이상이면 DEGRADED
 * @param criticalErrorRate 이 오류율 이상이면 UNHEALTHY
 * @param warningLatencyMs 이 평균 지연 이상이면 DEGRADED (UNHEALTHY 상태는 유지)
 * @param criticalLatencyMs 이 평균 지연 이상이면 DEGRADED
 * @param latencyEmaAlpha 평균 지연 EMA 가중치 (0 초과 1 이하)
 * @author TenantGuard Team
 * @since 1.0.0
 */
public record HealthThresholds(
    int maxConsecutiveFailures,
    double warningErrorRate,
    double criticalErrorRate,
    double warningLatencyMs,
    double criticalLatencyMs,
    double latencyEmaAlpha
) {

    public HealthThresholds {
        if (maxConsecutiveFailures <= 0) {
            throw new IllegalArgumentException(
                "maxConsecutiveFailures must be positive (current: " + maxConsecutiveFailures + ")"
            );
        }
        if (!(warningErrorRate > 0 && warningErrorRate <= criticalErrorRate && criticalErrorRate <= 1.0)) {
            throw new IllegalArgumentException(
                "error rate thresholds must satisfy 0 < warning <= critical <= 1 (warning: "
                    + warningErrorRate + ", critical: " + criticalErrorRate + ")"
            );
        }
        if (!(warningLatencyMs > 0 && warningLatencyMs <= criticalLatencyMs)) {
            throw new IllegalArgumentException(
                "latency thresholds must satisfy 0 < warning <= critical (warning: "
                    + warningLatencyMs + ", critical: " + criticalLatencyMs + ")"
            );
        }
        if (!(latencyEmaAlpha > 0 && latencyEmaAlpha <= 1.0)) {
            throw new IllegalArgumentException(
                "latencyEmaAlpha must be in (0, 1] (current: " + latencyEmaAlpha + ")"
            );
        }
    }

    public HealthThresholds withMaxConsecutiveFailures(int maxConsecutiveFailures) {
        return new HealthThresholds(maxConsecutiveFailures, warningErrorRate, criticalErrorRate,
            warningLatencyMs, criticalLatencyMs, latencyEmaAlpha);
    }

    public HealthThresholds withErrorRates(double warningErrorRate, double criticalErrorRate) {
        return new HealthThresholds(maxConsecutiveFailures, warningErrorRate, criticalErrorRate,
            warningLatencyMs, criticalLatencyMs, latencyEmaAlpha);
    }

    public HealthThresholds withLatencies(double warningLatencyMs, double criticalLatencyMs) {
        return new HealthThresholds(maxConsecutiveFailures, warningErrorRate, criticalErrorRate,
            warningLatencyMs, criticalLatencyMs, latencyEmaAlpha);
    }
}
