package com.ryuqq.tenantguard.core.health;

import com.ryuqq.tenantguard.core.model.TenantId;

import java.time.Instant;
import java.util.Objects;

/**
 * 테넌트 하나의 누적 건강 지표.
 *
 * <p>모든 갱신과 조회는 인스턴스 모니터로 보호되므로 테넌트 단위 원자성을 가집니다.</p>
 *
 * <p><strong>상태 평가 규칙</strong> (SUSPENDED이면 평가하지 않음):</p>
 * <ol>
 *   <li>연속 실패 ≥ maxConsecutiveFailures → UNHEALTHY</li>
 *   <li>오류율 ≥ critical → UNHEALTHY, ≥ warning → DEGRADED</li>
 *   <li>평균 지연 ≥ critical → DEGRADED, ≥ warning → DEGRADED (현재 UNHEALTHY면 유지)</li>
 *   <li>그 외 → HEALTHY</li>
 * </ol>
 *
 * <p>평균 지연은 EMA({@code new = α * sample + (1 - α) * old})이며, 첫 샘플은 그대로 사용합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class HealthMetrics {

    private final TenantId tenantId;

    private HealthStatus status = HealthStatus.HEALTHY;
    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private int consecutiveFailures;
    private double avgLatencyMs;
    private boolean latencySampled;
    private Instant lastSuccess;
    private Instant lastFailure;
    private Instant lastCheck;
    private boolean rateLimited;
    private String lastErrorType;
    private String suspendedReason;
    private Instant suspendedAt;

    public HealthMetrics(TenantId tenantId) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId cannot be null");
    }

    /**
     * 저장된 스냅샷으로 지표 복원.
     *
     * @param snapshot 마지막으로 저장된 스냅샷
     * @return 복원된 지표
     */
    public static HealthMetrics restore(HealthMetricsSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        HealthMetrics metrics = new HealthMetrics(snapshot.tenantId());
        metrics.status = snapshot.status();
        metrics.totalRequests = snapshot.totalRequests();
        metrics.successfulRequests = snapshot.successfulRequests();
        metrics.failedRequests = snapshot.failedRequests();
        metrics.consecutiveFailures = snapshot.consecutiveFailures();
        metrics.avgLatencyMs = snapshot.avgLatencyMs();
        metrics.latencySampled = snapshot.successfulRequests() > 0;
        metrics.lastSuccess = snapshot.lastSuccess();
        metrics.lastFailure = snapshot.lastFailure();
        metrics.lastCheck = snapshot.lastCheck();
        metrics.rateLimited = snapshot.rateLimited();
        metrics.lastErrorType = snapshot.lastErrorType();
        metrics.suspendedReason = snapshot.suspendedReason();
        metrics.suspendedAt = snapshot.suspendedAt();
        return metrics;
    }

    /**
     * 성공 기록.
     *
     * @param latencyMs 호출 지연 (밀리초)
     * @param now 현재 시각
     * @param thresholds 평가 임계값
     * @return 평가 후 상태
     */
    public synchronized HealthStatus recordSuccess(double latencyMs, Instant now, HealthThresholds thresholds) {
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs must be non-negative (current: " + latencyMs + ")");
        }
        totalRequests++;
        successfulRequests++;
        consecutiveFailures = 0;
        rateLimited = false;
        if (latencySampled) {
            double alpha = thresholds.latencyEmaAlpha();
            avgLatencyMs = alpha * latencyMs + (1 - alpha) * avgLatencyMs;
        } else {
            avgLatencyMs = latencyMs;
            latencySampled = true;
        }
        lastSuccess = now;
        lastCheck = now;
        return evaluate(thresholds);
    }

    /**
     * 실패 기록.
     *
     * @param errorType 오류 종류 (예: 분류 이름 또는 예외 클래스 이름)
     * @param rateLimitedError 속도 제한 오류이면 true
     * @param now 현재 시각
     * @param thresholds 평가 임계값
     * @return 평가 후 상태
     */
    public synchronized HealthStatus recordFailure(
        String errorType,
        boolean rateLimitedError,
        Instant now,
        HealthThresholds thresholds
    ) {
        totalRequests++;
        failedRequests++;
        consecutiveFailures++;
        lastErrorType = errorType;
        if (rateLimitedError) {
            rateLimited = true;
        }
        lastFailure = now;
        lastCheck = now;
        return evaluate(thresholds);
    }

    /**
     * 현재 지표로 상태 재평가.
     *
     * @param thresholds 평가 임계값
     * @return 평가 후 상태 (SUSPENDED면 그대로)
     */
    public synchronized HealthStatus evaluate(HealthThresholds thresholds) {
        Objects.requireNonNull(thresholds, "thresholds cannot be null");
        if (status == HealthStatus.SUSPENDED) {
            return status;
        }

        double errorRate = errorRate();
        HealthStatus next;
        if (consecutiveFailures >= thresholds.maxConsecutiveFailures()) {
            next = HealthStatus.UNHEALTHY;
        } else if (errorRate >= thresholds.criticalErrorRate()) {
            next = HealthStatus.UNHEALTHY;
        } else if (errorRate >= thresholds.warningErrorRate()) {
            next = HealthStatus.DEGRADED;
        } else if (avgLatencyMs >= thresholds.criticalLatencyMs()) {
            next = HealthStatus.DEGRADED;
        } else if (avgLatencyMs >= thresholds.warningLatencyMs()) {
            next = status == HealthStatus.UNHEALTHY ? HealthStatus.UNHEALTHY : HealthStatus.DEGRADED;
        } else {
            next = HealthStatus.HEALTHY;
        }
        status = next;
        return next;
    }

    /**
     * 관리자 정지.
     *
     * @param reason 정지 사유
     * @param now 현재 시각
     */
    public synchronized void suspend(String reason, Instant now) {
        status = HealthStatus.SUSPENDED;
        suspendedReason = reason;
        suspendedAt = now;
        lastCheck = now;
    }

    /**
     * 정지 해제 후 누적 지표로 재평가.
     *
     * @param now 현재 시각
     * @param thresholds 평가 임계값
     * @return 재평가된 상태
     */
    public synchronized HealthStatus resume(Instant now, HealthThresholds thresholds) {
        status = HealthStatus.HEALTHY;
        suspendedReason = null;
        suspendedAt = null;
        lastCheck = now;
        return evaluate(thresholds);
    }

    public synchronized HealthStatus getStatus() {
        return status;
    }

    public synchronized double errorRate() {
        return totalRequests == 0 ? 0.0 : (double) failedRequests / totalRequests;
    }

    public TenantId getTenantId() {
        return tenantId;
    }

    public synchronized HealthMetricsSnapshot snapshot() {
        return new HealthMetricsSnapshot(
            tenantId,
            status,
            totalRequests,
            successfulRequests,
            failedRequests,
            consecutiveFailures,
            errorRate(),
            avgLatencyMs,
            lastSuccess,
            lastFailure,
            lastCheck,
            rateLimited,
            lastErrorType,
            suspendedReason,
            suspendedAt
        );
    }
}
