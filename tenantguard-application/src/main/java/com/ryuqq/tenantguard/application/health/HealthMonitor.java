package com.ryuqq.tenantguard.application.health;

import com.ryuqq.tenantguard.application.registry.TenantEntry;
import com.ryuqq.tenantguard.application.registry.TenantRegistry;
import com.ryuqq.tenantguard.core.exception.ErrorCategory;
import com.ryuqq.tenantguard.core.health.HealthBand;
import com.ryuqq.tenantguard.core.health.HealthMetrics;
import com.ryuqq.tenantguard.core.health.HealthMetricsSnapshot;
import com.ryuqq.tenantguard.core.health.HealthStatus;
import com.ryuqq.tenantguard.core.health.HealthSummary;
import com.ryuqq.tenantguard.core.health.HealthThresholds;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.retry.ErrorClassifier;
import com.ryuqq.tenantguard.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 테넌트 건강 상태 추적기.
 *
 * <p>호출 결과를 테넌트별 {@link HealthMetrics}에 기록하고 상태를 재평가합니다.
 * 상태가 바뀌면 info 레벨로 기록합니다.</p>
 *
 * <p>SUSPENDED는 {@link #suspend(TenantId, String)} / {@link #resume(TenantId)}로만 바뀝니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final TenantRegistry registry;
    private final HealthThresholds thresholds;
    private final ErrorClassifier classifier;
    private final Clock clock;

    public HealthMonitor(TenantRegistry registry, HealthThresholds thresholds, ErrorClassifier classifier, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds cannot be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * 성공 기록.
     *
     * @param tenantId 테넌트 ID
     * @param latencyMs 호출 지연 (밀리초)
     * @return 평가 후 상태
     */
    public HealthStatus recordSuccess(TenantId tenantId, double latencyMs) {
        HealthMetrics metrics = registry.entryFor(tenantId).getMetrics();
        HealthStatus before = metrics.getStatus();
        HealthStatus after = metrics.recordSuccess(latencyMs, clock.instant(), thresholds);
        logTransition(tenantId, before, after);
        return after;
    }

    /**
     * 실패 기록.
     *
     * @param tenantId 테넌트 ID
     * @param errorType 오류 종류
     * @param rateLimited 속도 제한 오류 여부
     * @return 평가 후 상태
     */
    public HealthStatus recordFailure(TenantId tenantId, String errorType, boolean rateLimited) {
        HealthMetrics metrics = registry.entryFor(tenantId).getMetrics();
        HealthStatus before = metrics.getStatus();
        HealthStatus after = metrics.recordFailure(errorType, rateLimited, clock.instant(), thresholds);
        logTransition(tenantId, before, after);
        return after;
    }

    /**
     * 예외를 분류하여 실패 기록.
     *
     * <p>오류 종류는 분류 이름(예: {@code transient_network})으로 기록됩니다.</p>
     *
     * @param tenantId 테넌트 ID
     * @param error 최종 오류
     * @return 평가 후 상태
     */
    public HealthStatus recordFailure(TenantId tenantId, Throwable error) {
        ErrorCategory category = classifier.classify(error);
        return recordFailure(tenantId, category.name().toLowerCase(Locale.ROOT),
            category == ErrorCategory.RATE_LIMITED);
    }

    public Optional<HealthMetricsSnapshot> getMetrics(TenantId tenantId) {
        return registry.find(tenantId).map(entry -> entry.getMetrics().snapshot());
    }

    /**
     * 모든 테넌트 지표 (테넌트 ID 순).
     *
     * @return 지표 목록
     */
    public List<HealthMetricsSnapshot> getAllMetrics() {
        List<HealthMetricsSnapshot> all = new ArrayList<>();
        for (TenantEntry entry : registry.entries()) {
            all.add(entry.getMetrics().snapshot());
        }
        all.sort(Comparator.comparing(HealthMetricsSnapshot::tenantId));
        return all;
    }

    /**
     * UNHEALTHY 또는 SUSPENDED 테넌트 목록.
     *
     * @return 지표 목록
     */
    public List<HealthMetricsSnapshot> getUnhealthyTenants() {
        List<HealthMetricsSnapshot> unhealthy = new ArrayList<>();
        for (HealthMetricsSnapshot snapshot : getAllMetrics()) {
            if (snapshot.status().isProblematic()) {
                unhealthy.add(snapshot);
            }
        }
        return unhealthy;
    }

    /**
     * 전체 요약.
     *
     * <p>평균 지연은 요청 이력이 있는 테넌트만으로 계산합니다. 테넌트가 없으면 HEALTHY 비율을 1.0으로 봅니다.</p>
     *
     * @return 요약
     */
    public HealthSummary getHealthSummary() {
        List<HealthMetricsSnapshot> all = getAllMetrics();
        Map<HealthStatus, Integer> counts = new EnumMap<>(HealthStatus.class);
        for (HealthStatus status : HealthStatus.values()) {
            counts.put(status, 0);
        }

        long totalRequests = 0;
        long failedRequests = 0;
        double latencySum = 0;
        int activeTenants = 0;
        for (HealthMetricsSnapshot snapshot : all) {
            counts.merge(snapshot.status(), 1, Integer::sum);
            totalRequests += snapshot.totalRequests();
            failedRequests += snapshot.failedRequests();
            if (snapshot.totalRequests() > 0) {
                latencySum += snapshot.avgLatencyMs();
                activeTenants++;
            }
        }

        double globalErrorRate = totalRequests == 0 ? 0.0 : (double) failedRequests / totalRequests;
        double averageLatency = activeTenants == 0 ? 0.0 : latencySum / activeTenants;
        double healthyRatio = all.isEmpty() ? 1.0 : (double) counts.get(HealthStatus.HEALTHY) / all.size();
        return new HealthSummary(all.size(), counts, globalErrorRate, averageLatency, healthyRatio,
            HealthBand.fromHealthyRatio(healthyRatio));
    }

    /**
     * 테넌트 정지 (관리자 조치).
     *
     * @param tenantId 테넌트 ID
     * @param reason 정지 사유
     */
    public void suspend(TenantId tenantId, String reason) {
        registry.entryFor(tenantId).getMetrics().suspend(reason, clock.instant());
        log.info("Tenant {} suspended: {}", tenantId.getValue(), reason);
    }

    /**
     * 정지 해제 후 누적 지표로 재평가.
     *
     * @param tenantId 테넌트 ID
     * @return 재평가된 상태 (추적 중이 아니면 empty)
     */
    public Optional<HealthStatus> resume(TenantId tenantId) {
        Optional<TenantEntry> entry = registry.find(tenantId);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        HealthStatus status = entry.get().getMetrics().resume(clock.instant(), thresholds);
        log.info("Tenant {} resumed with status {}", tenantId.getValue(), status);
        return Optional.of(status);
    }

    public HealthThresholds getThresholds() {
        return thresholds;
    }

    private static void logTransition(TenantId tenantId, HealthStatus before, HealthStatus after) {
        if (before != after) {
            log.info("Tenant {} health changed: {} -> {}", tenantId.getValue(), before, after);
        }
    }
}
