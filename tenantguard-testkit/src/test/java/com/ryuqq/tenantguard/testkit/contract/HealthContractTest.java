package com.ryuqq.tenantguard.testkit.contract;

import com.ryuqq.tenantguard.adapter.runner.HealthSnapshotPersister;
import com.ryuqq.tenantguard.application.guard.TenantGuard;
import com.ryuqq.tenantguard.core.health.HealthBand;
import com.ryuqq.tenantguard.core.health.HealthMetricsSnapshot;
import com.ryuqq.tenantguard.core.health.HealthSnapshotRecord;
import com.ryuqq.tenantguard.core.health.HealthStatus;
import com.ryuqq.tenantguard.core.health.HealthSummary;
import com.ryuqq.tenantguard.core.model.TenantId;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Health Contract Tests.
 *
 * <p>Baseline thresholds: 5 consecutive failures, warning 20% / critical 50% error rate.</p>
 * <ul>
 *   <li>Error rate and consecutive failures drive the status</li>
 *   <li>Suspension overrides evaluation until resumed</li>
 *   <li>Snapshots survive a restart through the metrics store</li>
 * </ul>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
class HealthContractTest extends AbstractContractTest {

    // ============================================================
    // Evaluation
    // ============================================================

    @Test
    void testHealth_SixFailuresOfTen_UnhealthyAndStaysUnhealthyAfterSuccess() {
        // Given: S F F S F F S F F S (never 5 in a row)
        TenantId tenant = tenant("bot-sick");
        recordPattern(tenant, "SFFSFFSFFS");
        assertHealthStatus(tenant, HealthStatus.UNHEALTHY);

        // When
        HealthStatus status = guard.healthMonitor().recordSuccess(tenant, 120.0);

        // Then: 6 / 11 = 0.545 is still above the critical rate
        HealthMetricsSnapshot metrics = guard.healthMonitor().getMetrics(tenant).orElseThrow();
        assertEquals(HealthStatus.UNHEALTHY, status);
        assertEquals(0, metrics.consecutiveFailures());
        assertEquals(11, metrics.totalRequests());
        assertApproximately(6.0 / 11.0, metrics.errorRate(), 1e-9);
    }

    @Test
    void testHealth_FiveConsecutiveFailures_Unhealthy() {
        // Given
        TenantId tenant = tenant("bot-streak");
        recordPattern(tenant, "SSSSSSSSSSSSSSSSSSSS");

        // When
        recordPattern(tenant, "FFFFF");

        // Then: error rate 0.2 alone would only be DEGRADED
        assertHealthStatus(tenant, HealthStatus.UNHEALTHY);
    }

    @Test
    void testHealth_ModerateErrorRate_Degraded() {
        // Given / When: 3 failures of 10
        TenantId tenant = tenant("bot-wobbly");
        recordPattern(tenant, "SSFSSFSSFS");

        // Then
        assertHealthStatus(tenant, HealthStatus.DEGRADED);
    }

    // ============================================================
    // Suspension
    // ============================================================

    @Test
    void testSuspend_IgnoresTrafficUntilResumed() {
        // Given
        TenantId tenant = tenant("bot-abuse");
        recordPattern(tenant, "SSSS");
        guard.admin().suspend(tenant, "spam reports");

        // When
        guard.healthMonitor().recordSuccess(tenant, 50.0);

        // Then
        assertHealthStatus(tenant, HealthStatus.SUSPENDED);
        assertEquals("spam reports", guard.healthMonitor().getMetrics(tenant).orElseThrow().suspendedReason());
        assertEquals(1, guard.admin().getUnhealthyTenants().size());

        Optional<HealthStatus> resumed = guard.admin().resume(tenant);
        assertEquals(Optional.of(HealthStatus.HEALTHY), resumed);
        assertNull(guard.healthMonitor().getMetrics(tenant).orElseThrow().suspendedReason());
    }

    // ============================================================
    // Summary
    // ============================================================

    @Test
    void testSummary_NoTenants_ExcellentBand() {
        // When
        HealthSummary summary = guard.admin().getHealthSummary();

        // Then
        assertEquals(0, summary.totalTenants());
        assertEquals(1.0, summary.healthyRatio());
        assertEquals(HealthBand.EXCELLENT, summary.band());
    }

    @Test
    void testSummary_MixedTenants_CountsPerStatus() {
        // Given
        recordPattern(tenant("bot-a"), "SSSS");
        recordPattern(tenant("bot-b"), "SSSS");
        recordPattern(tenant("bot-c"), "FFFFF");

        // When
        HealthSummary summary = guard.admin().getHealthSummary();

        // Then
        assertEquals(3, summary.totalTenants());
        assertEquals(2, summary.count(HealthStatus.HEALTHY));
        assertEquals(1, summary.count(HealthStatus.UNHEALTHY));
        assertApproximately(2.0 / 3.0, summary.healthyRatio(), 1e-9);
        assertApproximately(5.0 / 13.0, summary.globalErrorRate(), 1e-9);
    }

    // ============================================================
    // Persistence and Recovery
    // ============================================================

    @Test
    void testSnapshots_PersistedAndRestoredIntoFreshGuard() {
        // Given
        TenantId tenant = tenant("bot-persist");
        recordPattern(tenant, "SFFSFFSFFS");
        HealthSnapshotPersister persister = new HealthSnapshotPersister(
            guard.registry(), metricsStore, clock, Duration.ofDays(7));
        assertEquals(1, persister.persistAll());

        // When
        try (TenantGuard restarted = TenantGuard.builder(baseConfig())
            .bucketStore(bucketStore)
            .clock(clock)
            .sleeper(clock)
            .build()) {
            HealthSnapshotPersister restoring = new HealthSnapshotPersister(
                restarted.registry(), metricsStore, clock, Duration.ofDays(7));
            int restored = restoring.restoreLatest();

            // Then
            assertEquals(1, restored);
            HealthMetricsSnapshot metrics = restarted.healthMonitor().getMetrics(tenant).orElseThrow();
            assertEquals(HealthStatus.UNHEALTHY, metrics.status());
            assertEquals(10, metrics.totalRequests());
            assertEquals(6, metrics.failedRequests());
        }
    }

    @Test
    void testSnapshots_RetentionRemovesOldHistory() {
        // Given
        TenantId tenant = tenant("bot-history");
        recordPattern(tenant, "FFFFF");
        HealthSnapshotPersister persister = new HealthSnapshotPersister(
            guard.registry(), metricsStore, clock, Duration.ofHours(1));
        Instant start = clock.instant();
        persister.persistAll();
        clock.advance(Duration.ofMinutes(40));
        persister.persistAll();

        // When
        clock.advance(Duration.ofMinutes(30));
        int deleted = persister.cleanupOld();

        // Then
        assertEquals(1, deleted);
        List<HealthSnapshotRecord> history = persister.history(tenant, start);
        assertEquals(1, history.size());
        assertEquals(start.plus(Duration.ofMinutes(40)), history.get(0).timestamp());
        assertEquals(1, persister.unhealthyHistory(start).size());
    }

    private void recordPattern(TenantId tenant, String pattern) {
        for (char outcome : pattern.toCharArray()) {
            if (outcome == 'S') {
                guard.healthMonitor().recordSuccess(tenant, 100.0);
            } else {
                guard.healthMonitor().recordFailure(tenant, "transient_network", false);
            }
        }
    }
}
