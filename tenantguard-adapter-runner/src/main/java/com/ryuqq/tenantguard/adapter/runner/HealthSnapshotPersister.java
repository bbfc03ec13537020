package com.ryuqq.tenantguard.adapter.runner;

import com.ryuqq.tenantguard.application.registry.TenantEntry;
import com.ryuqq.tenantguard.application.registry.TenantRegistry;
import com.ryuqq.tenantguard.core.health.HealthSnapshotRecord;
import com.ryuqq.tenantguard.core.model.TenantId;
import com.ryuqq.tenantguard.core.spi.MetricsStore;
import com.ryuqq.tenantguard.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 건강 스냅샷 저장/복원 서비스.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>주기적으로 모든 테넌트의 지표와 브레이커 상태를 {@link MetricsStore}에 저장</li>
 *   <li>보관 기간이 지난 스냅샷 삭제</li>
 *   <li>시작 시 테넌트별 최신 스냅샷으로 지표 복원</li>
 *   <li>테넌트 이력, 문제 상태 이력 조회</li>
 * </ul>
 *
 * <p>한 테넌트의 저장이 실패해도 나머지 테넌트는 계속 저장합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class HealthSnapshotPersister implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HealthSnapshotPersister.class);

    private final TenantRegistry registry;
    private final MetricsStore store;
    private final Clock clock;
    private final Duration retention;

    public HealthSnapshotPersister(TenantRegistry registry, MetricsStore store, Clock clock, Duration retention) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.retention = Objects.requireNonNull(retention, "retention cannot be null");
    }

    /**
     * 저장 후 보관 기간 정리.
     */
    @Override
    public void run() {
        persistAll();
        cleanupOld();
    }

    /**
     * 모든 테넌트 스냅샷 저장.
     *
     * @return 저장한 스냅샷 수
     */
    public int persistAll() {
        Instant now = clock.instant();
        int stored = 0;
        for (TenantEntry entry : registry.entries()) {
            try {
                store.storeSnapshot(new HealthSnapshotRecord(
                    entry.getTenantId(),
                    now,
                    entry.getMetrics().snapshot(),
                    entry.getBreaker().getState()
                ));
                stored++;
            } catch (RuntimeException e) {
                log.error("Failed to persist health snapshot for tenant {}", entry.getTenantId().getValue(), e);
            }
        }
        log.debug("Persisted {} health snapshots", stored);
        return stored;
    }

    /**
     * 보관 기간이 지난 스냅샷 삭제.
     *
     * @return 삭제한 스냅샷 수
     */
    public int cleanupOld() {
        int deleted = store.deleteOlderThan(clock.instant().minus(retention));
        if (deleted > 0) {
            log.info("Deleted {} health snapshots older than {}", deleted, retention);
        }
        return deleted;
    }

    /**
     * 테넌트별 최신 스냅샷으로 지표 복원.
     *
     * <p>이미 요청을 기록한 테넌트는 건너뜁니다.</p>
     *
     * @return 복원한 테넌트 수
     */
    public int restoreLatest() {
        int restored = 0;
        for (HealthSnapshotRecord record : store.loadLatest()) {
            if (registry.restore(record.metrics())) {
                restored++;
            }
        }
        log.info("Restored health metrics for {} tenants", restored);
        return restored;
    }

    /**
     * 테넌트 스냅샷 이력.
     *
     * @param tenantId 테넌트 ID
     * @param since 시작 시각 (포함)
     * @return 시간 오름차순 이력
     */
    public List<HealthSnapshotRecord> history(TenantId tenantId, Instant since) {
        return store.loadHistory(tenantId, since);
    }

    /**
     * UNHEALTHY/SUSPENDED 스냅샷 이력.
     *
     * @param since 시작 시각 (포함)
     * @return 시간 오름차순 이력
     */
    public List<HealthSnapshotRecord> unhealthyHistory(Instant since) {
        return store.loadUnhealthySince(since);
    }
}
