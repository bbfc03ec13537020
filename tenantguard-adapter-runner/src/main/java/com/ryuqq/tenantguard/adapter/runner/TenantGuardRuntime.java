package com.ryuqq.tenantguard.adapter.runner;

import com.ryuqq.tenantguard.application.guard.TenantGuard;
import com.ryuqq.tenantguard.core.spi.MetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * TenantGuard와 백그라운드 정리 작업의 생명주기 관리.
 *
 * <p><strong>start():</strong></p>
 * <pre>
 * 1. 최신 건강 스냅샷 복원
 * 2. 세션 회수 / 유휴 정리 / 스냅샷 저장 작업 등록
 * </pre>
 *
 * <p><strong>close():</strong> 작업을 모두 취소하고 종료를 기다린 뒤 TenantGuard를 닫습니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class TenantGuardRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TenantGuardRuntime.class);

    private static final int MAINTENANCE_THREADS = 2;

    private final TenantGuard guard;
    private final MaintenanceConfig config;
    private final MaintenanceScheduler scheduler;
    private final StaleSessionReaper sessionReaper;
    private final IdleResourceReaper idleReaper;
    private final HealthSnapshotPersister persister;
    private boolean started;

    public TenantGuardRuntime(TenantGuard guard, MetricsStore metricsStore, MaintenanceConfig config) {
        this.guard = Objects.requireNonNull(guard, "guard cannot be null");
        Objects.requireNonNull(metricsStore, "metricsStore cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.scheduler = new MaintenanceScheduler(MAINTENANCE_THREADS, config.shutdownTimeoutMs());
        this.sessionReaper = new StaleSessionReaper(guard.sessionPool());
        this.idleReaper = new IdleResourceReaper(guard.rateLimiter(), guard.registry(),
            Duration.ofMillis(guard.config().tenantIdleTtlMs()));
        this.persister = new HealthSnapshotPersister(guard.registry(), metricsStore, guard.clock(),
            Duration.ofMillis(config.snapshotRetentionMs()));
    }

    /**
     * 스냅샷 복원 후 주기 작업 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("TenantGuardRuntime already started");
        }
        started = true;
        persister.restoreLatest();
        scheduler.schedule("stale-session-sweep", Duration.ofMillis(config.sessionSweepIntervalMs()), sessionReaper);
        scheduler.schedule("idle-resource-sweep", Duration.ofMillis(config.idleSweepIntervalMs()), idleReaper);
        scheduler.schedule("health-snapshot", Duration.ofMillis(config.healthSnapshotIntervalMs()), persister);
        log.info("TenantGuard runtime started");
    }

    public TenantGuard guard() {
        return guard;
    }

    public MaintenanceScheduler scheduler() {
        return scheduler;
    }

    public HealthSnapshotPersister persister() {
        return persister;
    }

    @Override
    public synchronized void close() {
        scheduler.shutdown();
        guard.close();
        log.info("TenantGuard runtime stopped");
    }
}
